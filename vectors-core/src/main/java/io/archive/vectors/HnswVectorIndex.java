package io.archive.vectors;

import com.github.jelmerk.hnswlib.core.DistanceFunctions;
import com.github.jelmerk.hnswlib.core.Item;
import com.github.jelmerk.hnswlib.core.hnsw.HnswIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * HNSW-based implementation of VectorIndex for approximate nearest neighbor search.
 *
 * <p>Uses the Hierarchical Navigable Small World (HNSW) algorithm which provides
 * O(log n) search complexity instead of O(n) brute-force search. Needs no training
 * but keeps raw vectors and the graph in memory.</p>
 *
 * <p>hnswlib reports inner-product distance ({@code 1 - dot}); scores are
 * passed through unchanged as {@link ScoreKind#DISTANCE}.</p>
 */
public class HnswVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(HnswVectorIndex.class);

    // Format constants
    static final byte[] MAGIC = "AVHN".getBytes(StandardCharsets.US_ASCII);
    private static final short FORMAT_VERSION = 1;

    private final IndexConfig config;
    private final HnswIndex<Long, float[], VectorItem, Float> hnswIndex;
    private long total;

    public HnswVectorIndex(IndexConfig config) {
        this(config, HnswIndex.newBuilder(
                config.dimensions(),
                DistanceFunctions.FLOAT_INNER_PRODUCT,
                config.hnswMaxItems()
            )
            .withM(config.hnswM())
            .withEfConstruction(config.hnswEfConstruction())
            .withEf(config.hnswEfSearch())
            .build(), 0);

        log.info("Created HNSW index: dims={}, maxItems={}", config.dimensions(), config.hnswMaxItems());
    }

    private HnswVectorIndex(IndexConfig config, HnswIndex<Long, float[], VectorItem, Float> hnswIndex, long total) {
        this.config = config;
        this.hnswIndex = hnswIndex;
        this.total = total;
    }

    // ==================== Build ====================

    @Override
    public void train(float[][] sample) {
        // Graph construction is incremental
    }

    @Override
    public boolean isTrained() {
        return true;
    }

    @Override
    public long add(float[][] batch) {
        if (total + batch.length > hnswIndex.getMaxItemCount()) {
            throw new IllegalStateException(String.format(
                "HNSW index capacity exceeded: %d + %d > %d",
                total, batch.length, hnswIndex.getMaxItemCount()));
        }

        long firstId = total;
        List<VectorItem> items = new ArrayList<>(batch.length);
        for (int i = 0; i < batch.length; i++) {
            float[] embedding = batch[i];
            if (embedding.length != config.dimensions()) {
                throw new IllegalArgumentException(String.format(
                    "Embedding dimension mismatch: expected %d, got %d",
                    config.dimensions(), embedding.length
                ));
            }
            items.add(new VectorItem(firstId + i, embedding.clone()));
        }

        // Batch add to HNSW (more efficient than individual adds)
        try {
            hnswIndex.addAll(items);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while adding items to HNSW index", e);
        }
        total += items.size();
        log.debug("Batch added {} vectors to HNSW index", items.size());
        return firstId;
    }

    // ==================== Search ====================

    @Override
    public List<Neighbor> search(float[] query, int k) {
        if (total == 0) {
            return List.of();
        }

        return hnswIndex.findNearest(query, k).stream()
            .map(r -> new Neighbor(r.item().id(), r.distance()))
            .collect(Collectors.toList());
    }

    @Override
    public ScoreKind scoreKind() {
        return ScoreKind.DISTANCE;
    }

    // ==================== Persistence ====================

    @Override
    public void save(OutputStream os) throws IOException {
        DataOutputStream dos = new DataOutputStream(new BufferedOutputStream(os));

        // Write header
        dos.write(MAGIC);
        dos.writeShort(FORMAT_VERSION);
        dos.writeInt(config.dimensions());
        dos.writeLong(total);
        dos.writeUTF(config.modelId());

        // Write HNSW index
        ByteArrayOutputStream hnswBytes = new ByteArrayOutputStream();
        hnswIndex.save(hnswBytes);
        byte[] hnswData = hnswBytes.toByteArray();
        dos.writeInt(hnswData.length);
        dos.write(hnswData);

        dos.flush();
        log.info("Saved HNSW index: {} vectors, {} bytes HNSW data", total, hnswData.length);
    }

    public static HnswVectorIndex loadFrom(InputStream is) throws IOException {
        DataInputStream dis = new DataInputStream(new BufferedInputStream(is));

        // Read and verify header
        byte[] magic = new byte[4];
        dis.readFully(magic);
        if (!Arrays.equals(magic, MAGIC)) {
            throw new IOException("Invalid file format: not an HNSW index (magic: " + new String(magic) + ")");
        }

        short version = dis.readShort();
        if (version != FORMAT_VERSION) {
            throw new UnsupportedFormatException(version);
        }

        int dimensions = dis.readInt();
        long total = dis.readLong();
        String modelId = dis.readUTF();

        // Read HNSW index
        int hnswDataLength = dis.readInt();
        byte[] hnswData = new byte[hnswDataLength];
        dis.readFully(hnswData);

        HnswIndex<Long, float[], VectorItem, Float> graph = HnswIndex.load(new ByteArrayInputStream(hnswData));
        IndexConfig config = IndexConfig.forModel(modelId, dimensions)
            .withHnswMaxItems(graph.getMaxItemCount());

        log.info("Loaded HNSW index: {} vectors", total);
        return new HnswVectorIndex(config, graph, total);
    }

    // ==================== Metadata ====================

    @Override
    public IndexMode mode() {
        return IndexMode.GRAPH;
    }

    @Override
    public String getModelId() {
        return config.modelId();
    }

    @Override
    public int getDimensions() {
        return config.dimensions();
    }

    @Override
    public long size() {
        return total;
    }

    @Override
    public IndexStats getStats() {
        long vectorBytes = total * config.dimensions() * Float.BYTES;
        long graphOverhead = total * config.hnswM() * 8L; // Approximate graph overhead
        return new IndexStats(mode(), total, config.modelId(), config.dimensions(), true, 0,
            vectorBytes + graphOverhead);
    }

    @Override
    public void close() {
        // HNSW index doesn't need explicit closing
    }

    // ==================== HNSW Item Implementation ====================

    /**
     * Item wrapper for HNSW index.
     */
    private static class VectorItem implements Item<Long, float[]>, Serializable {
        private static final long serialVersionUID = 1L;

        private final Long id;
        private final float[] vector;

        VectorItem(long id, float[] vector) {
            this.id = id;
            this.vector = vector;
        }

        @Override
        public Long id() {
            return id;
        }

        @Override
        public float[] vector() {
            return vector;
        }

        @Override
        public int dimensions() {
            return vector.length;
        }
    }
}
