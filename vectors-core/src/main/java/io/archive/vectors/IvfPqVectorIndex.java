package io.archive.vectors;

import io.archive.vectors.quantize.KMeans;
import io.archive.vectors.quantize.ProductQuantizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Compressed index: inverted file over k-means clusters with product-quantized
 * residuals.
 *
 * <p>Each vector is stored as its id plus {@code m} bytes, so memory grows with
 * the code size rather than the raw vector width. Queries scan only the
 * {@code nprobe} clusters whose centroids are closest to the query, which makes
 * results approximate: probing more clusters trades latency for recall.</p>
 *
 * <p>Scores are approximate inner products ({@code q·centroid + q·decodedResidual}).</p>
 */
public class IvfPqVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(IvfPqVectorIndex.class);

    // Format constants
    static final byte[] MAGIC = "AVIQ".getBytes(StandardCharsets.US_ASCII);
    private static final short FORMAT_VERSION = 1;

    private final IndexConfig config;
    private volatile int nprobe;

    private float[][] centroids;
    private ProductQuantizer quantizer;
    private InvertedList[] lists;
    private long total;

    public IvfPqVectorIndex(IndexConfig config) {
        this.config = config;
        this.nprobe = config.nprobe();
    }

    /**
     * Sets how many clusters each search visits.
     */
    public void setNprobe(int nprobe) {
        if (nprobe < 1) throw new IllegalArgumentException("nprobe must be >= 1");
        this.nprobe = nprobe;
    }

    public int getClusterCount() {
        return centroids == null ? 0 : centroids.length;
    }

    // ==================== Build ====================

    @Override
    public void train(float[][] sample) {
        if (sample == null || sample.length == 0) {
            throw new TrainingException("Cannot train a compressed index on an empty sample");
        }
        for (float[] vector : sample) {
            checkDimensions(vector);
        }

        int clusters = config.clustersFor(sample.length);
        log.info("Training IVF+PQ on {} samples: {} clusters, {} sub-quantizers requested",
            sample.length, clusters, config.subQuantizers());

        float[][] learned = new KMeans(clusters, config.seed()).fit(sample);

        float[][] residuals = new float[sample.length][];
        for (int i = 0; i < sample.length; i++) {
            residuals[i] = residual(sample[i], learned[KMeans.nearest(learned, sample[i])]);
        }
        ProductQuantizer pq = ProductQuantizer.train(residuals, config.subQuantizers(), config.seed());

        this.centroids = learned;
        this.quantizer = pq;
        this.lists = new InvertedList[learned.length];
        for (int c = 0; c < learned.length; c++) {
            lists[c] = new InvertedList(pq.codeSize());
        }
        this.total = 0;

        log.info("Trained with {} clusters, {} bytes per code", learned.length, pq.codeSize());
    }

    @Override
    public boolean isTrained() {
        return centroids != null;
    }

    @Override
    public long add(float[][] batch) {
        if (!isTrained()) {
            throw new IllegalStateException("Compressed index must be trained before adding vectors");
        }
        for (float[] vector : batch) {
            checkDimensions(vector);
        }

        long firstId = total;
        for (float[] vector : batch) {
            int list = KMeans.nearest(centroids, vector);
            byte[] code = quantizer.encode(residual(vector, centroids[list]));
            lists[list].append(total, code);
            total++;
        }
        log.debug("Added {} vectors (first id={})", batch.length, firstId);
        return firstId;
    }

    // ==================== Search ====================

    @Override
    public List<Neighbor> search(float[] query, int k) {
        if (total == 0) {
            return List.of();
        }
        checkDimensions(query);

        float[] centroidScores = new float[centroids.length];
        for (int c = 0; c < centroids.length; c++) {
            centroidScores[c] = VectorMath.dot(query, centroids[c]);
        }
        int[] probes = closestLists(query, Math.min(nprobe, centroids.length));
        float[][] table = quantizer.innerProductTable(query);

        TopK top = new TopK(k);
        for (int list : probes) {
            InvertedList inverted = lists[list];
            float base = centroidScores[list];
            for (int i = 0; i < inverted.size; i++) {
                float score = base + quantizer.score(table, inverted.codes, i * inverted.codeSize);
                top.offer(inverted.ids[i], score);
            }
        }
        return top.toList();
    }

    @Override
    public ScoreKind scoreKind() {
        return ScoreKind.SIMILARITY;
    }

    private int[] closestLists(float[] query, int count) {
        float[] distances = new float[centroids.length];
        for (int c = 0; c < centroids.length; c++) {
            distances[c] = VectorMath.squaredDistance(query, centroids[c]);
        }
        return IntStream.range(0, centroids.length)
            .boxed()
            .sorted(Comparator.comparingDouble(c -> distances[c]))
            .limit(count)
            .mapToInt(Integer::intValue)
            .toArray();
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
        dos.writeInt(nprobe);
        dos.writeBoolean(isTrained());

        if (isTrained()) {
            // Coarse quantizer
            dos.writeInt(centroids.length);
            for (float[] centroid : centroids) {
                for (float v : centroid) {
                    dos.writeFloat(v);
                }
            }

            quantizer.writeTo(dos);

            // Inverted lists
            for (InvertedList list : lists) {
                dos.writeInt(list.size);
                for (int i = 0; i < list.size; i++) {
                    dos.writeLong(list.ids[i]);
                }
                dos.write(list.codes, 0, list.size * list.codeSize);
            }
        }

        dos.flush();
        log.info("Saved IVF+PQ index: {} vectors in {} clusters", total, getClusterCount());
    }

    public static IvfPqVectorIndex loadFrom(InputStream is) throws IOException {
        DataInputStream dis = new DataInputStream(new BufferedInputStream(is));

        // Read and verify header
        byte[] magic = new byte[4];
        dis.readFully(magic);
        if (!Arrays.equals(magic, MAGIC)) {
            throw new IOException("Invalid file format: not an IVF+PQ index (magic: " + new String(magic) + ")");
        }

        short version = dis.readShort();
        if (version != FORMAT_VERSION) {
            throw new UnsupportedFormatException(version);
        }

        int dimensions = dis.readInt();
        long total = dis.readLong();
        String modelId = dis.readUTF();
        int nprobe = dis.readInt();
        boolean trained = dis.readBoolean();

        IvfPqVectorIndex index = new IvfPqVectorIndex(IndexConfig.forModel(modelId, dimensions).withNprobe(nprobe));
        if (!trained) {
            return index;
        }

        int clusters = dis.readInt();
        float[][] centroids = new float[clusters][dimensions];
        for (int c = 0; c < clusters; c++) {
            for (int d = 0; d < dimensions; d++) {
                centroids[c][d] = dis.readFloat();
            }
        }

        ProductQuantizer quantizer = ProductQuantizer.readFrom(dis);

        InvertedList[] lists = new InvertedList[clusters];
        long counted = 0;
        for (int c = 0; c < clusters; c++) {
            int size = dis.readInt();
            InvertedList list = new InvertedList(quantizer.codeSize(), size);
            for (int i = 0; i < size; i++) {
                list.ids[i] = dis.readLong();
            }
            dis.readFully(list.codes, 0, size * quantizer.codeSize());
            list.size = size;
            lists[c] = list;
            counted += size;
        }
        if (counted != total) {
            throw new IOException(String.format(
                "Corrupt IVF+PQ index: header says %d vectors, lists hold %d", total, counted));
        }

        index.centroids = centroids;
        index.quantizer = quantizer;
        index.lists = lists;
        index.total = total;

        log.info("Loaded IVF+PQ index: {} vectors in {} clusters (nprobe={})", total, clusters, nprobe);
        return index;
    }

    // ==================== Metadata ====================

    @Override
    public IndexMode mode() {
        return IndexMode.COMPRESSED;
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
        long codeBytes = isTrained() ? total * (quantizer.codeSize() + Long.BYTES) : 0;
        long centroidBytes = (long) getClusterCount() * config.dimensions() * Float.BYTES;
        return new IndexStats(mode(), total, config.modelId(), config.dimensions(), isTrained(),
            getClusterCount(), codeBytes + centroidBytes);
    }

    @Override
    public void close() {
        // Nothing to release
    }

    // ==================== Helper Methods ====================

    private void checkDimensions(float[] vector) {
        if (vector.length != config.dimensions()) {
            throw new IllegalArgumentException(String.format(
                "Embedding dimension mismatch: expected %d, got %d",
                config.dimensions(), vector.length
            ));
        }
    }

    private static float[] residual(float[] vector, float[] centroid) {
        float[] residual = new float[vector.length];
        for (int i = 0; i < vector.length; i++) {
            residual[i] = vector[i] - centroid[i];
        }
        return residual;
    }

    /**
     * Growable id + packed code storage for one cluster.
     */
    private static final class InvertedList {
        private final int codeSize;
        private long[] ids;
        private byte[] codes;
        private int size;

        InvertedList(int codeSize) {
            this(codeSize, 16);
        }

        InvertedList(int codeSize, int capacity) {
            this.codeSize = codeSize;
            this.ids = new long[Math.max(1, capacity)];
            this.codes = new byte[Math.max(1, capacity) * codeSize];
        }

        void append(long id, byte[] code) {
            if (size == ids.length) {
                int capacity = ids.length * 2;
                ids = Arrays.copyOf(ids, capacity);
                codes = Arrays.copyOf(codes, capacity * codeSize);
            }
            ids[size] = id;
            System.arraycopy(code, 0, codes, size * codeSize, codeSize);
            size++;
        }
    }
}
