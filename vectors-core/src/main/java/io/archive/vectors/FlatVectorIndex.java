package io.archive.vectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Exact index using brute-force inner product search.
 *
 * <p>Suitable for corpora that fit in memory as raw floats. For larger
 * corpora use the compressed {@link IvfPqVectorIndex}.</p>
 */
public class FlatVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(FlatVectorIndex.class);

    // Format constants
    static final byte[] MAGIC = "AVFL".getBytes(StandardCharsets.US_ASCII);
    private static final short FORMAT_VERSION = 1;

    private final IndexConfig config;
    private final List<float[]> vectors;

    public FlatVectorIndex(IndexConfig config) {
        this.config = config;
        this.vectors = new ArrayList<>();
    }

    // ==================== Build ====================

    @Override
    public void train(float[][] sample) {
        // Nothing to learn
    }

    @Override
    public boolean isTrained() {
        return true;
    }

    @Override
    public long add(float[][] batch) {
        long firstId = vectors.size();
        for (float[] vector : batch) {
            checkDimensions(vector);
        }
        for (float[] vector : batch) {
            vectors.add(vector.clone());
        }
        log.debug("Added {} vectors (first id={})", batch.length, firstId);
        return firstId;
    }

    // ==================== Search ====================

    @Override
    public List<Neighbor> search(float[] query, int k) {
        if (vectors.isEmpty()) {
            return List.of();
        }
        checkDimensions(query);

        TopK top = new TopK(k);
        for (int i = 0; i < vectors.size(); i++) {
            top.offer(i, VectorMath.dot(query, vectors.get(i)));
        }
        return top.toList();
    }

    @Override
    public ScoreKind scoreKind() {
        return ScoreKind.SIMILARITY;
    }

    // ==================== Persistence ====================

    @Override
    public void save(OutputStream os) throws IOException {
        DataOutputStream dos = new DataOutputStream(new BufferedOutputStream(os));

        // Write header
        dos.write(MAGIC);
        dos.writeShort(FORMAT_VERSION);
        dos.writeInt(config.dimensions());
        dos.writeLong(vectors.size());
        dos.writeUTF(config.modelId());

        // Write vectors
        for (float[] vector : vectors) {
            for (float v : vector) {
                dos.writeFloat(v);
            }
        }

        dos.flush();
        log.info("Saved flat index: {} vectors", vectors.size());
    }

    public static FlatVectorIndex loadFrom(InputStream is) throws IOException {
        DataInputStream dis = new DataInputStream(new BufferedInputStream(is));

        // Read and verify header
        byte[] magic = new byte[4];
        dis.readFully(magic);
        if (!Arrays.equals(magic, MAGIC)) {
            throw new IOException("Invalid file format: not a flat index (magic: " + new String(magic) + ")");
        }

        short version = dis.readShort();
        if (version != FORMAT_VERSION) {
            throw new UnsupportedFormatException(version);
        }

        int dimensions = dis.readInt();
        long count = dis.readLong();
        String modelId = dis.readUTF();

        FlatVectorIndex index = new FlatVectorIndex(IndexConfig.forModel(modelId, dimensions));
        for (long i = 0; i < count; i++) {
            float[] vector = new float[dimensions];
            for (int j = 0; j < dimensions; j++) {
                vector[j] = dis.readFloat();
            }
            index.vectors.add(vector);
        }

        log.info("Loaded flat index: {} vectors", count);
        return index;
    }

    // ==================== Metadata ====================

    @Override
    public IndexMode mode() {
        return IndexMode.EXACT;
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
        return vectors.size();
    }

    @Override
    public IndexStats getStats() {
        return new IndexStats(mode(), size(), config.modelId(), config.dimensions(), true, 0,
            (long) vectors.size() * config.dimensions() * Float.BYTES);
    }

    @Override
    public void close() {
        // No resources to release in memory implementation
    }

    private void checkDimensions(float[] vector) {
        if (vector.length != config.dimensions()) {
            throw new IllegalArgumentException(String.format(
                "Embedding dimension mismatch: expected %d, got %d",
                config.dimensions(), vector.length
            ));
        }
    }
}
