package io.archive.vectors;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.List;

/**
 * Nearest-neighbor capability over a dense id space.
 *
 * <p>Ids are assigned by the index: every {@link #add(float[][])} call appends the
 * batch at the current size, so the first vector ever added has id 0 and ids never
 * have gaps. Callers normalize vectors before adding and searching, which makes the
 * inner product used by every implementation a cosine similarity.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * VectorIndex index = VectorIndex.create(IndexMode.COMPRESSED, IndexConfig.defaultConfig());
 * index.train(sample);
 * long firstId = index.add(batch);
 * index.save(Path.of("udn.index"));
 *
 * VectorIndex loaded = VectorIndex.load(Path.of("udn.index"));
 * List<Neighbor> hits = loaded.search(query, 5);
 * }</pre>
 */
public interface VectorIndex extends AutoCloseable {

    // ==================== Factory Methods ====================

    /**
     * Creates a new empty index in the given mode.
     */
    static VectorIndex create(IndexMode mode, IndexConfig config) {
        return switch (mode) {
            case EXACT -> new FlatVectorIndex(config);
            case COMPRESSED -> new IvfPqVectorIndex(config);
            case GRAPH -> new HnswVectorIndex(config);
        };
    }

    /**
     * Loads an index from a file, dispatching on the format magic.
     *
     * @param path Path to the index file
     * @return Loaded index
     * @throws IOException if the file cannot be read or is not an index
     */
    static VectorIndex load(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is);
        }
    }

    /**
     * Loads an index from an input stream.
     */
    static VectorIndex load(InputStream is) throws IOException {
        BufferedInputStream in = new BufferedInputStream(is);
        in.mark(4);
        byte[] magic = in.readNBytes(4);
        in.reset();

        if (Arrays.equals(magic, FlatVectorIndex.MAGIC)) {
            return FlatVectorIndex.loadFrom(in);
        } else if (Arrays.equals(magic, IvfPqVectorIndex.MAGIC)) {
            return IvfPqVectorIndex.loadFrom(in);
        } else if (Arrays.equals(magic, HnswVectorIndex.MAGIC)) {
            return HnswVectorIndex.loadFrom(in);
        }
        throw new IOException("Invalid file format: not a vector index (magic: " + new String(magic) + ")");
    }

    // ==================== Build ====================

    /**
     * Trains the index on a sample of normalized vectors. No-op for modes
     * that need no training.
     *
     * @throws TrainingException if the sample is empty
     */
    void train(float[][] vectors);

    /**
     * Whether vectors can be added.
     */
    boolean isTrained();

    /**
     * Appends vectors, assigning contiguous ids starting at the current size.
     *
     * @return id of the first vector in the batch
     */
    long add(float[][] vectors);

    // ==================== Search ====================

    /**
     * Finds the {@code k} nearest vectors to the query, best first.
     */
    List<Neighbor> search(float[] query, int k);

    /**
     * How {@link Neighbor#score()} values produced by this index should be read.
     */
    ScoreKind scoreKind();

    // ==================== Persistence ====================

    /**
     * Saves the index to a file. The file is replaced atomically, so a crash
     * leaves either the previous checkpoint or the new one.
     */
    default void save(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try (OutputStream os = Files.newOutputStream(tmp)) {
            save(os);
        }
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /**
     * Saves the index to an output stream.
     */
    void save(OutputStream os) throws IOException;

    // ==================== Metadata ====================

    IndexMode mode();

    /**
     * Returns the embedding model identifier used by this index.
     */
    String getModelId();

    /**
     * Returns the vector dimensions.
     */
    int getDimensions();

    /**
     * Returns the number of indexed vectors.
     */
    long size();

    default boolean isEmpty() {
        return size() == 0;
    }

    IndexStats getStats();

    @Override
    void close();
}
