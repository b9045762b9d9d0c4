package io.archive.vectors;

/**
 * Operating modes of a {@link VectorIndex}.
 */
public enum IndexMode {
    /** Brute-force inner product over raw vectors. Exact, no training. */
    EXACT,

    /** Inverted file + product quantization. Trained, approximate, memory-compact. */
    COMPRESSED,

    /** HNSW proximity graph. Approximate, no training, raw vectors kept in memory. */
    GRAPH;

    /**
     * Whether indexes in this mode need a training pass before vectors can be added.
     */
    public boolean requiresTraining() {
        return this == COMPRESSED;
    }
}
