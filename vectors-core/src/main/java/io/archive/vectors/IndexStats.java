package io.archive.vectors;

/**
 * Statistics about a VectorIndex.
 */
public record IndexStats(
    /** Operating mode */
    IndexMode mode,

    /** Total number of vectors */
    long totalVectors,

    /** Embedding model info */
    String modelId,

    /** Vector dimensions */
    int dimensions,

    /** Whether the index can accept vectors */
    boolean trained,

    /** IVF clusters, 0 for other modes */
    int clusters,

    /** Approximate in-memory size in bytes */
    long sizeBytes
) {}
