package io.archive.vectors;

/**
 * Configuration for creating a VectorIndex.
 */
public record IndexConfig(
    /** Embedding model identifier, stored in the index header */
    String modelId,

    /** Vector dimensions */
    int dimensions,

    /** Upper bound on IVF clusters */
    int maxClusters,

    /** Training samples per cluster used to size the IVF coarse quantizer */
    int samplesPerCluster,

    /** Requested PQ sub-quantizers (reduced to a divisor of the dimensions) */
    int subQuantizers,

    /** IVF clusters probed per query */
    int nprobe,

    /** HNSW M parameter (max connections) */
    int hnswM,

    /** HNSW efConstruction parameter */
    int hnswEfConstruction,

    /** HNSW efSearch parameter */
    int hnswEfSearch,

    /** HNSW capacity */
    int hnswMaxItems,

    /** Seed for k-means initialization */
    long seed
) {
    public static final String DEFAULT_MODEL = "all-MiniLM-L6-v2";

    public static IndexConfig defaultConfig() {
        return forModel(DEFAULT_MODEL, 384);
    }

    public static IndexConfig forModel(String modelId, int dimensions) {
        return new IndexConfig(modelId, dimensions, 4096, 40, 48, 32, 16, 200, 50, 1_000_000, 42L);
    }

    public IndexConfig withNprobe(int nprobe) {
        return new IndexConfig(modelId, dimensions, maxClusters, samplesPerCluster, subQuantizers,
            nprobe, hnswM, hnswEfConstruction, hnswEfSearch, hnswMaxItems, seed);
    }

    public IndexConfig withSubQuantizers(int subQuantizers) {
        return new IndexConfig(modelId, dimensions, maxClusters, samplesPerCluster, subQuantizers,
            nprobe, hnswM, hnswEfConstruction, hnswEfSearch, hnswMaxItems, seed);
    }

    public IndexConfig withHnswMaxItems(int hnswMaxItems) {
        return new IndexConfig(modelId, dimensions, maxClusters, samplesPerCluster, subQuantizers,
            nprobe, hnswM, hnswEfConstruction, hnswEfSearch, hnswMaxItems, seed);
    }

    /**
     * Number of IVF clusters for a training sample of the given size:
     * {@code min(maxClusters, samples / samplesPerCluster)}, never less than one.
     */
    public int clustersFor(int samples) {
        return Math.max(1, Math.min(maxClusters, samples / samplesPerCluster));
    }
}
