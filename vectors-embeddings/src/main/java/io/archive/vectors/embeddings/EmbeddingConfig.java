package io.archive.vectors.embeddings;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration for embedding models.
 */
public record EmbeddingConfig(
    /** Backend to use for embedding generation */
    EmbeddingBackend backend,

    /** Directory to cache downloaded models */
    Path cacheDir,

    /** Maximum tokens per input; longer inputs are truncated */
    int maxSequenceLength,

    /** Texts per inference call when embedding chunk files */
    int batchSize,

    /** Whether to normalize output vectors */
    boolean normalizeOutput,

    /** Output dimensions (0 = use model default) */
    int dimensions
) {

    public static final Path DEFAULT_CACHE_DIR =
        Paths.get(System.getProperty("user.home"), ".archive-vectors", "models");

    public static EmbeddingConfig defaults() {
        return new EmbeddingConfig(EmbeddingBackend.ONNX, DEFAULT_CACHE_DIR, 256, 32, true, 0);
    }

    public static EmbeddingConfig simple() {
        return new EmbeddingConfig(EmbeddingBackend.SIMPLE, DEFAULT_CACHE_DIR, 256, 32, true, 0);
    }

    public EmbeddingConfig withBackend(EmbeddingBackend backend) {
        return new EmbeddingConfig(backend, cacheDir, maxSequenceLength, batchSize, normalizeOutput, dimensions);
    }

    public EmbeddingConfig withCacheDir(Path cacheDir) {
        return new EmbeddingConfig(backend, cacheDir, maxSequenceLength, batchSize, normalizeOutput, dimensions);
    }

    public EmbeddingConfig withBatchSize(int batchSize) {
        return new EmbeddingConfig(backend, cacheDir, maxSequenceLength, batchSize, normalizeOutput, dimensions);
    }

    public EmbeddingConfig withDimensions(int dimensions) {
        return new EmbeddingConfig(backend, cacheDir, maxSequenceLength, batchSize, normalizeOutput, dimensions);
    }
}
