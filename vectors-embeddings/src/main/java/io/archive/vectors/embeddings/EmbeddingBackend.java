package io.archive.vectors.embeddings;

/**
 * Available embedding backends.
 */
public enum EmbeddingBackend {
    /** ONNX Runtime - local sentence-transformer execution */
    ONNX,

    /** Hash-based pseudo-embeddings (for testing/development) */
    SIMPLE
}
