package io.archive.vectors.embeddings;

import io.archive.vectors.retrieval.QueryEmbedder;

import java.io.Closeable;
import java.util.List;

/**
 * Interface for generating text embeddings.
 *
 * <p>The same model must embed the corpus and the queries; the model id is
 * recorded in every index built from its vectors.</p>
 */
public interface EmbeddingModel extends QueryEmbedder, Closeable {

    /**
     * Generates an embedding for a single text.
     *
     * @throws io.archive.vectors.retrieval.EmbedderUnavailableException if the model cannot run
     */
    @Override
    float[] embed(String text);

    /**
     * Generates embeddings for multiple texts, in order.
     *
     * <p>Implementations may batch requests for efficiency.</p>
     */
    List<float[]> embedBatch(List<String> texts);

    /**
     * Returns the model identifier (e.g., "all-MiniLM-L6-v2").
     */
    String getModelId();

    /**
     * Returns the embedding dimensions.
     */
    int getDimensions();

    @Override
    void close();

    /**
     * Loads an embedding model by ID.
     */
    static EmbeddingModel load(String modelId) {
        return load(modelId, EmbeddingConfig.defaults());
    }

    /**
     * Loads an embedding model with custom configuration.
     */
    static EmbeddingModel load(String modelId, EmbeddingConfig config) {
        return switch (config.backend()) {
            case ONNX -> new OnnxEmbeddingModel(modelId, config);
            case SIMPLE -> new SimpleEmbeddingModel(modelId, config);
        };
    }
}
