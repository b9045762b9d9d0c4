package io.archive.vectors.embeddings;

import io.archive.vectors.VectorMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Hash-based embedding model for testing and development.
 *
 * <p>Vectors are Gaussian noise seeded from a SHA-256 of the text: identical
 * texts always embed identically, different texts are near-orthogonal.</p>
 *
 * <p><b>Warning:</b> These embeddings have no semantic meaning. Use only for testing.</p>
 */
public class SimpleEmbeddingModel implements EmbeddingModel {

    private static final Logger log = LoggerFactory.getLogger(SimpleEmbeddingModel.class);

    private final String modelId;
    private final int dimensions;
    private final boolean normalizeOutput;

    public SimpleEmbeddingModel(String modelId, EmbeddingConfig config) {
        this.modelId = modelId;
        this.dimensions = config.dimensions() > 0 ? config.dimensions() : ModelDownloader.getDimensions(modelId);
        this.normalizeOutput = config.normalizeOutput();

        log.info("Initialized SimpleEmbeddingModel: {} ({}d)", modelId, dimensions);
        log.warn("SimpleEmbeddingModel produces hash-based embeddings with no semantic meaning. Use for testing only.");
    }

    @Override
    public float[] embed(String text) {
        Random random = new Random(seedOf(text));
        float[] embedding = new float[dimensions];
        for (int i = 0; i < dimensions; i++) {
            embedding[i] = (float) random.nextGaussian();
        }
        return normalizeOutput ? VectorMath.normalize(embedding) : embedding;
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        List<float[]> embeddings = new ArrayList<>(texts.size());
        for (String text : texts) {
            embeddings.add(embed(text));
        }
        return embeddings;
    }

    @Override
    public String getModelId() {
        return modelId;
    }

    @Override
    public int getDimensions() {
        return dimensions;
    }

    @Override
    public void close() {
        // Nothing to close
    }

    private static long seedOf(String text) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
            long seed = 0;
            for (int i = 0; i < 8; i++) {
                seed = (seed << 8) | (hash[i] & 0xFF);
            }
            return seed;
        } catch (NoSuchAlgorithmException e) {
            return text.hashCode();
        }
    }
}
