package io.archive.vectors.embeddings;

import io.archive.vectors.VectorMath;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimpleEmbeddingModelTest {

    @Test
    void testDeterministicAndNormalized() {
        try (EmbeddingModel model = EmbeddingModel.load("test-model", EmbeddingConfig.simple().withDimensions(16))) {
            float[] a = model.embed("Brigham Young");
            float[] b = model.embed("Brigham Young");

            assertEquals(16, a.length);
            assertArrayEquals(a, b);
            assertEquals(1.0f, VectorMath.dot(a, a), 1e-5f);
        }
    }

    @Test
    void testDifferentTextsDiffer() {
        try (EmbeddingModel model = EmbeddingModel.load("test-model", EmbeddingConfig.simple().withDimensions(64))) {
            float similarity = VectorMath.cosineSimilarity(model.embed("silver mine"), model.embed("sugar beets"));

            assertTrue(similarity < 0.9f);
        }
    }

    @Test
    void testDimensionsFromKnownModel() {
        try (EmbeddingModel model = EmbeddingModel.load("bge-base-en", EmbeddingConfig.simple())) {
            assertEquals(768, model.getDimensions());
            assertEquals("bge-base-en", model.getModelId());
        }
    }

    @Test
    void testBatchMatchesSingle() {
        try (EmbeddingModel model = EmbeddingModel.load("test-model", EmbeddingConfig.simple().withDimensions(8))) {
            List<float[]> batch = model.embedBatch(List.of("one", "two"));

            assertEquals(2, batch.size());
            assertArrayEquals(model.embed("two"), batch.get(1));
        }
    }
}
