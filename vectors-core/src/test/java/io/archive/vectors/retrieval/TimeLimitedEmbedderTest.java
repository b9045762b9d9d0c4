package io.archive.vectors.retrieval;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class TimeLimitedEmbedderTest {

    @Test
    void testPassesThroughResult() {
        try (TimeLimitedEmbedder embedder = new TimeLimitedEmbedder(text -> new float[]{1f, 2f}, Duration.ofSeconds(5))) {
            assertArrayEquals(new float[]{1f, 2f}, embedder.embed("q"));
        }
    }

    @Test
    void testSlowEmbedderUnavailable() {
        try (TimeLimitedEmbedder embedder = new TimeLimitedEmbedder(text -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new float[0];
        }, Duration.ofMillis(100))) {
            assertThrows(EmbedderUnavailableException.class, () -> embedder.embed("q"));
        }
    }

    @Test
    void testFailureUnavailable() {
        try (TimeLimitedEmbedder embedder = new TimeLimitedEmbedder(text -> {
            throw new IllegalStateException("model not loaded");
        }, Duration.ofSeconds(5))) {
            EmbedderUnavailableException e = assertThrows(EmbedderUnavailableException.class, () -> embedder.embed("q"));
            assertTrue(e.getMessage().contains("model not loaded"));
        }
    }
}
