package io.archive.vectors.retrieval;

/**
 * Turns query text into a vector in the same space as the indexed chunks.
 */
@FunctionalInterface
public interface QueryEmbedder {

    /**
     * @throws EmbedderUnavailableException if no vector can be produced
     */
    float[] embed(String text);
}
