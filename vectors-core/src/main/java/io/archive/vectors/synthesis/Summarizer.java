package io.archive.vectors.synthesis;

import io.archive.vectors.retrieval.Passage;

import java.util.List;

/**
 * A generative backend that writes an answer from ranked passages.
 * Failures are returned as {@link SynthesisResult#failure(String)}, not thrown.
 */
public interface Summarizer {

    /**
     * Backend name for logs and stats.
     */
    String name();

    /**
     * Checks once whether the backend can be reached.
     */
    boolean probeAvailability();

    SynthesisResult summarize(String query, List<Passage> passages);
}
