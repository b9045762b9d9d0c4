package io.archive.vectors.retrieval;

import java.util.List;

/**
 * Answer text plus ranked passages for one query.
 */
public record RetrievalResult(Outcome outcome, String query, String answer, List<Passage> passages, boolean synthesized) {

    public static final String EMPTY_QUERY_ANSWER = "Please enter a search query.";
    public static final String NO_RESULTS_ANSWER = "No relevant articles found.";

    public enum Outcome {
        /** Blank query, nothing searched */
        EMPTY_QUERY,
        /** Search ran but nothing usable came back */
        NO_RESULTS,
        /** Passages found */
        FOUND
    }

    public RetrievalResult {
        passages = List.copyOf(passages);
    }

    public static RetrievalResult emptyQuery(String query) {
        return new RetrievalResult(Outcome.EMPTY_QUERY, query, EMPTY_QUERY_ANSWER, List.of(), false);
    }

    public static RetrievalResult noResults(String query) {
        return new RetrievalResult(Outcome.NO_RESULTS, query, NO_RESULTS_ANSWER, List.of(), false);
    }

    public static RetrievalResult found(String query, String answer, List<Passage> passages) {
        return new RetrievalResult(Outcome.FOUND, query, answer, passages, false);
    }

    /**
     * Same passages with a synthesized answer in place of the extractive one.
     */
    public RetrievalResult withSynthesizedAnswer(String synthesizedAnswer) {
        return new RetrievalResult(outcome, query, synthesizedAnswer, passages, true);
    }

    public boolean hasPassages() {
        return !passages.isEmpty();
    }
}
