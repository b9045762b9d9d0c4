package io.archive.vectors.retrieval;

import io.archive.vectors.ScoreKind;

/**
 * Maps raw index scores onto a 0-100 relevance scale.
 *
 * <p>All indexes compare unit vectors, so a similarity score is a cosine in
 * {@code [-1, 1]} and a distance score is {@code 1 - cosine}. Both map to
 * {@code max(0, cosine) * 100}.</p>
 */
public final class Relevance {

    private Relevance() {
    }

    public static double percent(float score, ScoreKind kind) {
        double cosine = kind == ScoreKind.DISTANCE ? 1.0 - score : score;
        return Math.min(100.0, Math.max(0.0, cosine) * 100.0);
    }

    /**
     * Whole-number percentage, e.g. {@code "74%"}.
     */
    public static String format(double percent) {
        return String.format("%.0f%%", percent);
    }
}
