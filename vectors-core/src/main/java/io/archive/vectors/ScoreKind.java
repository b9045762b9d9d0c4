package io.archive.vectors;

/**
 * What the score of a {@link Neighbor} means.
 */
public enum ScoreKind {
    /** Inner-product similarity of unit vectors, higher is better. */
    SIMILARITY,

    /** Cosine distance ({@code 1 - similarity}), lower is better. */
    DISTANCE
}
