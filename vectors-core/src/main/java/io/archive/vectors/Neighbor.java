package io.archive.vectors;

/**
 * One hit of a nearest-neighbor search.
 *
 * @param id    global id of the vector
 * @param score similarity or distance, see {@link VectorIndex#scoreKind()}
 */
public record Neighbor(long id, float score) {
}
