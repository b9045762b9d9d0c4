package io.archive.vectors.retrieval;

import io.archive.vectors.store.ChunkRecord;

/**
 * Resolves the text of a chunk from its locator (source file and row offset).
 * Implementations return an empty string rather than fail.
 */
@FunctionalInterface
public interface TextResolver {

    String resolve(ChunkRecord record);
}
