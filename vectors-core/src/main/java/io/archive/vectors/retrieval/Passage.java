package io.archive.vectors.retrieval;

import io.archive.vectors.store.ChunkRecord;

/**
 * One ranked search hit joined with its metadata and text.
 *
 * @param record metadata row for the hit
 * @param text resolved chunk text, empty if it could not be read
 * @param score raw index score
 * @param relevance score mapped to {@code [0, 100]}
 */
public record Passage(ChunkRecord record, String text, float score, double relevance) {

    public long globalId() {
        return record.globalId();
    }

    public String paper() {
        return record.paper();
    }

    public String date() {
        return record.date();
    }
}
