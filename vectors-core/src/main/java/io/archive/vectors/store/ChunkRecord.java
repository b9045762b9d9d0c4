package io.archive.vectors.store;

import java.util.Objects;

/**
 * Metadata row for one indexed chunk, keyed by the global id it shares with
 * the vector index. Raw vectors are never stored here.
 */
public record ChunkRecord(
    /** Dense global id, the join key with the vector index */
    long globalId,

    /** Article identifier in the archive, may be empty */
    String articleId,

    /** Article title, may be empty */
    String articleTitle,

    /** Publication date as written in the source, may be empty */
    String date,

    /** Newspaper name, may be empty */
    String paper,

    /** Base name of the source batch the chunk came from */
    String sourceFile,

    /** Row of the chunk within its source batch */
    int rowOffset,

    /** Inline text for self-contained deployments, otherwise null */
    String text
) {
    public ChunkRecord {
        if (globalId < 0) throw new IllegalArgumentException("globalId must be >= 0");
        Objects.requireNonNull(sourceFile, "sourceFile cannot be null");
        articleId = articleId != null ? articleId : "";
        articleTitle = articleTitle != null ? articleTitle : "";
        date = date != null ? date : "";
        paper = paper != null ? paper : "";
    }

    public boolean hasInlineText() {
        return text != null;
    }
}
