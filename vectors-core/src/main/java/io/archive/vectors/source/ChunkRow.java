package io.archive.vectors.source;

/**
 * One row of a chunk metadata batch. Missing columns read as empty strings.
 */
public record ChunkRow(
    String articleId,
    String articleTitle,
    String date,
    String paper,
    int chunkIndex,
    String text
) {
    public ChunkRow {
        articleId = articleId != null ? articleId : "";
        articleTitle = articleTitle != null ? articleTitle : "";
        date = date != null ? date : "";
        paper = paper != null ? paper : "";
        text = text != null ? text : "";
    }
}
