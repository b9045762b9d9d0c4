package io.archive.vectors.retrieval;

import io.archive.vectors.source.ChunkSource;
import io.archive.vectors.store.ChunkRecord;

/**
 * Re-reads chunk text from the source CSV on demand, for stores that keep only locators.
 */
public class SourceFileTextResolver implements TextResolver {

    private final ChunkSource source;

    public SourceFileTextResolver(ChunkSource source) {
        this.source = source;
    }

    @Override
    public String resolve(ChunkRecord record) {
        if (record.hasInlineText()) {
            return record.text();
        }
        return source.readText(record.sourceFile(), record.rowOffset()).orElse("");
    }
}
