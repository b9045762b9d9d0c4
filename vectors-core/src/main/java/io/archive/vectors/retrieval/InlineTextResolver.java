package io.archive.vectors.retrieval;

import io.archive.vectors.store.ChunkRecord;

/**
 * Reads text stored with the metadata row.
 */
public class InlineTextResolver implements TextResolver {

    @Override
    public String resolve(ChunkRecord record) {
        return record.text() != null ? record.text() : "";
    }
}
