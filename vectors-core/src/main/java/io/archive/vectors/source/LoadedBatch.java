package io.archive.vectors.source;

import java.util.List;

/**
 * A source batch read into memory, vectors and rows positionally aligned.
 */
public record LoadedBatch(SourceBatch batch, float[][] vectors, List<ChunkRow> rows) {

    public LoadedBatch {
        if (vectors.length != rows.size()) {
            throw new BatchFormatException(batch.name(), String.format(
                "vector count %d does not match metadata row count %d", vectors.length, rows.size()));
        }
        rows = List.copyOf(rows);
    }

    public int size() {
        return vectors.length;
    }

    public int dimensions() {
        return vectors.length == 0 ? 0 : vectors[0].length;
    }
}
