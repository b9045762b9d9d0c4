package io.archive.vectors;

/**
 * Thrown when the vector index and the metadata store disagree on how many
 * chunks exist, in a way that cannot be repaired by dropping uncommitted rows.
 */
public class IndexConsistencyException extends RuntimeException {

    private final long indexVectors;
    private final long storeRows;

    public IndexConsistencyException(long indexVectors, long storeRows) {
        super(String.format(
            "Vector index holds %d vectors but metadata store holds %d rows", indexVectors, storeRows));
        this.indexVectors = indexVectors;
        this.storeRows = storeRows;
    }

    public long getIndexVectors() {
        return indexVectors;
    }

    public long getStoreRows() {
        return storeRows;
    }
}
