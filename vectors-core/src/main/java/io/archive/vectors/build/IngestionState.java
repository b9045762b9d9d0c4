package io.archive.vectors.build;

/**
 * Ingestion progress of one source file. Only {@link #COMMITTED} survives a restart;
 * a file left {@link #IN_PROGRESS} by a crash is pending again.
 */
public enum IngestionState {
    PENDING,
    IN_PROGRESS,
    COMMITTED
}
