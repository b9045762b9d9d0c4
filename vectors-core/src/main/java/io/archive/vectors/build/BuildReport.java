package io.archive.vectors.build;

import io.archive.vectors.IndexMode;

import java.time.Duration;

/**
 * Outcome of a build run.
 */
public record BuildReport(
    IndexMode mode,

    /** Source files found */
    int totalFiles,

    /** Files ingested by this run */
    int processed,

    /** Files skipped for missing metadata */
    int skipped,

    /** Files already committed by an earlier run */
    int alreadyCommitted,

    /** Files rejected as unreadable or mismatched */
    int errored,

    /** Vectors added by this run */
    long vectorsAdded,

    /** Vectors in the index after the run */
    long totalVectors,

    /** Rows in the metadata store after the run */
    long metadataRows,

    Duration elapsed
) {
    public boolean isConsistent() {
        return totalVectors == metadataRows;
    }

    public String summary() {
        return String.format(
            "%s index: %d files (%d processed, %d already committed, %d skipped, %d errored), "
                + "%,d vectors added, %,d total, %,d metadata rows in %.1f min",
            mode, totalFiles, processed, alreadyCommitted, skipped, errored,
            vectorsAdded, totalVectors, metadataRows, elapsed.toMillis() / 60_000.0);
    }
}
