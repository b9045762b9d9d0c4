package io.archive.vectors.source;

/**
 * Thrown when a source batch cannot be ingested as a whole: unreadable array,
 * bad shape, or vectors and metadata rows that do not line up.
 */
public class BatchFormatException extends RuntimeException {

    private final String sourceName;

    public BatchFormatException(String sourceName, String message) {
        super(String.format("%s: %s", sourceName, message));
        this.sourceName = sourceName;
    }

    public BatchFormatException(String sourceName, String message, Throwable cause) {
        super(String.format("%s: %s", sourceName, message), cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
