package io.archive.vectors.store;

/**
 * Raised when the metadata database is missing or a statement against it fails.
 */
public class MetadataStoreException extends RuntimeException {

    public MetadataStoreException(String message) {
        super(message);
    }

    public MetadataStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
