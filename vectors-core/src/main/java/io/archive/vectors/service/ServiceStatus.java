package io.archive.vectors.service;

/**
 * Status reported by the service and carried on every response.
 */
public enum ServiceStatus {
    /** Query answered, possibly with no results */
    OK,
    /** Index or metadata could not be loaded at startup */
    NOT_INITIALIZED,
    /** Query could not be embedded */
    UNAVAILABLE
}
