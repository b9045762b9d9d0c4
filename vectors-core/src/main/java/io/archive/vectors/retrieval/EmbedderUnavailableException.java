package io.archive.vectors.retrieval;

/**
 * The query embedder could not produce a vector: model not loaded, remote call
 * failed or timed out, or the vector width does not match the index.
 * No search is possible without a query vector, so this fails the query.
 */
public class EmbedderUnavailableException extends RuntimeException {

    public EmbedderUnavailableException(String message) {
        super(message);
    }

    public EmbedderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
