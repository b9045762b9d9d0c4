package io.archive.vectors;

/**
 * Thrown when a compressed index cannot be trained. Fatal for a build.
 */
public class TrainingException extends RuntimeException {

    public TrainingException(String message) {
        super(message);
    }
}
