package io.archive.vectors;

/**
 * Exception thrown when a persisted index was built with a different embedding model
 * or vector width than the one in use.
 */
public class IncompatibleModelException extends RuntimeException {

    private final String expectedModel;
    private final String actualModel;

    public IncompatibleModelException(String expectedModel, String actualModel) {
        super(String.format(
            "Index was built with a different embedding model. Expected '%s' but found '%s'",
            expectedModel, actualModel
        ));
        this.expectedModel = expectedModel;
        this.actualModel = actualModel;
    }

    public String getExpectedModel() {
        return expectedModel;
    }

    public String getActualModel() {
        return actualModel;
    }
}
