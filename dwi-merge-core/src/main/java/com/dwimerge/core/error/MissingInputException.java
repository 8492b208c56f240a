package com.dwimerge.core.error;

/**
 * A required upstream signal was never produced. Indicates a broken dependency graph
 * rather than bad data.
 */
public class MissingInputException extends DwiMergeException {

    public MissingInputException(String subject, String message) {
        super(subject, message);
    }

    public MissingInputException(String subject, String message, Throwable cause) {
        super(subject, message, cause);
    }

    @Override
    public String getCategory() {
        return "missing-input";
    }
}
