package com.dwimerge.core.error;

/**
 * Malformed content in a gradient table, image header or tabular QC input.
 */
public class FormatException extends DwiMergeException {

    public FormatException(String subject, String message) {
        super(subject, message);
    }

    public FormatException(String subject, String message, Throwable cause) {
        super(subject, message, cause);
    }

    @Override
    public String getCategory() {
        return "format";
    }
}
