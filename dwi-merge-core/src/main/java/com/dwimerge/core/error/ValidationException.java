package com.dwimerge.core.error;

/**
 * Structural mismatch between acquisition groups: a missing slot, inconsistent volume counts,
 * incompatible spatial grids or too few groups for averaging.
 */
public class ValidationException extends DwiMergeException {

    public ValidationException(String subject, String message) {
        super(subject, message);
    }

    public ValidationException(String subject, String message, Throwable cause) {
        super(subject, message, cause);
    }

    @Override
    public String getCategory() {
        return "validation";
    }
}
