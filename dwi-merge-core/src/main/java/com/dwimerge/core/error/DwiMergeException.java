package com.dwimerge.core.error;

/**
 * Base class for all domain errors raised while assembling or running a merge.
 *
 * <p>Every error carries a {@code subject}: the offending group identifier,
 * configuration key, workflow node or file that a user has to look at to fix
 * the run. The subject is prepended to the message so that log lines and CLI
 * output are self-describing.
 *
 * <p>No error is ever coerced into a partial result. A group that fails
 * validation blocks the whole run.
 */
public abstract class DwiMergeException extends RuntimeException {

    private final String subject;

    protected DwiMergeException(String subject, String message) {
        super(format(subject, message));
        this.subject = subject;
    }

    protected DwiMergeException(String subject, String message, Throwable cause) {
        super(format(subject, message), cause);
        this.subject = subject;
    }

    /**
     * Returns the group identifier, configuration key, node id or file this error is about.
     *
     * @return error subject, never null
     */
    public String getSubject() {
        return subject;
    }

    /**
     * Short label of the error category, used in CLI output.
     *
     * @return category label
     */
    public abstract String getCategory();

    private static String format(String subject, String message) {
        return subject == null || subject.isBlank() ? message : "[" + subject + "] " + message;
    }
}
