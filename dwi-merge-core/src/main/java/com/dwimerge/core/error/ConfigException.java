package com.dwimerge.core.error;

/**
 * Invalid or contradictory configuration, e.g. an unknown merge strategy or a denoise
 * window that is not odd.
 */
public class ConfigException extends DwiMergeException {

    public ConfigException(String subject, String message) {
        super(subject, message);
    }

    public ConfigException(String subject, String message, Throwable cause) {
        super(subject, message, cause);
    }

    @Override
    public String getCategory() {
        return "config";
    }
}
