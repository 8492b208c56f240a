package com.dwimerge.cli;

import com.dwimerge.core.error.ConfigException;
import com.dwimerge.core.error.DwiMergeException;
import org.slf4j.Logger;

/**
 * Exit codes shared by all commands.
 */
public final class ExitCodes {

    public static final int OK = 0;
    public static final int FAILURE = 1;
    public static final int CONFIG_ERROR = 2;

    private ExitCodes() {
        // Utility class
    }

    /**
     * Reports a failure on stderr and the log, and maps it to an exit code.
     *
     * @param action what was attempted, e.g. {@code Merge}
     * @param e failure
     * @param log logger of the command
     * @return {@link #CONFIG_ERROR} for configuration problems, {@link #FAILURE} otherwise
     */
    public static int report(String action, Exception e, Logger log) {
        if (e instanceof DwiMergeException domain) {
            log.error("{} failed ({} error): {}", action, domain.getCategory(), domain.getMessage());
        } else {
            log.error("{} failed", action, e);
        }
        System.err.println("✗ " + action + " failed: " + e.getMessage());
        return e instanceof ConfigException ? CONFIG_ERROR : FAILURE;
    }
}
