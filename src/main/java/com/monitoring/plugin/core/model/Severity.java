package com.monitoring.plugin.core.model;

/**
 * Outcome severity of a monitoring check.
 * Each value maps to the standard plugin exit status.
 */
public enum Severity {
    /**
     * Everything is within thresholds. Exit status 0.
     */
    OK(0),

    /**
     * A warning threshold was crossed. Exit status 1.
     */
    WARNING(1),

    /**
     * A critical threshold was crossed. Exit status 2.
     */
    CRITICAL(2),

    /**
     * The check could not determine a verdict (bad arguments, internal failure,
     * nothing measured). Exit status 3.
     */
    UNKNOWN(3);

    private final int exitCode;

    Severity(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }

    /**
     * Upper-case label used in plugin output, e.g. {@code "CRITICAL"}.
     */
    public String label() {
        return name();
    }

    /**
     * Returns the severity for a plugin exit status.
     *
     * @throws IllegalArgumentException if the code is not between 0 and 3
     */
    public static Severity fromExitCode(int exitCode) {
        for (Severity severity : values()) {
            if (severity.exitCode == exitCode) {
                return severity;
            }
        }
        throw new IllegalArgumentException("No severity for exit code " + exitCode);
    }
}
