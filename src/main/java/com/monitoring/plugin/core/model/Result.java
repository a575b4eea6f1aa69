package com.monitoring.plugin.core.model;

import java.util.Objects;

/**
 * Outcome of one sub-check: a severity and the message describing it.
 * A null message is stored as the empty string.
 */
public record Result(Severity severity, String message) {

    public Result {
        Objects.requireNonNull(severity, "severity is required");
        message = message != null ? message : "";
    }

    public static Result ok(String message) {
        return new Result(Severity.OK, message);
    }

    public static Result warning(String message) {
        return new Result(Severity.WARNING, message);
    }

    public static Result critical(String message) {
        return new Result(Severity.CRITICAL, message);
    }

    public static Result unknown(String message) {
        return new Result(Severity.UNKNOWN, message);
    }

    @Override
    public String toString() {
        return severity.label() + " - " + message;
    }
}
