package com.monitoring.plugin.threshold;

/**
 * Runtime exception thrown when a threshold range expression does not follow
 * the monitoring-plugins range syntax, or describes an empty range.
 */
public class InvalidThresholdFormatException extends RuntimeException {

    private final String expression;

    public InvalidThresholdFormatException(String expression, String message) {
        super(message);
        this.expression = expression;
    }

    public InvalidThresholdFormatException(String expression, String message, Throwable cause) {
        super(message, cause);
        this.expression = expression;
    }

    /**
     * The expression that failed to parse, possibly null.
     */
    public String getExpression() {
        return expression;
    }
}
