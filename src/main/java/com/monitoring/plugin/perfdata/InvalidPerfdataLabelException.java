package com.monitoring.plugin.perfdata;

/**
 * Runtime exception thrown when a performance data label cannot be rendered
 * in the perfdata wire format.
 */
public class InvalidPerfdataLabelException extends RuntimeException {

    private final String label;

    public InvalidPerfdataLabelException(String label, String message) {
        super(message);
        this.label = label;
    }

    public InvalidPerfdataLabelException(String label, String message, Throwable cause) {
        super(message, cause);
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
