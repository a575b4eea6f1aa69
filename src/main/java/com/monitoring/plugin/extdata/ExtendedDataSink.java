package com.monitoring.plugin.extdata;

/**
 * Receives lines of extended (long) plugin output.
 * Log adapters call {@link #add(String)} once per formatted log record.
 */
@FunctionalInterface
public interface ExtendedDataSink {

    /**
     * Appends one line of extended output.
     */
    void add(String line);
}
