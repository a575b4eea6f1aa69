package com.monitoring.plugin.extdata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered collection of free-text lines shown after the plugin summary line.
 * Duplicates and empty lines are kept as given.
 *
 * <p>Not thread-safe: one instance belongs to one check execution.</p>
 */
public class ExtendedDataCollector implements ExtendedDataSink {

    private final List<String> lines = new ArrayList<>();

    @Override
    public void add(String line) {
        lines.add(Objects.requireNonNull(line, "line is required"));
    }

    /**
     * Joins all lines with {@code '\n'}; empty string when nothing was added.
     */
    public String render() {
        return String.join("\n", lines);
    }

    public List<String> lines() {
        return Collections.unmodifiableList(lines);
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
