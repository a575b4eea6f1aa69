package com.monitoring.plugin.perfdata;

import com.monitoring.plugin.threshold.ThresholdRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered collection of performance metrics, rendered as the single perfdata line
 * consumed by graphing backends. Tokens keep insertion order and are space separated.
 *
 * <p>Not thread-safe: one instance belongs to one check execution.</p>
 */
public class PerformanceDataFormatter {

    private final List<PerfDatum> data = new ArrayList<>();

    /**
     * Adds a metric with every optional field set or null.
     *
     * @throws InvalidPerfdataLabelException if the label is empty or contains {@code '='}
     */
    public void addPerfdata(String label, Number value, String unit, String warning,
                            String critical, Number minimum, Number maximum) {
        add(new PerfDatum(label, value, unit, warning, critical, minimum, maximum));
    }

    /**
     * Adds a metric whose thresholds are parsed ranges, rendered in canonical form.
     *
     * @throws InvalidPerfdataLabelException if the label is empty or contains {@code '='}
     */
    public void addPerfdata(String label, Number value, String unit, ThresholdRange warning,
                            ThresholdRange critical, Number minimum, Number maximum) {
        add(PerfDatum.builder(label, value)
                .unit(unit)
                .warning(warning)
                .critical(critical)
                .minimum(minimum)
                .maximum(maximum)
                .build());
    }

    public void addPerfdata(String label, Number value, String unit) {
        add(new PerfDatum(label, value, unit, null, null, null, null));
    }

    public void addPerfdata(String label, Number value) {
        add(new PerfDatum(label, value));
    }

    public void add(PerfDatum datum) {
        data.add(Objects.requireNonNull(datum, "datum is required"));
    }

    /**
     * Renders all metrics; empty string when none were added.
     */
    public String render() {
        return data.stream()
                .map(PerfDatum::render)
                .collect(Collectors.joining(" "));
    }

    public List<PerfDatum> data() {
        return Collections.unmodifiableList(data);
    }

    public boolean isEmpty() {
        return data.isEmpty();
    }

    public int size() {
        return data.size();
    }
}
