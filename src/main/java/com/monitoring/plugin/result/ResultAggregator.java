package com.monitoring.plugin.result;

import com.monitoring.plugin.core.model.Result;
import com.monitoring.plugin.core.model.Severity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Collects the results of every sub-check run by a plugin and derives the overall verdict.
 *
 * <p>Aggregation logic:</p>
 * <ul>
 *   <li>Any CRITICAL result → CRITICAL</li>
 *   <li>Any WARNING result (and none CRITICAL) → WARNING</li>
 *   <li>Any UNKNOWN result (and none CRITICAL or WARNING) → UNKNOWN</li>
 *   <li>Only OK results → OK</li>
 *   <li>No result at all → UNKNOWN</li>
 * </ul>
 *
 * <p>Not thread-safe: one instance belongs to one check execution.</p>
 */
public class ResultAggregator {

    public static final String DEFAULT_JOINER = ", ";
    public static final Set<Severity> DEFAULT_LEVELS =
            Collections.unmodifiableSet(EnumSet.of(Severity.OK, Severity.WARNING, Severity.CRITICAL));

    private final List<Result> results = new ArrayList<>();

    /**
     * Appends a result.
     */
    public void addResult(Severity severity, String message) {
        add(new Result(severity, message));
    }

    public void add(Result result) {
        results.add(Objects.requireNonNull(result, "result is required"));
    }

    /**
     * Returns the worst severity among all results, UNKNOWN masking only OK.
     */
    public Severity code() {
        if (results.isEmpty()) {
            return Severity.UNKNOWN;
        }
        boolean warning = false;
        boolean unknown = false;
        for (Result result : results) {
            switch (result.severity()) {
                case CRITICAL:
                    return Severity.CRITICAL;
                case WARNING:
                    warning = true;
                    break;
                case UNKNOWN:
                    unknown = true;
                    break;
                default:
                    break;
            }
        }
        if (warning) {
            return Severity.WARNING;
        }
        return unknown ? Severity.UNKNOWN : Severity.OK;
    }

    /**
     * Returns the message of the earliest result carrying the aggregate severity,
     * or the empty string when there is none.
     */
    public String message() {
        Severity code = code();
        for (Result result : results) {
            if (result.severity() == code) {
                return result.message();
            }
        }
        return "";
    }

    /**
     * Joins, in insertion order, the non-empty messages of every result whose
     * severity is one of {@code levels}. {@link #DEFAULT_LEVELS} and {@link #DEFAULT_JOINER}
     * reproduce the usual "all but UNKNOWN, comma separated" summary.
     */
    public String message(Set<Severity> levels, String joiner) {
        Objects.requireNonNull(levels, "levels is required");
        Objects.requireNonNull(joiner, "joiner is required");
        return results.stream()
                .filter(r -> levels.contains(r.severity()))
                .map(Result::message)
                .filter(m -> !m.isEmpty())
                .collect(Collectors.joining(joiner));
    }

    /**
     * Read-only view of the results in insertion order.
     */
    public List<Result> results() {
        return Collections.unmodifiableList(results);
    }

    public int size() {
        return results.size();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }
}
