package com.monitoring.plugin.threshold;

import com.monitoring.plugin.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies a measured value against optional warning and critical ranges.
 *
 * <p>The critical range is checked first; the warning range only matters when the
 * critical one does not alarm. With no range at all the value is {@link Severity#OK}.</p>
 */
public final class ThresholdChecker {
    private static final Logger log = LoggerFactory.getLogger(ThresholdChecker.class);

    private ThresholdChecker() {
        // utility class
    }

    /**
     * Evaluates a value against parsed ranges.
     *
     * @param value    the measured value
     * @param warning  warning range, or null
     * @param critical critical range, or null
     * @return CRITICAL, WARNING or OK
     */
    public static Severity evaluate(double value, ThresholdRange warning, ThresholdRange critical) {
        Severity severity;
        if (critical != null && critical.contains(value)) {
            severity = Severity.CRITICAL;
        } else if (warning != null && warning.contains(value)) {
            severity = Severity.WARNING;
        } else {
            severity = Severity.OK;
        }
        log.debug("Value {} against warning={} critical={} -> {}", value, warning, critical, severity);
        return severity;
    }

    /**
     * Evaluates a value against textual range expressions, parsing them first.
     * Null or absent expressions are skipped.
     *
     * @throws InvalidThresholdFormatException if a supplied expression is malformed
     */
    public static Severity evaluate(double value, String warning, String critical) {
        ThresholdRange criticalRange = critical != null ? ThresholdRange.parse(critical) : null;
        ThresholdRange warningRange = warning != null ? ThresholdRange.parse(warning) : null;
        return evaluate(value, warningRange, criticalRange);
    }
}
