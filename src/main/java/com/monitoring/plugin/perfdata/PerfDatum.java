package com.monitoring.plugin.perfdata;

import com.monitoring.plugin.core.NumberFormats;
import com.monitoring.plugin.threshold.ThresholdRange;

import java.util.Objects;

/**
 * One performance metric, rendered as
 * {@code 'label'=value[uom];[warn];[crit];[min];[max]}.
 *
 * <p>Every field except label and value is optional (null). Thresholds are kept as text:
 * either the expression the caller supplied or the canonical form of a parsed range.</p>
 */
public record PerfDatum(
        String label,
        Number value,
        String unit,
        String warning,
        String critical,
        Number minimum,
        Number maximum
) {
    public PerfDatum {
        validateLabel(label);
        Objects.requireNonNull(value, "value is required");
        NumberFormats.format(value);
        if (minimum != null) {
            NumberFormats.format(minimum);
        }
        if (maximum != null) {
            NumberFormats.format(maximum);
        }
        validateField("unit", unit);
        validateField("warning", warning);
        validateField("critical", critical);
    }

    public PerfDatum(String label, Number value) {
        this(label, value, null, null, null, null, null);
    }

    /**
     * Renders this metric as one perfdata token. Absent fields leave their
     * position empty; single quotes in the label are doubled.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append('\'').append(label.replace("'", "''")).append('\'')
                .append('=').append(NumberFormats.format(value));
        if (unit != null) {
            sb.append(unit);
        }
        sb.append(';');
        if (warning != null) {
            sb.append(warning);
        }
        sb.append(';');
        if (critical != null) {
            sb.append(critical);
        }
        sb.append(';');
        if (minimum != null) {
            sb.append(NumberFormats.format(minimum));
        }
        sb.append(';');
        if (maximum != null) {
            sb.append(NumberFormats.format(maximum));
        }
        return sb.toString();
    }

    private static void validateLabel(String label) {
        if (label == null || label.isEmpty()) {
            throw new InvalidPerfdataLabelException(label, "Perfdata label must not be empty");
        }
        if (label.indexOf('=') >= 0) {
            throw new InvalidPerfdataLabelException(label,
                    "Perfdata label must not contain '=', got: '" + label + "'");
        }
        if (label.indexOf('\n') >= 0 || label.indexOf('\r') >= 0) {
            throw new InvalidPerfdataLabelException(label, "Perfdata label must not contain line breaks");
        }
    }

    private static void validateField(String field, String text) {
        if (text == null) {
            return;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ';' || c == '\'' || Character.isWhitespace(c)) {
                throw new IllegalArgumentException(
                        "Perfdata " + field + " must not contain ';', quotes or whitespace, got: '" + text + "'");
            }
        }
    }

    public static Builder builder(String label, Number value) {
        return new Builder(label, value);
    }

    public static class Builder {
        private final String label;
        private final Number value;
        private String unit;
        private String warning;
        private String critical;
        private Number minimum;
        private Number maximum;

        private Builder(String label, Number value) {
            this.label = label;
            this.value = value;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        public Builder warning(String warning) {
            this.warning = warning;
            return this;
        }

        public Builder warning(ThresholdRange warning) {
            this.warning = warning != null ? warning.toCanonicalString() : null;
            return this;
        }

        public Builder critical(String critical) {
            this.critical = critical;
            return this;
        }

        public Builder critical(ThresholdRange critical) {
            this.critical = critical != null ? critical.toCanonicalString() : null;
            return this;
        }

        public Builder minimum(Number minimum) {
            this.minimum = minimum;
            return this;
        }

        public Builder maximum(Number maximum) {
            this.maximum = maximum;
            return this;
        }

        public PerfDatum build() {
            return new PerfDatum(label, value, unit, warning, critical, minimum, maximum);
        }
    }
}
