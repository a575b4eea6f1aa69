package com.monitoring.plugin.threshold;

import com.monitoring.plugin.core.NumberFormats;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A threshold range as described by the monitoring-plugins development guidelines.
 *
 * <p>Syntax: {@code [@][start:][end]}</p>
 * <ul>
 *   <li>{@code 10} is {@code 0:10}: alarm when below 0 or above 10</li>
 *   <li>{@code 10:} alarms when below 10 (no upper bound)</li>
 *   <li>{@code :10} and {@code ~:10} alarm when above 10 (no lower bound)</li>
 *   <li>{@code 10:20} alarms when outside {@code [10, 20]}</li>
 *   <li>a leading {@code @} alarms when the value is inside the range instead</li>
 * </ul>
 *
 * <p>Both bounds are inclusive. Instances are immutable and can be shared.</p>
 */
public final class ThresholdRange {

    private static final String NUMBER = "[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)";
    private static final Pattern SYNTAX = Pattern.compile(
            "^(?<inverted>@)?(?:(?<start>~|" + NUMBER + ")?(?<colon>:))?(?<end>" + NUMBER + ")?$");

    private final double lowerBound;
    private final double upperBound;
    private final boolean inverted;
    private final String expression;

    private ThresholdRange(double lowerBound, double upperBound, boolean inverted, String expression) {
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.inverted = inverted;
        this.expression = expression;
    }

    /**
     * Parses a threshold expression.
     *
     * @param expression the range expression, e.g. {@code "@10:20"}
     * @return the parsed range, remembering the original text
     * @throws InvalidThresholdFormatException if the expression is empty, malformed,
     *                                         or its start is greater than its end
     */
    public static ThresholdRange parse(String expression) {
        if (expression == null || expression.isEmpty()) {
            throw new InvalidThresholdFormatException(expression, "Threshold expression must not be empty");
        }
        Matcher matcher = SYNTAX.matcher(expression);
        if (!matcher.matches()) {
            throw new InvalidThresholdFormatException(expression,
                    "Threshold expression '" + expression + "' does not match [@][start:][end]");
        }

        boolean inverted = matcher.group("inverted") != null;
        boolean hasColon = matcher.group("colon") != null;
        String start = matcher.group("start");
        String end = matcher.group("end");

        if (end == null && (!hasColon || start == null)) {
            throw new InvalidThresholdFormatException(expression,
                    "Threshold expression '" + expression + "' has no bound");
        }

        double lower;
        if (!hasColon) {
            lower = 0.0;
        } else if (start == null || "~".equals(start)) {
            lower = Double.NEGATIVE_INFINITY;
        } else {
            lower = toDouble(expression, start);
        }
        double upper = end != null ? toDouble(expression, end) : Double.POSITIVE_INFINITY;

        if (lower > upper) {
            throw new InvalidThresholdFormatException(expression,
                    "Threshold expression '" + expression + "' has start greater than end");
        }
        return new ThresholdRange(lower, upper, inverted, expression);
    }

    /**
     * Builds a range from explicit bounds. Use {@link Double#NEGATIVE_INFINITY} and
     * {@link Double#POSITIVE_INFINITY} for unbounded ends.
     *
     * @throws IllegalArgumentException if a bound is NaN or {@code lowerBound > upperBound}
     */
    public static ThresholdRange of(double lowerBound, double upperBound, boolean inverted) {
        if (Double.isNaN(lowerBound) || Double.isNaN(upperBound)) {
            throw new IllegalArgumentException("Threshold bounds must not be NaN");
        }
        if (lowerBound > upperBound) {
            throw new IllegalArgumentException(
                    "lowerBound must be <= upperBound (was " + lowerBound + " > " + upperBound + ")");
        }
        return new ThresholdRange(lowerBound, upperBound, inverted, null);
    }

    /**
     * Returns whether the value raises an alarm against this range.
     * Without inversion that means outside {@code [lower, upper]}; with inversion, inside it.
     * NaN never raises an alarm.
     */
    public boolean contains(double value) {
        if (inverted) {
            return lowerBound <= value && value <= upperBound;
        }
        return value < lowerBound || value > upperBound;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public boolean isInverted() {
        return inverted;
    }

    /**
     * The text this range was parsed from, or null when built with {@link #of}.
     */
    public String expression() {
        return expression;
    }

    /**
     * Renders the bounds as {@code [@]start:end}, with {@code ~} for an unbounded
     * start and nothing for an unbounded end.
     */
    public String toCanonicalString() {
        StringBuilder sb = new StringBuilder();
        if (inverted) {
            sb.append('@');
        }
        sb.append(lowerBound == Double.NEGATIVE_INFINITY ? "~" : NumberFormats.format(lowerBound));
        sb.append(':');
        if (upperBound != Double.POSITIVE_INFINITY) {
            sb.append(NumberFormats.format(upperBound));
        }
        return sb.toString();
    }

    private static double toDouble(String expression, String number) {
        try {
            return Double.parseDouble(number);
        } catch (NumberFormatException e) {
            throw new InvalidThresholdFormatException(expression,
                    "Malformed number '" + number + "' in threshold expression '" + expression + "'", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ThresholdRange that = (ThresholdRange) o;
        return Double.compare(lowerBound, that.lowerBound) == 0
                && Double.compare(upperBound, that.upperBound) == 0
                && inverted == that.inverted;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lowerBound, upperBound, inverted);
    }

    /**
     * The original expression when parsed, otherwise the canonical form.
     */
    @Override
    public String toString() {
        return expression != null ? expression : toCanonicalString();
    }
}
