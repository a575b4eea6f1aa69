package com.monitoring.plugin.core;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Renders numbers the way plugin output expects them: plain notation,
 * no exponent, no trailing zeros ({@code 20.0} becomes {@code 20}).
 */
public final class NumberFormats {

    private NumberFormats() {
        // utility class
    }

    /**
     * Formats a number for plugin output.
     *
     * @throws IllegalArgumentException if the number is NaN or infinite
     */
    public static String format(Number number) {
        if (number instanceof Integer || number instanceof Long
                || number instanceof Short || number instanceof Byte) {
            return number.toString();
        }
        if (number instanceof BigDecimal decimal) {
            return plain(decimal);
        }
        if (number instanceof BigInteger integer) {
            return integer.toString();
        }
        if (number instanceof Float f) {
            // widening to double would expose binary noise (0.1f -> 0.10000000149011612)
            if (f.isNaN() || f.isInfinite()) {
                throw new IllegalArgumentException("Cannot format non-finite number: " + f);
            }
            return plain(new BigDecimal(Float.toString(f)));
        }
        return format(number.doubleValue());
    }

    /**
     * Formats a double for plugin output.
     *
     * @throws IllegalArgumentException if the value is NaN or infinite
     */
    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Cannot format non-finite number: " + value);
        }
        return plain(BigDecimal.valueOf(value));
    }

    private static String plain(BigDecimal decimal) {
        if (decimal.signum() == 0) {
            return "0";
        }
        return decimal.stripTrailingZeros().toPlainString();
    }
}
