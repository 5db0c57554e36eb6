package org.finos.lime.engine.runtime;

import java.math.BigDecimal;

/**
 * Double-precision number.
 */
public record NumberValue(double value) implements LimeValue {

    public static NumberValue of(double value) {
        return new NumberValue(value);
    }

    @Override
    public String kindName() {
        return "number";
    }

    @Override
    public String display() {
        return format(value);
    }

    /**
     * True when the value is a whole number that fits an index or count.
     */
    public boolean isIntegral() {
        return !Double.isInfinite(value) && value == Math.rint(value) && Math.abs(value) <= Integer.MAX_VALUE;
    }

    /**
     * Canonical text of a number: shortest decimal form, no trailing ".0",
     * scientific notation only for very large or very small magnitudes.
     */
    public static String format(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
        double magnitude = Math.abs(value);
        if (magnitude >= 1e21 || magnitude < 1e-6) {
            return exponentForm(decimal.toString());
        }
        return decimal.toPlainString();
    }

    /**
     * Rewrites BigDecimal's "1.5E-7" as "1.5e-07": lower-case marker, explicit
     * sign, at least two exponent digits.
     */
    private static String exponentForm(String scientific) {
        int marker = scientific.indexOf('E');
        if (marker < 0) {
            return scientific;
        }
        String exponent = scientific.substring(marker + 1);
        char sign = '+';
        if (exponent.charAt(0) == '+' || exponent.charAt(0) == '-') {
            sign = exponent.charAt(0);
            exponent = exponent.substring(1);
        }
        if (exponent.length() < 2) {
            exponent = "0" + exponent;
        }
        return scientific.substring(0, marker) + 'e' + sign + exponent;
    }
}
