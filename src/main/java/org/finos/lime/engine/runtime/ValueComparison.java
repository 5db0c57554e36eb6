package org.finos.lime.engine.runtime;

import java.util.List;

/**
 * Equality and ordering used by the comparison builtins.
 *
 * Values of different kinds are never equal and never ordered. Functions are
 * equal only to themselves and have no order.
 */
public final class ValueComparison {

    private ValueComparison() {
        // Static utility class
    }

    public static boolean equal(LimeValue left, LimeValue right) {
        if (left instanceof NumberValue a && right instanceof NumberValue b) {
            return a.value() == b.value();
        }
        if (left instanceof StringValue a && right instanceof StringValue b) {
            return a.value().equals(b.value());
        }
        if (left instanceof ListValue a && right instanceof ListValue b) {
            if (a.size() != b.size()) {
                return false;
            }
            for (int i = 0; i < a.size(); i++) {
                if (!equal(a.elements().get(i), b.elements().get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (left instanceof NoneValue && right instanceof NoneValue) {
            return true;
        }
        return left == right;
    }

    public static boolean lessThan(LimeValue left, LimeValue right) {
        Integer order = compare(left, right);
        return order != null && order < 0;
    }

    public static boolean greaterThan(LimeValue left, LimeValue right) {
        Integer order = compare(left, right);
        return order != null && order > 0;
    }

    /**
     * Orders two values of the same comparable kind.
     *
     * @return negative, zero or positive; null when the pair has no order
     *         (or involves NaN)
     */
    private static Integer compare(LimeValue left, LimeValue right) {
        if (left instanceof NumberValue a && right instanceof NumberValue b) {
            if (Double.isNaN(a.value()) || Double.isNaN(b.value())) {
                return null;
            }
            return a.value() < b.value() ? -1 : (a.value() > b.value() ? 1 : 0);
        }
        if (left instanceof StringValue a && right instanceof StringValue b) {
            return compareCodePoints(a.value(), b.value());
        }
        if (left instanceof ListValue a && right instanceof ListValue b) {
            return compareLists(a.elements(), b.elements());
        }
        return null;
    }

    private static Integer compareLists(List<LimeValue> left, List<LimeValue> right) {
        int shared = Math.min(left.size(), right.size());
        for (int i = 0; i < shared; i++) {
            if (equal(left.get(i), right.get(i))) {
                continue;
            }
            return compare(left.get(i), right.get(i));
        }
        return Integer.compare(left.size(), right.size());
    }

    private static int compareCodePoints(String left, String right) {
        int[] a = left.codePoints().toArray();
        int[] b = right.codePoints().toArray();
        int shared = Math.min(a.length, b.length);
        for (int i = 0; i < shared; i++) {
            if (a[i] != b[i]) {
                return Integer.compare(a[i], b[i]);
            }
        }
        return Integer.compare(a.length, b.length);
    }
}
