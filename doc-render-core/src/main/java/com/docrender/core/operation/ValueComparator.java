package com.docrender.core.operation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Comparator;

/**
 * Total order over dynamically typed cell values.
 *
 * <p>Values are ranked by kind first: {@code null}, booleans, numbers, strings, then everything
 * else. Within a kind, booleans order {@code false} before {@code true}, numbers numerically
 * regardless of boxed type (negative infinity first, NaN last), strings lexicographically. Other
 * values are grouped by class name, then ordered naturally when {@link Comparable} and by
 * {@link String#valueOf(Object)} otherwise.
 */
public final class ValueComparator implements Comparator<Object> {

    public static final ValueComparator INSTANCE = new ValueComparator();

    private static final int RANK_NULL = 0;
    private static final int RANK_BOOLEAN = 1;
    private static final int RANK_NUMBER = 2;
    private static final int RANK_STRING = 3;
    private static final int RANK_OTHER = 4;

    private ValueComparator() {
    }

    @Override
    public int compare(Object left, Object right) {
        if (left == right) {
            return 0;
        }
        int rank = Integer.compare(rank(left), rank(right));
        if (rank != 0) {
            return rank;
        }
        if (left instanceof Boolean a && right instanceof Boolean b) {
            return Boolean.compare(a, b);
        }
        if (left instanceof Number a && right instanceof Number b) {
            return compareNumbers(a, b);
        }
        if (left instanceof String a && right instanceof String b) {
            return a.compareTo(b);
        }
        return compareOther(left, right);
    }

    private static int rank(Object value) {
        if (value == null) {
            return RANK_NULL;
        }
        if (value instanceof Boolean) {
            return RANK_BOOLEAN;
        }
        if (value instanceof Number) {
            return RANK_NUMBER;
        }
        if (value instanceof String) {
            return RANK_STRING;
        }
        return RANK_OTHER;
    }

    private static int compareOther(Object left, Object right) {
        if (left.getClass() != right.getClass()) {
            return left.getClass().getName().compareTo(right.getClass().getName());
        }
        if (left instanceof Comparable<?>) {
            @SuppressWarnings("unchecked")
            Comparable<Object> comparable = (Comparable<Object>) left;
            return comparable.compareTo(right);
        }
        return String.valueOf(left).compareTo(String.valueOf(right));
    }

    private static int compareNumbers(Number a, Number b) {
        int category = Integer.compare(category(a), category(b));
        if (category != 0 || category(a) != 0) {
            return category;
        }
        return toBigDecimal(a).compareTo(toBigDecimal(b));
    }

    /**
     * -1 for negative infinity, 0 for finite values, 1 for positive infinity, 2 for NaN.
     */
    private static int category(Number n) {
        if (!isFloating(n)) {
            return 0;
        }
        double value = n.doubleValue();
        if (Double.isNaN(value)) {
            return 2;
        }
        if (Double.isInfinite(value)) {
            return value < 0 ? -1 : 1;
        }
        return 0;
    }

    private static boolean isFloating(Number n) {
        return n instanceof Double || n instanceof Float;
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal decimal) {
            return decimal;
        }
        if (n instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (isFloating(n)) {
            return new BigDecimal(n.doubleValue());
        }
        return BigDecimal.valueOf(n.longValue());
    }
}
