package io.github.yok.flexbackup.core;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Comparator;
import java.util.List;

/**
 * Orders {@link ExportedRow}s by a list of key columns.
 *
 * <p>
 * Keys are compared in priority order. Numbers compare numerically, strings lexicographically,
 * {@code null} sorts first; values of different kinds fall back to comparing their text.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
final class RowKeyComparator implements Comparator<ExportedRow> {

    private final List<String> keys;

    RowKeyComparator(List<String> keys) {
        this.keys = ImmutableList.copyOf(keys);
    }

    @Override
    public int compare(ExportedRow a, ExportedRow b) {
        for (String key : keys) {
            int cmp = compareValues(a.get(key), b.get(key));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    static int compareValues(Object a, Object b) {
        if (a == null || b == null) {
            if (a == b) {
                return 0;
            }
            return (a == null) ? -1 : 1;
        }
        if (a instanceof Number && b instanceof Number) {
            return compareNumbers((Number) a, (Number) b);
        }
        if (a instanceof String && b instanceof String) {
            return ((String) a).compareTo((String) b);
        }
        if (a instanceof Boolean && b instanceof Boolean) {
            return Boolean.compare((Boolean) a, (Boolean) b);
        }
        return a.toString().compareTo(b.toString());
    }

    private static int compareNumbers(Number a, Number b) {
        if (isNonFinite(a) || isNonFinite(b)) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        return toBigDecimal(a).compareTo(toBigDecimal(b));
    }

    private static boolean isNonFinite(Number n) {
        return (n instanceof Double || n instanceof Float) && !Double.isFinite(n.doubleValue());
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal) {
            return (BigDecimal) n;
        }
        if (n instanceof BigInteger) {
            return new BigDecimal((BigInteger) n);
        }
        if (n instanceof Double || n instanceof Float) {
            return BigDecimal.valueOf(n.doubleValue());
        }
        return BigDecimal.valueOf(n.longValue());
    }
}
