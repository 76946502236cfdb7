package io.xsdbind.core.facet;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Ordering and equality over native values. Numbers compare by numeric value regardless of their
 * Java class; temporal values without a timezone compare as if they were in UTC.
 */
public final class ValueOrder {

    private ValueOrder() {}

    /**
     * Compares two native values.
     *
     * @return negative, zero or positive as {@code a} is less than, equal to or greater than
     *     {@code b}; {@code null} if the values are not comparable (different value spaces, NaN)
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static Integer compare(Object a, Object b) {
        if (a == null || b == null) {
            return null;
        }
        if (a instanceof Number na && b instanceof Number nb) {
            if (isFloating(na) || isFloating(nb)) {
                double da = na.doubleValue();
                double db = nb.doubleValue();
                if (Double.isNaN(da) || Double.isNaN(db)) {
                    return null;
                }
                return Double.compare(da, db);
            }
            return toBigDecimal(na).compareTo(toBigDecimal(nb));
        }
        Object ta = temporalKey(a);
        Object tb = temporalKey(b);
        if (ta != null && tb != null) {
            if (ta.getClass() != tb.getClass()) {
                return null;
            }
            return ((Comparable) ta).compareTo(tb);
        }
        if (a.getClass() == b.getClass() && a instanceof Comparable ca) {
            return ca.compareTo(b);
        }
        return null;
    }

    /** Returns {@code true} if both values denote the same point of their value space. */
    public static boolean sameValue(Object a, Object b) {
        if (Objects.equals(a, b)) {
            return true;
        }
        if (a instanceof Double da && b instanceof Double db) {
            return da.isNaN() && db.isNaN();
        }
        Integer cmp = compare(a, b);
        return cmp != null && cmp == 0;
    }

    static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal bd) {
            return bd;
        }
        if (n instanceof BigInteger bi) {
            return new BigDecimal(bi);
        }
        return new BigDecimal(n.toString());
    }

    private static boolean isFloating(Number n) {
        return n instanceof Double || n instanceof Float;
    }

    private static Object temporalKey(Object v) {
        if (v instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (v instanceof LocalDateTime ldt) {
            return ldt.toInstant(ZoneOffset.UTC);
        }
        if (v instanceof LocalDate ld) {
            return ld.atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        if (v instanceof OffsetTime ot) {
            return ot.withOffsetSameInstant(ZoneOffset.UTC).toLocalTime();
        }
        if (v instanceof LocalTime lt) {
            return lt;
        }
        if (v instanceof Instant i) {
            return i;
        }
        return null;
    }
}
