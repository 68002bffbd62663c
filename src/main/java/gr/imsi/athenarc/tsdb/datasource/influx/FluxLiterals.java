package gr.imsi.athenarc.tsdb.datasource.influx;

import gr.imsi.athenarc.tsdb.domain.DateTimeUtil;
import gr.imsi.athenarc.tsdb.exception.RawQueryException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Date;

/**
 * Renders Java values as Flux literals.
 */
final class FluxLiterals {

    private FluxLiterals() {
    }

    static String format(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence) {
            return quote(value.toString());
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "true" : "false";
        }
        if (value instanceof Instant) {
            return "time(v: \"" + DateTimeUtil.formatIso((Instant) value) + "\")";
        }
        if (value instanceof ZonedDateTime) {
            return format(((ZonedDateTime) value).toInstant());
        }
        if (value instanceof OffsetDateTime) {
            return format(((OffsetDateTime) value).toInstant());
        }
        if (value instanceof Date) {
            return format(((Date) value).toInstant());
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
            || value instanceof Byte || value instanceof BigInteger) {
            return value.toString();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new RawQueryException("Unsupported numeric value: " + value, null);
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).stripTrailingZeros().toPlainString();
        }
        throw new RawQueryException("Unsupported value type: " + value.getClass().getName(), null);
    }

    /**
     * Double-quoted string with backslashes and quotes escaped.
     */
    static String quote(String s) {
        return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
