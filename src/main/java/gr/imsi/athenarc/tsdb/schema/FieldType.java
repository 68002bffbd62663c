package gr.imsi.athenarc.tsdb.schema;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Value types a field can be declared with.
 */
public enum FieldType {
    FLOAT,
    INTEGER,
    STRING,
    BOOLEAN;

    /**
     * Whether the value fits the type. Integers are accepted for float fields.
     */
    public boolean accepts(Object value) {
        switch (this) {
            case FLOAT:
                return value instanceof Number;
            case INTEGER:
                return value instanceof Integer || value instanceof Long || value instanceof Short
                    || value instanceof Byte || value instanceof BigInteger;
            case STRING:
                return value instanceof CharSequence;
            case BOOLEAN:
                return value instanceof Boolean;
            default:
                return false;
        }
    }

    static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof BigInteger) {
            return new BigDecimal((BigInteger) number);
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return BigDecimal.valueOf(number.longValue());
    }
}
