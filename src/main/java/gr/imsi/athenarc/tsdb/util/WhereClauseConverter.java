package gr.imsi.athenarc.tsdb.util;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;

import gr.imsi.athenarc.tsdb.query.ComparisonOperator;
import gr.imsi.athenarc.tsdb.query.Condition;

/**
 * Parses {@code field=value} and {@code field!=value} into an AND condition.
 */
public class WhereClauseConverter implements IStringConverter<Condition> {

    @Override
    public Condition convert(String value) {
        int notEquals = value.indexOf("!=");
        if (notEquals > 0) {
            return new Condition(value.substring(0, notEquals).trim(), ComparisonOperator.NOT_EQUALS,
                value.substring(notEquals + 2).trim());
        }
        int equals = value.indexOf('=');
        if (equals <= 0) {
            throw new ParameterException("Expected field=value but got: " + value);
        }
        return new Condition(value.substring(0, equals).trim(), ComparisonOperator.EQUALS,
            value.substring(equals + 1).trim());
    }
}
