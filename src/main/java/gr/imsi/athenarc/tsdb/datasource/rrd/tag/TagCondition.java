package gr.imsi.athenarc.tsdb.datasource.rrd.tag;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import gr.imsi.athenarc.tsdb.datasource.rrd.RrdException;
import gr.imsi.athenarc.tsdb.query.ComparisonOperator;
import gr.imsi.athenarc.tsdb.query.Condition;
import gr.imsi.athenarc.tsdb.query.LogicalType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A condition on a tag encoded in an RRD file path. Values are compared in
 * their sanitized form, so "us-east" matches a file tagged "us.east".
 */
public class TagCondition {

    private final String tag;
    private final ComparisonOperator operator;
    private final List<Object> values;
    private final LogicalType logicalType;

    public TagCondition(String tag, ComparisonOperator operator, Object value, LogicalType logicalType) {
        this.tag = Preconditions.checkNotNull(tag, "tag");
        this.operator = Preconditions.checkNotNull(operator, "operator");
        this.logicalType = logicalType == null ? LogicalType.AND : logicalType;
        if (value instanceof Collection) {
            this.values = Collections.unmodifiableList(new ArrayList<>((Collection<?>) value));
        } else {
            this.values = Collections.singletonList(value);
        }
    }

    public TagCondition(String tag, ComparisonOperator operator, Object value) {
        this(tag, operator, value, LogicalType.AND);
    }

    public static TagCondition equalTo(String tag, String value) {
        return new TagCondition(tag, ComparisonOperator.EQUALS, value);
    }

    public static TagCondition of(Condition condition) {
        Object value = condition.isArrayValue() ? condition.getValues() : condition.getScalarValue();
        return new TagCondition(condition.getField(), condition.getOperator(), value, condition.getLogicalType());
    }

    public static boolean supports(ComparisonOperator operator) {
        switch (operator) {
            case EQUALS:
            case SAME:
            case IN:
            case NOT_IN:
            case REGEX:
            case BETWEEN:
                return true;
            default:
                return false;
        }
    }

    public String getTag() {
        return tag;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public List<Object> getValues() {
        return values;
    }

    public LogicalType getLogicalType() {
        return logicalType;
    }

    public boolean isEquality() {
        return operator == ComparisonOperator.EQUALS || operator == ComparisonOperator.SAME;
    }

    public String getStringValue() {
        return values.isEmpty() || values.get(0) == null ? "" : String.valueOf(values.get(0));
    }

    /**
     * @throws RrdException for operators a file path cannot answer
     */
    public boolean matches(String value) {
        String actual = TagEncoding.sanitizeTagValue(value);
        switch (operator) {
            case EQUALS:
            case SAME:
                return TagEncoding.sanitizeTagValue(getStringValue()).equals(actual);
            case IN:
                return sanitizedValues().contains(actual);
            case NOT_IN:
                return !sanitizedValues().contains(actual);
            case REGEX:
                return Pattern.compile(getStringValue()).matcher(actual).find();
            case BETWEEN:
                Preconditions.checkState(values.size() == 2, "BETWEEN needs two values");
                return compare(value, values.get(0)) >= 0 && compare(value, values.get(1)) <= 0;
            default:
                throw new RrdException("Operator " + operator.getToken() + " not supported");
        }
    }

    private List<String> sanitizedValues() {
        List<String> sanitized = new ArrayList<>(values.size());
        for (Object v : values) {
            sanitized.add(TagEncoding.sanitizeTagValue(String.valueOf(v)));
        }
        return sanitized;
    }

    private static int compare(String actual, Object bound) {
        String other = String.valueOf(bound);
        try {
            return Double.compare(Double.parseDouble(actual), Double.parseDouble(other));
        } catch (NumberFormatException e) {
            return actual.compareTo(other);
        }
    }

    /**
     * All AND conditions must hold and, when there are OR conditions, at least
     * one of them. A condition on a tag the file does not carry fails.
     */
    public static boolean search(Map<String, String> tags, List<TagCondition> conditions) {
        boolean anyOr = false;
        boolean orMatched = false;
        for (TagCondition condition : conditions) {
            boolean matched = tags.containsKey(condition.tag) && condition.matches(tags.get(condition.tag));
            if (condition.logicalType == LogicalType.OR) {
                anyOr = true;
                orMatched |= matched;
            } else if (!matched) {
                return false;
            }
        }
        return !anyOr || orMatched;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("tag", tag)
            .add("operator", operator)
            .add("values", values)
            .add("logicalType", logicalType)
            .toString();
    }
}
