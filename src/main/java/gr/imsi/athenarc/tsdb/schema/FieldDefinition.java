package gr.imsi.athenarc.tsdb.schema;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Declared type and constraints of one field of a measurement. {@code min}
 * and {@code max} bound numbers by value and strings by length.
 */
public class FieldDefinition {

    private final FieldType type;
    private final boolean required;
    @Nullable
    private final Object defaultValue;
    @Nullable
    private final Number min;
    @Nullable
    private final Number max;
    @Nullable
    private final Pattern pattern;
    @Nullable
    private final List<Object> allowedValues;

    private FieldDefinition(Builder builder) {
        this.type = builder.type;
        this.required = builder.required;
        this.defaultValue = builder.defaultValue;
        this.min = builder.min;
        this.max = builder.max;
        this.pattern = builder.pattern;
        this.allowedValues = builder.allowedValues;
    }

    public static Builder builder(FieldType type) {
        return new Builder(type);
    }

    public FieldType getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    @Nullable
    public Object getDefaultValue() {
        return defaultValue;
    }

    /**
     * A missing value is valid unless the field is required.
     */
    public boolean validateValue(@Nullable Object value) {
        if (value == null) {
            return !required;
        }
        if (!type.accepts(value)) {
            return false;
        }
        if (min != null && compare(value, min) < 0) {
            return false;
        }
        if (max != null && compare(value, max) > 0) {
            return false;
        }
        if (pattern != null && !(type == FieldType.STRING && pattern.matcher(value.toString()).find())) {
            return false;
        }
        return allowedValues == null || allowedValues.contains(value);
    }

    private int compare(Object value, Number bound) {
        switch (type) {
            case FLOAT:
            case INTEGER:
                return FieldType.toDecimal((Number) value).compareTo(FieldType.toDecimal(bound));
            case STRING:
                return Integer.compare(value.toString().length(), bound.intValue());
            default:
                return 0;
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .omitNullValues()
            .add("type", type)
            .add("required", required)
            .add("min", min)
            .add("max", max)
            .add("pattern", pattern)
            .add("allowedValues", allowedValues)
            .toString();
    }

    public static class Builder {
        private final FieldType type;
        private boolean required;
        private Object defaultValue;
        private Number min;
        private Number max;
        private Pattern pattern;
        private List<Object> allowedValues;

        private Builder(FieldType type) {
            this.type = Preconditions.checkNotNull(type, "type");
        }

        public Builder required() {
            this.required = true;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder min(Number min) {
            this.min = min;
            return this;
        }

        public Builder max(Number max) {
            this.max = max;
            return this;
        }

        public Builder pattern(String regex) {
            this.pattern = Pattern.compile(regex);
            return this;
        }

        public Builder allowedValues(List<?> allowedValues) {
            this.allowedValues = ImmutableList.copyOf(allowedValues);
            return this;
        }

        public FieldDefinition build() {
            return new FieldDefinition(this);
        }
    }
}
