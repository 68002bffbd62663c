package gr.imsi.athenarc.tsdb.schema;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;

import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Constraints on one tag of a measurement. Lengths are counted in chars.
 */
public class TagDefinition {

    private final boolean required;
    @Nullable
    private final Set<String> allowedValues;
    @Nullable
    private final Integer minLength;
    @Nullable
    private final Integer maxLength;
    @Nullable
    private final Pattern pattern;

    private TagDefinition(Builder builder) {
        this.required = builder.required;
        this.allowedValues = builder.allowedValues;
        this.minLength = builder.minLength;
        this.maxLength = builder.maxLength;
        this.pattern = builder.pattern;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isRequired() {
        return required;
    }

    @Nullable
    public Set<String> getAllowedValues() {
        return allowedValues;
    }

    public boolean validateValue(@Nullable String value) {
        if (value == null) {
            return !required;
        }
        if (allowedValues != null && !allowedValues.contains(value)) {
            return false;
        }
        if (minLength != null && value.length() < minLength) {
            return false;
        }
        if (maxLength != null && value.length() > maxLength) {
            return false;
        }
        return pattern == null || pattern.matcher(value).find();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .omitNullValues()
            .add("required", required)
            .add("allowedValues", allowedValues)
            .add("minLength", minLength)
            .add("maxLength", maxLength)
            .add("pattern", pattern)
            .toString();
    }

    public static class Builder {
        private boolean required;
        private Set<String> allowedValues;
        private Integer minLength;
        private Integer maxLength;
        private Pattern pattern;

        public Builder required() {
            this.required = true;
            return this;
        }

        public Builder allowedValues(Collection<String> allowedValues) {
            this.allowedValues = ImmutableSet.copyOf(allowedValues);
            return this;
        }

        public Builder minLength(int minLength) {
            this.minLength = minLength;
            return this;
        }

        public Builder maxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder pattern(String regex) {
            this.pattern = Pattern.compile(regex);
            return this;
        }

        public TagDefinition build() {
            return new TagDefinition(this);
        }
    }
}
