package gr.imsi.athenarc.tsdb.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validation errors keyed by field or tag name; empty when the data is valid.
 */
public class SchemaValidationResult {

    private final Map<String, String> errors = new LinkedHashMap<>();

    public SchemaValidationResult addError(String name, String message) {
        errors.put(name, message);
        return this;
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public Map<String, String> getErrors() {
        return Collections.unmodifiableMap(errors);
    }

    public String getError(String name) {
        return errors.get(name);
    }

    @Override
    public String toString() {
        return isValid() ? "valid" : "invalid " + errors;
    }
}
