package gr.imsi.athenarc.tsdb.schema;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;

import gr.imsi.athenarc.tsdb.domain.DataPoint;
import gr.imsi.athenarc.tsdb.exception.SchemaException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Measurement schemas known to the application, and validation of data points
 * against them.
 */
public class SchemaRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaRegistry.class);

    private final Map<String, MeasurementSchema> schemas = new ConcurrentHashMap<>();

    /**
     * @throws SchemaException if the measurement already has a schema
     */
    public void createMeasurement(MeasurementSchema schema) {
        Preconditions.checkNotNull(schema, "schema");
        LOG.info("Creating measurement: {}", schema.getName());
        if (schemas.putIfAbsent(schema.getName(), schema) != null) {
            LOG.error("Error creating measurement '{}': already exists", schema.getName());
            throw new SchemaException("Measurement '" + schema.getName() + "' already exists");
        }
    }

    /**
     * @throws SchemaException if the measurement has no schema yet
     */
    public void updateMeasurement(MeasurementSchema schema) {
        Preconditions.checkNotNull(schema, "schema");
        LOG.info("Updating measurement: {}", schema.getName());
        if (schemas.replace(schema.getName(), schema) == null) {
            LOG.error("Error updating measurement '{}': does not exist", schema.getName());
            throw new SchemaException("Measurement '" + schema.getName() + "' does not exist");
        }
    }

    public boolean measurementExists(String measurement) {
        return schemas.containsKey(measurement);
    }

    public Set<String> listMeasurements() {
        return ImmutableSortedSet.copyOf(schemas.keySet());
    }

    /**
     * @throws SchemaException if the measurement has no schema
     */
    public MeasurementSchema getMeasurementSchema(String measurement) {
        MeasurementSchema schema = schemas.get(measurement);
        if (schema == null) {
            throw new SchemaException("Measurement '" + measurement + "' does not exist");
        }
        return schema;
    }

    /**
     * Checks the point's fields and tags against the schema of its measurement.
     * Fields and tags the schema does not declare are not checked.
     *
     * @throws SchemaException if the measurement has no schema
     */
    public SchemaValidationResult validate(DataPoint dataPoint) {
        LOG.debug("Validating data against schema for measurement: {}", dataPoint.getMeasurement());
        MeasurementSchema schema = getMeasurementSchema(dataPoint.getMeasurement());
        SchemaValidationResult result = new SchemaValidationResult();
        for (Map.Entry<String, FieldDefinition> field : schema.getFields().entrySet()) {
            String name = field.getKey();
            Object value = dataPoint.getFields().get(name);
            if (value == null && field.getValue().isRequired()) {
                result.addError(name, "Required field '" + name + "' is missing");
            } else if (!field.getValue().validateValue(value)) {
                result.addError(name, "Invalid value for field '" + name + "' of type '"
                    + field.getValue().getType().name().toLowerCase(Locale.ROOT) + "'");
            }
        }
        for (Map.Entry<String, TagDefinition> tag : schema.getTags().entrySet()) {
            String name = tag.getKey();
            String value = dataPoint.getTags().get(name);
            if (value == null && tag.getValue().isRequired()) {
                result.addError(name, "Required tag '" + name + "' is missing");
            } else if (!tag.getValue().validateValue(value)) {
                result.addError(name, "Invalid value for tag '" + name + "'");
            }
        }
        return result;
    }

    /**
     * @throws SchemaException if the point does not match its measurement's schema
     */
    public void checkValid(DataPoint dataPoint) {
        SchemaValidationResult result = validate(dataPoint);
        if (!result.isValid()) {
            throw new SchemaException("Data point for measurement '" + dataPoint.getMeasurement()
                + "' does not match its schema: " + result.getErrors());
        }
    }
}
