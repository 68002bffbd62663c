package gr.imsi.athenarc.tsdb.schema;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.tsdb.datasource.TimeSeriesWriter;
import gr.imsi.athenarc.tsdb.domain.DataPoint;

import java.util.List;
import java.util.Map;

/**
 * Checks points against the registry before handing them to the wrapped
 * writer. Declared fields missing from a point get their default value first.
 * Measurements without a schema are written unchecked.
 */
public class SchemaValidatingWriter implements TimeSeriesWriter {

    private final TimeSeriesWriter delegate;
    private final SchemaRegistry registry;

    public SchemaValidatingWriter(TimeSeriesWriter delegate, SchemaRegistry registry) {
        this.delegate = Preconditions.checkNotNull(delegate, "delegate");
        this.registry = Preconditions.checkNotNull(registry, "registry");
    }

    /**
     * @throws gr.imsi.athenarc.tsdb.exception.SchemaException if the point does not match its schema
     */
    @Override
    public boolean write(DataPoint dataPoint) {
        check(dataPoint);
        return delegate.write(dataPoint);
    }

    /**
     * Every point is checked before any is written.
     */
    @Override
    public boolean writeBatch(List<DataPoint> dataPoints) {
        for (DataPoint dataPoint : dataPoints) {
            check(dataPoint);
        }
        return delegate.writeBatch(dataPoints);
    }

    private void check(DataPoint dataPoint) {
        if (!registry.measurementExists(dataPoint.getMeasurement())) {
            return;
        }
        MeasurementSchema schema = registry.getMeasurementSchema(dataPoint.getMeasurement());
        for (Map.Entry<String, FieldDefinition> field : schema.getFields().entrySet()) {
            Object defaultValue = field.getValue().getDefaultValue();
            if (defaultValue != null && dataPoint.getFields().get(field.getKey()) == null) {
                dataPoint.addField(field.getKey(), defaultValue);
            }
        }
        registry.checkValid(dataPoint);
    }
}
