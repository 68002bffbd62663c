package gr.imsi.athenarc.tsdb.schema;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import gr.imsi.athenarc.tsdb.exception.SchemaException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The declared fields and tags of one measurement.
 */
public class MeasurementSchema {

    private final String name;
    private final Map<String, FieldDefinition> fields = new LinkedHashMap<>();
    private final Map<String, TagDefinition> tags = new LinkedHashMap<>();

    public MeasurementSchema(String name) {
        Preconditions.checkArgument(name != null && !name.isEmpty(), "Schema must have a name");
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public MeasurementSchema addField(String field, FieldDefinition definition) {
        fields.put(Preconditions.checkNotNull(field, "field"), Preconditions.checkNotNull(definition, "definition"));
        return this;
    }

    public MeasurementSchema addTag(String tag, TagDefinition definition) {
        tags.put(Preconditions.checkNotNull(tag, "tag"), Preconditions.checkNotNull(definition, "definition"));
        return this;
    }

    public Map<String, FieldDefinition> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public Map<String, TagDefinition> getTags() {
        return Collections.unmodifiableMap(tags);
    }

    public boolean hasField(String field) {
        return fields.containsKey(field);
    }

    public boolean hasTag(String tag) {
        return tags.containsKey(tag);
    }

    /**
     * @throws SchemaException if the field is not declared
     */
    public FieldDefinition getField(String field) {
        FieldDefinition definition = fields.get(field);
        if (definition == null) {
            throw new SchemaException("Field '" + field + "' does not exist in measurement '" + name + "'");
        }
        return definition;
    }

    /**
     * @throws SchemaException if the tag is not declared
     */
    public TagDefinition getTag(String tag) {
        TagDefinition definition = tags.get(tag);
        if (definition == null) {
            throw new SchemaException("Tag '" + tag + "' does not exist in measurement '" + name + "'");
        }
        return definition;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("name", name)
            .add("fields", fields)
            .add("tags", tags)
            .toString();
    }
}
