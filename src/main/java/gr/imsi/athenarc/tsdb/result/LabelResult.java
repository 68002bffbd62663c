package gr.imsi.athenarc.tsdb.result;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Flat list of names returned by schema-discovery queries (measurements, tag values).
 */
public class LabelResult implements QueryResult {

    private final List<String> values;
    private final Map<String, Object> metadata;

    public LabelResult(List<String> values, Map<String, Object> metadata) {
        this.values = ImmutableList.copyOf(values);
        this.metadata = ImmutableMap.copyOf(metadata);
    }

    public LabelResult(List<String> values) {
        this(values, Collections.<String, Object>emptyMap());
    }

    public static LabelResult empty() {
        return new LabelResult(Collections.<String>emptyList());
    }

    public List<String> getValues() {
        return values;
    }

    @Override
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        return "LabelResult{values=" + values + '}';
    }
}
