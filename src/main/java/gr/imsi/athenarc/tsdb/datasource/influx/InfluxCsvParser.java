package gr.imsi.athenarc.tsdb.datasource.influx;

import com.google.common.collect.ImmutableSet;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;

import gr.imsi.athenarc.tsdb.domain.DateTimeUtil;
import gr.imsi.athenarc.tsdb.exception.QueryException;
import gr.imsi.athenarc.tsdb.query.QueryType;
import gr.imsi.athenarc.tsdb.result.LabelResult;
import gr.imsi.athenarc.tsdb.result.QueryResult;
import gr.imsi.athenarc.tsdb.result.Series;
import gr.imsi.athenarc.tsdb.result.TimeSeriesResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the annotated CSV InfluxDB returns for Flux queries.
 * <p>
 * Annotation rows ({@code #datatype}, {@code #group}, {@code #default}) and
 * blank lines are skipped. A row whose second and third columns read
 * {@code result,table} (re)starts the header, since every table may carry its
 * own header. Data rows are grouped into one series per {@code result|table}.
 */
public class InfluxCsvParser {

    private static final Logger LOG = LoggerFactory.getLogger(InfluxCsvParser.class);

    static final String RESULT = "result";
    static final String TABLE = "table";
    static final String VALUE = "_value";
    static final String TIME = "_time";
    static final String STOP = "_stop";
    static final String MEASUREMENT = "_measurement";
    static final String DEFAULT_RESULT = "_result";

    /** Columns that never become labels. */
    static final Set<String> RESERVED_COLUMNS = ImmutableSet.of(
        "", RESULT, TABLE, "_start", STOP, TIME, VALUE, "_field", MEASUREMENT);

    public QueryResult parse(String csv, QueryType type) {
        return type == QueryType.LABEL ? parseLabels(csv) : parseTimeSeries(csv);
    }

    /**
     * Distinct values of the {@code _value} column in row order, or of the
     * first non-reserved column when there is no {@code _value}.
     */
    public LabelResult parseLabels(String csv) {
        Set<String> values = new LinkedHashSet<>();
        for (Map<String, String> row : rows(csv)) {
            String value = row.get(VALUE);
            if (value == null) {
                for (Map.Entry<String, String> column : row.entrySet()) {
                    if (!RESERVED_COLUMNS.contains(column.getKey())) {
                        value = column.getValue();
                        break;
                    }
                }
            }
            if (value != null && !value.isEmpty()) {
                values.add(value);
            }
        }
        return new LabelResult(new ArrayList<>(values));
    }

    public TimeSeriesResult parseTimeSeries(String csv) {
        Map<String, Series.Builder> series = new LinkedHashMap<>();
        for (Map<String, String> row : rows(csv)) {
            String result = row.getOrDefault(RESULT, "");
            String key = result + "|" + row.getOrDefault(TABLE, "");
            Series.Builder builder = series.get(key);
            if (builder == null) {
                builder = Series.builder(metricName(result, row.get(MEASUREMENT)));
                if (!result.isEmpty()) {
                    builder.alias(result);
                }
                for (Map.Entry<String, String> column : row.entrySet()) {
                    if (!RESERVED_COLUMNS.contains(column.getKey()) && !column.getValue().isEmpty()) {
                        builder.label(column.getKey(), column.getValue());
                    }
                }
                series.put(key, builder);
            }
            builder.point(timestamp(row), value(row.get(VALUE)));
        }
        List<Series> built = new ArrayList<>(series.size());
        for (Series.Builder builder : series.values()) {
            built.add(builder.build());
        }
        LOG.debug("Parsed {} series from InfluxDB response", built.size());
        return new TimeSeriesResult(built);
    }

    /**
     * A named result (from {@code yield(name:)}) names the series; the
     * default result falls back to the measurement.
     */
    private static String metricName(String result, String measurement) {
        if (!result.isEmpty() && !DEFAULT_RESULT.equals(result)) {
            return result;
        }
        if (measurement != null && !measurement.isEmpty()) {
            return measurement;
        }
        return result.isEmpty() ? DEFAULT_RESULT : result;
    }

    private static long timestamp(Map<String, String> row) {
        String time = row.get(TIME);
        if (time == null || time.isEmpty()) {
            time = row.get(STOP);
        }
        if (time == null || time.isEmpty()) {
            return 0L;
        }
        return DateTimeUtil.parseRfc3339(time).getEpochSecond();
    }

    private static Double value(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        try {
            return Double.valueOf(raw);
        } catch (NumberFormatException e) {
            if ("true".equalsIgnoreCase(raw)) {
                return 1.0;
            }
            if ("false".equalsIgnoreCase(raw)) {
                return 0.0;
            }
            LOG.warn("Ignoring non-numeric value {}", raw);
            return null;
        }
    }

    private List<Map<String, String>> rows(String csv) {
        if (csv == null || csv.trim().isEmpty()) {
            return Collections.emptyList();
        }
        CsvParserSettings settings = new CsvParserSettings();
        settings.getFormat().setComment('#');
        settings.setLineSeparatorDetectionEnabled(true);
        settings.setSkipEmptyLines(true);
        settings.setNullValue("");
        settings.setEmptyValue("");
        settings.setMaxCharsPerColumn(-1);
        CsvParser parser = new CsvParser(settings);

        List<Map<String, String>> rows = new ArrayList<>();
        String[] header = null;
        try {
            for (String[] record : parser.iterate(new StringReader(csv))) {
                if (isBlank(record)) {
                    continue;
                }
                if (header == null || isHeader(record)) {
                    header = record;
                    continue;
                }
                Map<String, String> row = new LinkedHashMap<>();
                for (int i = 0; i < header.length; i++) {
                    String name = header[i] == null ? "" : header[i];
                    String value = i < record.length && record[i] != null ? record[i] : "";
                    row.put(name, value);
                }
                rows.add(row);
            }
        } catch (RuntimeException e) {
            throw new QueryException("Failed to parse InfluxDB response: " + e.getMessage(), null, e);
        }
        return rows;
    }

    private static boolean isHeader(String[] record) {
        return record.length > 2 && RESULT.equals(record[1]) && TABLE.equals(record[2]);
    }

    private static boolean isBlank(String[] record) {
        for (String value : record) {
            if (value != null && !value.isEmpty()) {
                return false;
            }
        }
        return true;
    }

}
