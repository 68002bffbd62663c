package gr.imsi.athenarc.tsdb.datasource.rrd.tag;

import com.google.common.base.Preconditions;

import gr.imsi.athenarc.tsdb.datasource.rrd.RrdException;
import gr.imsi.athenarc.tsdb.query.LogicalType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Directory scanning shared by the strategies.
 */
abstract class AbstractTagStrategy implements TagStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractTagStrategy.class);

    protected final Path baseDir;

    protected AbstractTagStrategy(Path baseDir) {
        this.baseDir = Preconditions.checkNotNull(baseDir, "baseDir");
    }

    @Override
    public Path getBaseDir() {
        return baseDir;
    }

    @Override
    public List<Path> resolveFilePaths(String measurement, List<TagCondition> conditions) {
        if (!conditions.isEmpty() && allEqualities(conditions)) {
            Map<String, String> tags = new LinkedHashMap<>();
            for (TagCondition condition : conditions) {
                tags.put(condition.getTag(), condition.getStringValue());
            }
            return Collections.singletonList(getFilePath(measurement, tags));
        }
        List<Path> matches = new ArrayList<>();
        for (Path file : scan()) {
            if (measurement.equals(measurementOf(file)) && TagCondition.search(parseTags(file), conditions)) {
                matches.add(file);
            }
        }
        return matches;
    }

    @Override
    public List<String> listMeasurements(List<TagCondition> conditions) {
        TreeSet<String> measurements = new TreeSet<>();
        for (Path file : scan()) {
            if (TagCondition.search(parseTags(file), conditions)) {
                measurements.add(measurementOf(file));
            }
        }
        return new ArrayList<>(measurements);
    }

    @Override
    public List<String> listTagValues(String tag) {
        TreeSet<String> values = new TreeSet<>();
        for (Path file : scan()) {
            String value = parseTags(file).get(tag);
            if (value != null) {
                values.add(value);
            }
        }
        return new ArrayList<>(values);
    }

    protected String measurementOf(Path file) {
        return TagEncoding.parseMeasurement(file.getFileName().toString());
    }

    /**
     * All RRD files under the base directory, sorted by path.
     */
    protected List<Path> scan() {
        if (!Files.isDirectory(baseDir)) {
            LOG.warn("RRD directory {} does not exist", baseDir);
            return Collections.emptyList();
        }
        try (Stream<Path> files = Files.walk(baseDir)) {
            return files
                .filter(Files::isRegularFile)
                .filter(file -> file.getFileName().toString().endsWith(TagEncoding.EXTENSION))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new RrdException("Failed to scan RRD directory " + baseDir + ": " + e.getMessage(), e);
        }
    }

    private static boolean allEqualities(List<TagCondition> conditions) {
        for (TagCondition condition : conditions) {
            if (!condition.isEquality() || condition.getLogicalType() == LogicalType.OR) {
                return false;
            }
        }
        return true;
    }
}
