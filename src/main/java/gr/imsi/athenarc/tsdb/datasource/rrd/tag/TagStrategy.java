package gr.imsi.athenarc.tsdb.datasource.rrd.tag;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Maps a measurement and its tags onto RRD files. The layout is a deployment
 * decision, so the compiler and the writer only see this interface.
 */
public interface TagStrategy {

    Path getBaseDir();

    /**
     * The file a point with these tags is written to.
     */
    Path getFilePath(String measurement, Map<String, String> tags);

    /**
     * Files of the measurement whose tags satisfy the conditions, sorted by path.
     * When every condition is an AND equality the path is computed without
     * touching the file system.
     */
    List<Path> resolveFilePaths(String measurement, List<TagCondition> conditions);

    /**
     * Tags encoded in the path of an RRD file.
     */
    Map<String, String> parseTags(Path file);

    /**
     * Measurements with at least one file matching the conditions.
     */
    List<String> listMeasurements(List<TagCondition> conditions);

    /**
     * Distinct values of a tag across all files, sorted.
     */
    List<String> listTagValues(String tag);
}
