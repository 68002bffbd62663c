package gr.imsi.athenarc.tsdb.datasource.rrd.tag;

import java.nio.file.Path;
import java.util.Map;

/**
 * All files in one directory, tags encoded in the file name:
 * {@code cpu_usage_host-server1_region-us.east.rrd}.
 */
public class FileNameTagStrategy extends AbstractTagStrategy {

    public static final String NAME = "filename";

    public FileNameTagStrategy(Path baseDir) {
        super(baseDir);
    }

    @Override
    public Path getFilePath(String measurement, Map<String, String> tags) {
        return baseDir.resolve(TagEncoding.encode(measurement, tags));
    }

    @Override
    public Map<String, String> parseTags(Path file) {
        return TagEncoding.parseTags(file.getFileName().toString());
    }
}
