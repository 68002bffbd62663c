package gr.imsi.athenarc.tsdb.datasource.rrd.tag;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One file per measurement; tags are dropped on write and ignored on read.
 */
public class NoTagsStrategy extends AbstractTagStrategy {

    public static final String NAME = "none";

    public NoTagsStrategy(Path baseDir) {
        super(baseDir);
    }

    @Override
    public Path getFilePath(String measurement, Map<String, String> tags) {
        return baseDir.resolve(TagEncoding.sanitize(measurement) + TagEncoding.EXTENSION);
    }

    @Override
    public List<Path> resolveFilePaths(String measurement, List<TagCondition> conditions) {
        return Collections.singletonList(getFilePath(measurement, Collections.emptyMap()));
    }

    @Override
    public Map<String, String> parseTags(Path file) {
        return Collections.emptyMap();
    }

    @Override
    protected String measurementOf(Path file) {
        return TagEncoding.stripExtension(file.getFileName().toString());
    }
}
