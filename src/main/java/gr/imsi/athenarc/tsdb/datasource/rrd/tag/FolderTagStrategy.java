package gr.imsi.athenarc.tsdb.datasource.rrd.tag;

import com.google.common.collect.ImmutableList;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One directory level per folder tag, in the configured order, named after
 * the tag's value ({@code _unset} when the point lacks it). The remaining
 * tags are encoded in the file name:
 * {@code us-east/server1/cpu_usage_env-prod.rrd} for folder tags region, host.
 */
public class FolderTagStrategy extends AbstractTagStrategy {

    public static final String NAME = "folder";

    static final String UNSET = "_unset";

    private final List<String> folderTags;

    public FolderTagStrategy(Path baseDir, List<String> folderTags) {
        super(baseDir);
        this.folderTags = ImmutableList.copyOf(folderTags);
    }

    public List<String> getFolderTags() {
        return folderTags;
    }

    @Override
    public Path getFilePath(String measurement, Map<String, String> tags) {
        Path dir = baseDir;
        Map<String, String> fileTags = new LinkedHashMap<>(tags);
        for (String folderTag : folderTags) {
            String value = fileTags.remove(folderTag);
            dir = dir.resolve(value == null || value.isEmpty() ? UNSET : TagEncoding.sanitize(value));
        }
        return dir.resolve(TagEncoding.encode(measurement, fileTags));
    }

    @Override
    public Map<String, String> parseTags(Path file) {
        Map<String, String> tags = new LinkedHashMap<>();
        Path relative = baseDir.relativize(file.getParent() == null ? baseDir : file.getParent());
        for (int i = 0; i < relative.getNameCount() && i < folderTags.size(); i++) {
            String value = relative.getName(i).toString();
            if (!value.isEmpty() && !UNSET.equals(value)) {
                tags.put(folderTags.get(i), value);
            }
        }
        tags.putAll(TagEncoding.parseTags(file.getFileName().toString()));
        return tags;
    }
}
