package gr.imsi.athenarc.tsdb.datasource.rrd.tag;

import gr.imsi.athenarc.tsdb.config.RrdConfiguration;
import gr.imsi.athenarc.tsdb.exception.ConfigurationException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class TagStrategiesTest {

    @TempDir
    Path dir;

    private RrdConfiguration.Builder configuration() {
        return new RrdConfiguration.Builder().dir(dir);
    }

    @Test
    void filenameIsDefault() {
        assertTrue(TagStrategies.forConfiguration(configuration().build()) instanceof FileNameTagStrategy);
    }

    @Test
    void picksNamedStrategy() {
        TagStrategy folder = TagStrategies.forConfiguration(
            configuration().tagStrategy("Folder").folderTags(Arrays.asList("region", "host")).build());
        assertEquals(Arrays.asList("region", "host"), ((FolderTagStrategy) folder).getFolderTags());
        assertTrue(TagStrategies.forConfiguration(configuration().tagStrategy("none").build()) instanceof NoTagsStrategy);
        assertTrue(TagStrategies.forConfiguration(configuration().tagStrategy("notags").build()) instanceof NoTagsStrategy);
        assertEquals(dir, folder.getBaseDir());
    }

    @Test
    void unknownStrategyFails() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> TagStrategies.forConfiguration(configuration().tagStrategy("hash").build()));
        assertEquals("Unknown RRD tag strategy: hash", e.getMessage());
    }
}
