package gr.imsi.athenarc.tsdb.datasource.rrd.tag;

import gr.imsi.athenarc.tsdb.query.ComparisonOperator;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileNameTagStrategyTest {

    @TempDir
    Path dir;

    @Test
    void encodesSortedTagsIntoFileName() {
        FileNameTagStrategy strategy = new FileNameTagStrategy(dir);
        Path path = strategy.getFilePath("cpu_usage", ImmutableMap.of("region", "us-east", "host", "server1"));
        assertEquals(dir.resolve("cpu_usage_host-server1_region-us.east.rrd"), path);
        assertEquals(dir.resolve("cpu.rrd"), strategy.getFilePath("cpu", Collections.emptyMap()));
    }

    @Test
    void parsesTagsAndMeasurementBack() {
        FileNameTagStrategy strategy = new FileNameTagStrategy(dir);
        Map<String, String> tags = strategy.parseTags(dir.resolve("cpu_usage_host-server1_region-us.east.rrd"));
        assertEquals(ImmutableMap.of("host", "server1", "region", "us.east"), tags);
        assertEquals("cpu_usage", TagEncoding.parseMeasurement("cpu_usage_host-server1.rrd"));
        assertEquals("cpu_usage", TagEncoding.parseMeasurement("cpu_usage.rrd"));
    }

    @Test
    void equalitiesResolveWithoutScanning() {
        FileNameTagStrategy strategy = new FileNameTagStrategy(dir.resolve("absent"));
        assertEquals(Collections.singletonList(dir.resolve("absent").resolve("cpu_host-a.rrd")),
            strategy.resolveFilePaths("cpu", Collections.singletonList(TagCondition.equalTo("host", "a"))));
    }

    @Test
    void scansForOtherConditions() throws IOException {
        for (String name : Arrays.asList("cpu_host-a.rrd", "cpu_host-b.rrd", "mem_host-a.rrd", "notes.txt")) {
            Files.createFile(dir.resolve(name));
        }
        FileNameTagStrategy strategy = new FileNameTagStrategy(dir);

        assertEquals(Arrays.asList(dir.resolve("cpu_host-a.rrd"), dir.resolve("cpu_host-b.rrd")),
            strategy.resolveFilePaths("cpu", Collections.emptyList()));
        assertEquals(Collections.singletonList(dir.resolve("cpu_host-b.rrd")),
            strategy.resolveFilePaths("cpu", Collections.singletonList(
                new TagCondition("host", ComparisonOperator.NOT_IN, Collections.singletonList("a")))));
        assertEquals(Arrays.asList("cpu", "mem"), strategy.listMeasurements(Collections.emptyList()));
        assertEquals(Arrays.asList("a", "b"), strategy.listTagValues("host"));
    }

    @Test
    void missingDirectoryScansNothing() {
        FileNameTagStrategy strategy = new FileNameTagStrategy(dir.resolve("absent"));
        assertTrue(strategy.listMeasurements(Collections.emptyList()).isEmpty());
    }
}
