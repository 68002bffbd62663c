package gr.imsi.athenarc.tsdb.datasource.rrd;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class RrdInfoParserTest {

    private static final String INFO = "filename = \"/var/lib/rrd/cpu.rrd\"\n"
        + "rrd_version = \"0003\"\n"
        + "step = 300\n"
        + "last_update = 1698408000\n"
        + "header_size = 1200\n"
        + "ds[user].index = 0\n"
        + "ds[user].type = \"GAUGE\"\n"
        + "ds[user].minimal_heartbeat = 600\n"
        + "ds[user].min = NaN\n"
        + "ds[user].max = 1.0000000000e+02\n"
        + "ds[user].last_ds = \"12.5\"\n"
        + "ds[system].index = 1\n"
        + "ds[system].type = \"COUNTER\"\n"
        + "ds[system].minimal_heartbeat = 600\n"
        + "rra[0].cf = \"AVERAGE\"\n"
        + "rra[0].rows = 2016\n"
        + "rra[0].pdp_per_row = 1\n"
        + "rra[0].xff = 5.0000000000e-01\n"
        + "rra[1].cf = \"MAX\"\n"
        + "rra[1].rows = 1488\n"
        + "rra[1].pdp_per_row = 12\n";

    private final RrdInfoParser parser = new RrdInfoParser();

    @Test
    void readsHeader() {
        RrdInfo info = parser.parse(INFO);
        assertEquals("/var/lib/rrd/cpu.rrd", info.getFilename());
        assertEquals("0003", info.getRrdVersion());
        assertEquals(300L, info.getStep());
        assertEquals(1698408000L, info.getLastUpdate());
    }

    @Test
    void readsDataSourcesInOrder() {
        RrdInfo info = parser.parse(INFO);
        assertEquals(Arrays.asList("user", "system"), info.getDataSourceNames());

        RrdInfo.DataSource user = info.getDataSources().get("user");
        assertEquals("GAUGE", user.getType());
        assertEquals(600L, user.getHeartbeat());
        assertNull(user.getMin());
        assertEquals(100.0, user.getMax());
        assertEquals("12.5", user.getLastValue());
        assertEquals("COUNTER", info.getDataSources().get("system").getType());
    }

    @Test
    void readsArchives() {
        RrdInfo info = parser.parse(INFO);
        assertEquals(2, info.getArchives().size());
        RrdInfo.Archive average = info.getArchives().get(0);
        assertEquals("AVERAGE", average.getConsolidationFunction());
        assertEquals(2016L, average.getRows());
        assertEquals(0.5, average.getXff());
        assertEquals(12L, info.getArchives().get(1).getPdpPerRow());
    }

    @Test
    void ignoresLinesWithoutAssignment() {
        assertEquals(1, RrdInfoParser.parseLines("garbage\n  step = 60  \n").size());
        assertTrue(parser.parse(null).getDataSourceNames().isEmpty());
    }
}
