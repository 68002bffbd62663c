package gr.imsi.athenarc.tsdb.datasource.nulldriver;

import gr.imsi.athenarc.tsdb.domain.DataPoint;
import gr.imsi.athenarc.tsdb.query.Query;
import gr.imsi.athenarc.tsdb.query.QueryType;
import gr.imsi.athenarc.tsdb.result.LabelResult;
import gr.imsi.athenarc.tsdb.result.TimeSeriesResult;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class NullDriverTest {

    @Test
    void compilesToQueryDescription() {
        Query query = new Query("cpu").where("host", "=", "a");
        NullQuery compiled = new NullCompiler().compile(query);
        assertEquals(query.toString(), compiled.getRawQuery());
        assertEquals(QueryType.DATA, compiled.getType());
    }

    @Test
    void returnsEmptyResults() {
        NullQueryExecutor executor = new NullQueryExecutor();
        assertTrue(((TimeSeriesResult) executor.execute(new NullQuery("anything"))).isEmpty());
        assertTrue(executor.execute(new NullQuery("tags", QueryType.LABEL)) instanceof LabelResult);
    }

    @Test
    void acceptsEveryWrite() {
        NullWriter writer = new NullWriter();
        DataPoint point = new DataPoint("cpu", Collections.singletonMap("value", 1), Instant.EPOCH);
        assertTrue(writer.write(point));
        assertTrue(writer.writeBatch(Arrays.asList(point, point)));
    }
}
