package gr.imsi.athenarc.tsdb.result;

import java.util.Map;

/**
 * Uniform output of every executor.
 */
public interface QueryResult {

    /**
     * Backend-specific extras such as the executed query or the RRD file read.
     */
    Map<String, Object> getMetadata();

    boolean isEmpty();
}
