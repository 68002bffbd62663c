package gr.imsi.athenarc.tsdb.query;

/**
 * Kind of result a compiled query produces: time-series data or a flat list of
 * labels (measurement names, tag values).
 */
public enum QueryType {
    DATA,
    LABEL
}
