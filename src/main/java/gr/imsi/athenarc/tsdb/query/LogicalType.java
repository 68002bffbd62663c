package gr.imsi.athenarc.tsdb.query;

/**
 * How a condition joins the conditions before it.
 */
public enum LogicalType {
    AND,
    OR
}
