package gr.imsi.athenarc.tsdb.datasource.rrd;

/**
 * The RRD file a command referenced does not exist (yet).
 */
public class RrdNotFoundException extends RrdException {

    public RrdNotFoundException(String message) {
        super(message);
    }
}
