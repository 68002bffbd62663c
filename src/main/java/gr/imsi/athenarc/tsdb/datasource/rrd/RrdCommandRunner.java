package gr.imsi.athenarc.tsdb.datasource.rrd;

/**
 * Runs one rrdtool command and returns its standard output.
 */
public interface RrdCommandRunner {

    /**
     * @throws RrdNotFoundException when the command references a missing file
     * @throws RrdException         for any other rrdtool error
     */
    String run(RrdCommand command);
}
