package gr.imsi.athenarc.tsdb.domain;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import gr.imsi.athenarc.tsdb.exception.QueryException;

public class DateTimeUtil {

    public static final ZoneId UTC = ZoneOffset.UTC;

    /** ISO-8601 with a numeric offset, e.g. 2023-05-28T23:00:00+00:00 */
    public static final DateTimeFormatter ISO_OFFSET_FORMATTER =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssxxx").withZone(UTC);

    public static String formatIso(Instant instant) {
        return ISO_OFFSET_FORMATTER.format(instant);
    }

    /**
     * Parses RFC 3339 timestamps as InfluxDB and Prometheus emit them.
     */
    public static Instant parseRfc3339(String s) {
        try {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.parse(s, Instant::from);
        } catch (DateTimeParseException e) {
            throw new QueryException("Invalid timestamp: " + s, null, e);
        }
    }
}
