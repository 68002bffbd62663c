package gr.imsi.athenarc.tsdb.domain;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A bucketing interval written in the compact grammar ("30s", "5m", "1h", "1d", "2w").
 */
public class AggregateInterval implements Comparable<AggregateInterval> {

    private static final Pattern COMPACT = Pattern.compile("^(\\d+)([smhdw])$");

    private final long multiplier;
    private final ChronoUnit chronoUnit;

    private AggregateInterval(long multiplier, ChronoUnit chronoUnit) {
        this.multiplier = multiplier;
        this.chronoUnit = chronoUnit;
    }

    public static AggregateInterval of(long multiplier, ChronoUnit chronoUnit) {
        return new AggregateInterval(multiplier, chronoUnit);
    }

    /**
     * Parses a compact interval.
     *
     * @return the interval, or null when the text does not follow the grammar
     */
    public static AggregateInterval parse(String interval) {
        if (interval == null) {
            return null;
        }
        Matcher matcher = COMPACT.matcher(interval.trim());
        if (!matcher.matches()) {
            return null;
        }
        long amount = Long.parseLong(matcher.group(1));
        switch (matcher.group(2)) {
            case "s":
                return of(amount, ChronoUnit.SECONDS);
            case "m":
                return of(amount, ChronoUnit.MINUTES);
            case "h":
                return of(amount, ChronoUnit.HOURS);
            case "d":
                return of(amount, ChronoUnit.DAYS);
            default:
                return of(amount, ChronoUnit.WEEKS);
        }
    }

    public long getMultiplier() {
        return multiplier;
    }

    public ChronoUnit getChronoUnit() {
        return chronoUnit;
    }

    public Duration toDuration() {
        return chronoUnit.getDuration().multipliedBy(multiplier);
    }

    public long toSeconds() {
        return toDuration().getSeconds();
    }

    /**
     * Graphite's spelling of the interval, e.g. "5minute".
     */
    public String toGraphiteInterval() {
        switch (chronoUnit) {
            case SECONDS:
                return multiplier + "second";
            case MINUTES:
                return multiplier + "minute";
            case HOURS:
                return multiplier + "hour";
            case DAYS:
                return multiplier + "day";
            default:
                return multiplier + "week";
        }
    }

    @Override
    public int compareTo(AggregateInterval o) {
        return toDuration().compareTo(o.toDuration());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateInterval)) return false;
        AggregateInterval that = (AggregateInterval) o;
        return multiplier == that.multiplier && chronoUnit == that.chronoUnit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(multiplier, chronoUnit);
    }

    @Override
    public String toString() {
        return "AggregateInterval{" + multiplier + " " + chronoUnit + '}';
    }
}
