package gr.imsi.athenarc.tsdb.query;

import gr.imsi.athenarc.tsdb.exception.QueryException;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A calendar-aware look-back window such as "1h", "7d" or "2y", kept as its
 * calendar components so that every backend can render it in its own syntax.
 * Weeks are stored as days.
 */
public final class RelativeTime {

    private static final Pattern DURATION = Pattern.compile("^(\\d+)([smhdwy])$");

    private static final long SECONDS_PER_DAY = 86_400L;
    private static final long DAYS_PER_YEAR = 365L;

    private final int years;
    private final int days;
    private final int hours;
    private final int minutes;
    private final int seconds;

    private RelativeTime(int years, int days, int hours, int minutes, int seconds) {
        this.years = years;
        this.days = days;
        this.hours = hours;
        this.minutes = minutes;
        this.seconds = seconds;
    }

    /**
     * Parses the compact grammar {@code <amount><s|m|h|d|w|y>}.
     *
     * @throws QueryException for anything else
     */
    public static RelativeTime parse(String duration) {
        Matcher matcher = duration == null ? null : DURATION.matcher(duration);
        if (matcher == null || !matcher.matches()) {
            throw new QueryException("Invalid duration format: " + duration);
        }
        int amount;
        try {
            amount = Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new QueryException("Invalid duration format: " + duration, null, e);
        }
        switch (matcher.group(2)) {
            case "s":
                return new RelativeTime(0, 0, 0, 0, amount);
            case "m":
                return new RelativeTime(0, 0, 0, amount, 0);
            case "h":
                return new RelativeTime(0, 0, amount, 0, 0);
            case "d":
                return new RelativeTime(0, amount, 0, 0, 0);
            case "w":
                return new RelativeTime(0, amount * 7, 0, 0, 0);
            default:
                return new RelativeTime(amount, 0, 0, 0, 0);
        }
    }

    public int getYears() {
        return years;
    }

    public int getDays() {
        return days;
    }

    public int getHours() {
        return hours;
    }

    public int getMinutes() {
        return minutes;
    }

    public int getSeconds() {
        return seconds;
    }

    /**
     * Total length in seconds, counting a year as 365 days.
     */
    public long toSeconds() {
        return (years * DAYS_PER_YEAR + days) * SECONDS_PER_DAY + hours * 3600L + minutes * 60L + seconds;
    }

    /**
     * Renders the components with the given unit suffixes, largest first,
     * skipping zero components. An all-zero window renders as "0" + secondUnit.
     */
    public String format(String yearUnit, String dayUnit, String hourUnit, String minuteUnit, String secondUnit) {
        StringBuilder sb = new StringBuilder();
        append(sb, years, yearUnit);
        append(sb, days, dayUnit);
        append(sb, hours, hourUnit);
        append(sb, minutes, minuteUnit);
        append(sb, seconds, secondUnit);
        return sb.length() == 0 ? "0" + secondUnit : sb.toString();
    }

    private static void append(StringBuilder sb, int amount, String unit) {
        if (amount > 0) {
            sb.append(amount).append(unit);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RelativeTime)) return false;
        RelativeTime that = (RelativeTime) o;
        return years == that.years && days == that.days && hours == that.hours
            && minutes == that.minutes && seconds == that.seconds;
    }

    @Override
    public int hashCode() {
        return Objects.hash(years, days, hours, minutes, seconds);
    }

    @Override
    public String toString() {
        return format("y", "d", "h", "m", "s");
    }
}
