package gr.imsi.athenarc.tsdb.query;

import com.google.common.base.Preconditions;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * The time window of a query: exactly one of {@link Absolute}, {@link Relative}
 * or {@link #unset()}. Switching mode replaces the whole value, so a query can
 * never hold an absolute range and a relative window at the same time.
 */
public abstract class TimeSpec {

    public enum Kind {
        UNSET,
        ABSOLUTE,
        RELATIVE
    }

    private static final TimeSpec UNSET = new Unset();

    private TimeSpec() {
    }

    public abstract Kind getKind();

    public static TimeSpec unset() {
        return UNSET;
    }

    public static Absolute absolute(@Nullable Instant start, @Nullable Instant end) {
        return new Absolute(start, end);
    }

    public static Relative relative(RelativeTime duration) {
        return new Relative(duration);
    }

    @Nullable
    public Instant getStart() {
        return null;
    }

    @Nullable
    public Instant getEnd() {
        return null;
    }

    @Nullable
    public RelativeTime getRelativeTime() {
        return null;
    }

    public boolean isUnset() {
        return getKind() == Kind.UNSET;
    }

    private static final class Unset extends TimeSpec {
        @Override
        public Kind getKind() {
            return Kind.UNSET;
        }

        @Override
        public String toString() {
            return "Unset";
        }
    }

    /**
     * A fixed window. Either bound may be open, but not both.
     */
    public static final class Absolute extends TimeSpec {
        @Nullable
        private final Instant start;
        @Nullable
        private final Instant end;

        private Absolute(@Nullable Instant start, @Nullable Instant end) {
            Preconditions.checkArgument(start != null || end != null, "An absolute time range needs a start or an end");
            this.start = start;
            this.end = end;
        }

        @Override
        public Kind getKind() {
            return Kind.ABSOLUTE;
        }

        @Override
        @Nullable
        public Instant getStart() {
            return start;
        }

        @Override
        @Nullable
        public Instant getEnd() {
            return end;
        }

        public boolean isBounded() {
            return start != null && end != null;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Absolute)) return false;
            Absolute that = (Absolute) o;
            return Objects.equals(start, that.start) && Objects.equals(end, that.end);
        }

        @Override
        public int hashCode() {
            return Objects.hash(start, end);
        }

        @Override
        public String toString() {
            return "Absolute{" + start + " .. " + end + "}";
        }
    }

    /**
     * A look-back window ending now.
     */
    public static final class Relative extends TimeSpec {
        private final RelativeTime duration;

        private Relative(RelativeTime duration) {
            this.duration = Preconditions.checkNotNull(duration, "duration");
        }

        @Override
        public Kind getKind() {
            return Kind.RELATIVE;
        }

        @Override
        public RelativeTime getRelativeTime() {
            return duration;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Relative)) return false;
            return duration.equals(((Relative) o).duration);
        }

        @Override
        public int hashCode() {
            return duration.hashCode();
        }

        @Override
        public String toString() {
            return "Relative{" + duration + "}";
        }
    }
}
