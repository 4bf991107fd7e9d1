package intervalsequence;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Simple representation of a <code>[min, max)</code> half-open interval. Both bounds are kept in
 * UTC so that equal instants are equal values.
 */
public record TimeInterval(OffsetDateTime min, OffsetDateTime max)
        implements HalfOpenInterval<OffsetDateTime, TimeInterval> {

    public TimeInterval {
        checkNotNull(min, "min");
        checkNotNull(max, "max");
        min = min.withOffsetSameInstant(ZoneOffset.UTC);
        max = max.withOffsetSameInstant(ZoneOffset.UTC);
        checkArgument(!min.isAfter(max), "Interval start %s is after its end %s", min, max);
    }

    /**
     * Parse both bounds with {@link #parseTime(String)}
     */
    public static TimeInterval parse(String min, String max) {
        return new TimeInterval(parseTime(min), parseTime(max));
    }

    /**
     * Parse either an ISO 8601 instant or an ISO 8601 date, which is taken as the start of that day
     * in UTC
     */
    public static OffsetDateTime parseTime(String value) {
        if (value == null) {
            throw new BadIntervalException(null);
        }
        try {
            return Instant.parse(value).atOffset(ZoneOffset.UTC);
        } catch (RuntimeException e) {
            try {
                return LocalDate.parse(value).atStartOfDay().atOffset(ZoneOffset.UTC);
            } catch (RuntimeException e2) {
                throw new BadIntervalException(value);
            }
        }
    }

    @Override
    public OffsetDateTime lowerBound() {
        return min;
    }

    @Override
    public OffsetDateTime upperBound() {
        return max;
    }

    @Override
    public TimeInterval withBounds(OffsetDateTime lowerBound, OffsetDateTime upperBound) {
        return new TimeInterval(lowerBound, upperBound);
    }

    @Override
    public String toString() {
        return "[" + min.toInstant() + ", " + max.toInstant() + ")";
    }

    static class BadIntervalException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public BadIntervalException(String val) {
            super("'" + val + "' is not a valid interval bound");
        }
    }
}
