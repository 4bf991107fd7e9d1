package intervalsequence;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A <code>[min, max)</code> half-open interval over long values
 */
public record LongInterval(long min, long max) implements HalfOpenInterval<Long, LongInterval> {

    public LongInterval {
        checkArgument(min <= max, "Interval start %s is after its end %s", min, max);
    }

    public long length() {
        return max - min;
    }

    @Override
    public Long lowerBound() {
        return min;
    }

    @Override
    public Long upperBound() {
        return max;
    }

    @Override
    public LongInterval withBounds(Long lowerBound, Long upperBound) {
        return new LongInterval(lowerBound, upperBound);
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + ")";
    }
}
