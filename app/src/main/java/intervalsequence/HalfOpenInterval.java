package intervalsequence;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * {@link Interval} over a <code>[lowerBound, upperBound)</code> half-open range of comparable
 * values. Implementations supply the bounds and a way to build a new instance, the predicates are
 * shared.
 *
 * @param <T>
 *        the boundary type
 * @param <I>
 *        the implementing interval type
 */
public interface HalfOpenInterval<T extends Comparable<? super T>, I extends HalfOpenInterval<T, I>>
        extends Interval<I> {

    /** Inclusive lower bound */
    T lowerBound();

    /** Exclusive upper bound */
    T upperBound();

    /**
     * Build a new interval of the implementing type with the given bounds
     */
    I withBounds(T lowerBound, T upperBound);

    @Override
    default int compareStart(I other) {
        return lowerBound().compareTo(other.lowerBound());
    }

    @Override
    default boolean overlaps(I other) {
        return lowerBound().compareTo(other.upperBound()) < 0 && other.lowerBound().compareTo(upperBound()) < 0;
    }

    @Override
    default boolean abuts(I other) {
        return upperBound().compareTo(other.lowerBound()) == 0 || other.upperBound().compareTo(lowerBound()) == 0;
    }

    @Override
    default boolean contains(I other) {
        return lowerBound().compareTo(other.lowerBound()) <= 0 && other.upperBound().compareTo(upperBound()) <= 0;
    }

    @Override
    default I gap(I other) {
        checkArgument(!overlaps(other), "%s overlaps %s, there is no gap between them", this, other);
        if (upperBound().compareTo(other.lowerBound()) <= 0) {
            return withBounds(upperBound(), other.lowerBound());
        }
        return withBounds(other.upperBound(), lowerBound());
    }

    @Override
    default I intersect(I other) {
        checkArgument(overlaps(other), "%s does not overlap %s", this, other);
        return withBounds(max(lowerBound(), other.lowerBound()), min(upperBound(), other.upperBound()));
    }

    @Override
    default I merge(I other) {
        return withBounds(min(lowerBound(), other.lowerBound()), max(upperBound(), other.upperBound()));
    }

    private static <T extends Comparable<? super T>> T min(T a, T b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static <T extends Comparable<? super T>> T max(T a, T b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
