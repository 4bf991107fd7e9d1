package intervalsequence;

import java.util.Comparator;

/**
 * The operations an {@link IntervalSequence} needs from the intervals it holds. Implementations are
 * immutable values: two intervals are equal when their boundaries are equal.
 *
 * @param <I>
 *        the implementing interval type
 */
public interface Interval<I extends Interval<I>> {

    /**
     * Compare the start boundary of this interval with the start boundary of another
     */
    int compareStart(I other);

    /**
     * True if the two intervals share at least one point
     */
    boolean overlaps(I other);

    /**
     * True if one interval ends exactly where the other one starts
     */
    boolean abuts(I other);

    /**
     * True if every point of the other interval is also in this interval
     */
    boolean contains(I other);

    /**
     * Return the interval strictly between this interval and another one.
     *
     * @throws IllegalArgumentException
     *         if the intervals overlap
     */
    I gap(I other);

    /**
     * Return the part shared by this interval and another one.
     *
     * @throws IllegalArgumentException
     *         if the intervals do not overlap
     */
    I intersect(I other);

    /**
     * Return the smallest interval enclosing this interval and another one
     */
    I merge(I other);

    /**
     * Ascending order of start boundaries
     */
    static <I extends Interval<I>> Comparator<I> byStart() {
        return (left, right) -> left.compareStart(right);
    }
}
