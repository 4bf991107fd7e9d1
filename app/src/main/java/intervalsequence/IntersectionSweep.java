package intervalsequence;

/**
 * Finds the overlaps between the intervals of a sequence in a single ascending pass.
 * <p>
 * A reference interval is compared with the next interval in start order. Once a comparison is
 * pending, intervals contained in the reference are skipped. When the compared interval is not
 * contained in the reference it becomes the new reference and the next interval is compared fresh.
 * <p>
 * This reports one intersection per change of reference, not every pairwise intersection of a
 * cluster of overlapping intervals.
 */
final class IntersectionSweep {

    private IntersectionSweep() {
    }

    static <I extends Interval<I>> IntervalSequence<I> sweep(IntervalSequence<I> sequence) {
        IntervalSequence<I> intersections = new IntervalSequence<>();
        I reference = null;
        I comparison = null;
        for (IntervalSequence.Entry<I> entry : sequence.sortedCopy(Interval.<I>byStart())) {
            I interval = entry.interval();
            if (reference == null) {
                reference = interval;
                continue;
            }

            if (comparison != null && reference.contains(interval)) {
                continue;
            }

            comparison = interval;
            if (reference.overlaps(comparison)) {
                intersections.push(reference.intersect(comparison));
            }

            if (!reference.contains(comparison)) {
                reference = comparison;
                comparison = null;
            }
        }
        return intersections;
    }
}
