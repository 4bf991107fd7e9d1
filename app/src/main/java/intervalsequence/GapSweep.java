package intervalsequence;

/**
 * Finds the holes between the intervals of a sequence.
 * <p>
 * The intervals are visited in ascending start order while tracking an envelope, the last interval
 * that was not contained in the envelope before it. A gap is reported each time the next interval
 * neither overlaps nor abuts the envelope. The envelope is replaced by the next interval, never
 * merged with it, unless it fully contains it.
 */
final class GapSweep {

    private GapSweep() {
    }

    static <I extends Interval<I>> IntervalSequence<I> sweep(IntervalSequence<I> sequence) {
        IntervalSequence<I> gaps = new IntervalSequence<>();
        I envelope = null;
        for (IntervalSequence.Entry<I> entry : sequence.sortedCopy(Interval.<I>byStart())) {
            I interval = entry.interval();
            if (envelope == null) {
                envelope = interval;
                continue;
            }

            if (!envelope.overlaps(interval) && !envelope.abuts(interval)) {
                gaps.push(envelope.gap(interval));
            }

            if (!envelope.contains(interval)) {
                envelope = interval;
            }
        }
        return gaps;
    }
}
