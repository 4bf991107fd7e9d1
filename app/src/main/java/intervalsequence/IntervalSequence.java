package intervalsequence;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Predicate;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * An ordered collection of intervals addressed by a zero-based offset.
 * <p>
 * Offsets are always <code>0..count()-1</code>. Iteration normally visits them in ascending order;
 * after {@link #sort(Comparator)} the values are visited in the new order but keep the offset they
 * had before the sort. Operations that change the number of elements ({@link #push}, {@link #remove})
 * renumber the offsets in the current iteration order.
 * <p>
 * Instances are not thread safe, and iterating while the sequence is being modified gives undefined
 * results. Callers must not do that.
 *
 * @param <I>
 *        the interval type
 */
public final class IntervalSequence<I extends Interval<I>> implements Iterable<IntervalSequence.Entry<I>> {

    /**
     * An interval together with its offset in the sequence
     */
    public record Entry<T>(int offset, T interval) {
    }

    @SafeVarargs
    public static <I extends Interval<I>> IntervalSequence<I> of(I... intervals) {
        return new IntervalSequence<>(Arrays.asList(intervals));
    }

    /** Intervals indexed by offset */
    private final List<I> intervals;
    /** Offsets in iteration order */
    private final List<Integer> order;

    public IntervalSequence() {
        this.intervals = new ArrayList<>();
        this.order = new ArrayList<>();
    }

    public IntervalSequence(Collection<? extends I> intervals) {
        this();
        reset(intervals);
    }

    public int count() {
        return intervals.size();
    }

    public boolean isEmpty() {
        return intervals.isEmpty();
    }

    @Override
    public Iterator<Entry<I>> iterator() {
        return new EntryIterator();
    }

    class EntryIterator implements Iterator<Entry<I>> {
        private int position;

        @Override
        public boolean hasNext() {
            return position < order.size();
        }

        @Override
        public Entry<I> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int offset = order.get(position++);
            return new Entry<>(offset, intervals.get(offset));
        }
    }

    /**
     * The intervals in iteration order, without their offsets
     */
    public List<I> toList() {
        ImmutableList.Builder<I> builder = ImmutableList.builderWithExpectedSize(order.size());
        for (int offset : order) {
            builder.add(intervals.get(offset));
        }
        return builder.build();
    }

    public void clear() {
        intervals.clear();
        order.clear();
    }

    /**
     * @throws InvalidIndexException
     *         if no interval is stored at that offset
     */
    public I get(int offset) {
        if (offset < 0 || offset >= intervals.size()) {
            throw new InvalidIndexException(offset);
        }
        return intervals.get(offset);
    }

    /**
     * Remove the interval at the given offset and return it. The remaining intervals are renumbered
     * so that offsets stay contiguous.
     *
     * @throws InvalidIndexException
     *         if no interval is stored at that offset
     */
    public I remove(int offset) {
        I removed = get(offset);
        List<I> remaining = new ArrayList<>(intervals.size() - 1);
        for (int current : order) {
            if (current != offset) {
                remaining.add(intervals.get(current));
            }
        }
        reset(remaining);
        return removed;
    }

    /**
     * Append intervals at the end of the sequence, in argument order
     */
    @SafeVarargs
    public final void push(I interval, I... more) {
        checkNotNull(interval);
        for (I next : more) {
            checkNotNull(next);
        }
        if (!isInOffsetOrder()) {
            reset(toList());
        }
        append(interval);
        for (I next : more) {
            append(next);
        }
    }

    /**
     * Replace the interval stored at an existing offset
     *
     * @throws InvalidIndexException
     *         if no interval is stored at that offset
     */
    public void set(int offset, I interval) {
        checkNotNull(interval);
        get(offset);
        intervals.set(offset, interval);
    }

    /**
     * Offset of the first interval, in iteration order, equal to the given one
     */
    public OptionalInt find(I interval) {
        for (int offset : order) {
            if (intervals.get(offset).equals(interval)) {
                return OptionalInt.of(offset);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * True if every given interval is present in the sequence
     */
    @SafeVarargs
    public final boolean contains(I interval, I... more) {
        if (find(interval).isEmpty()) {
            return false;
        }
        for (I next : more) {
            if (find(next).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
     * The smallest interval enclosing every member, empty if the sequence is empty
     */
    public Optional<I> getBoundingInterval() {
        if (intervals.isEmpty()) {
            return Optional.empty();
        }
        I bounds = intervals.get(0);
        for (int offset = 1; offset < intervals.size(); offset++) {
            bounds = bounds.merge(intervals.get(offset));
        }
        return Optional.of(bounds);
    }

    /**
     * Reorder the sequence in place. Each interval keeps its offset, only the iteration order
     * changes. The sort is stable.
     *
     * @return true, exceptions thrown by the comparator are propagated
     */
    public boolean sort(Comparator<? super I> comparator) {
        checkNotNull(comparator);
        List<Integer> sorted = new ArrayList<>(order);
        sorted.sort((left, right) -> comparator.compare(intervals.get(left), intervals.get(right)));
        order.clear();
        order.addAll(sorted);
        return true;
    }

    /**
     * Return a sequence holding the intervals sorted by the comparator and numbered from 0. The
     * receiver is not modified. If sorting would not change anything, the receiver itself is
     * returned.
     */
    public IntervalSequence<I> sortedCopy(Comparator<? super I> comparator) {
        checkNotNull(comparator);
        List<I> sorted = new ArrayList<>(toList());
        sorted.sort(comparator);
        if (isSameAs(sorted)) {
            return this;
        }
        return new IntervalSequence<>(sorted);
    }

    /**
     * Return a sequence holding the intervals accepted by the predicate, in iteration order and
     * numbered from 0. The receiver is not modified. If every interval is accepted, the receiver
     * itself is returned.
     */
    public IntervalSequence<I> filteredCopy(Predicate<? super I> predicate) {
        checkNotNull(predicate);
        List<I> kept = new ArrayList<>();
        for (int offset : order) {
            I interval = intervals.get(offset);
            if (predicate.test(interval)) {
                kept.add(interval);
            }
        }
        if (kept.size() == intervals.size()) {
            return this;
        }
        return new IntervalSequence<>(kept);
    }

    /**
     * True if at least one interval matches, false on an empty sequence
     */
    public boolean any(Predicate<? super I> predicate) {
        for (int offset : order) {
            if (predicate.test(intervals.get(offset))) {
                return true;
            }
        }
        return false;
    }

    /**
     * True if every interval matches. Unlike the usual convention, an empty sequence returns false.
     */
    public boolean all(Predicate<? super I> predicate) {
        for (int offset : order) {
            if (!predicate.test(intervals.get(offset))) {
                return false;
            }
        }
        return !intervals.isEmpty();
    }

    /**
     * The holes between the intervals, see {@link GapSweep}
     */
    public IntervalSequence<I> gaps() {
        return GapSweep.sweep(this);
    }

    /**
     * The overlaps between the intervals, see {@link IntersectionSweep}
     */
    public IntervalSequence<I> intersections() {
        return IntersectionSweep.sweep(this);
    }

    /**
     * True if the candidate holds exactly the same instances, in the same order, as this sequence
     * and this sequence's offsets are in ascending iteration order
     */
    private boolean isSameAs(List<I> candidate) {
        if (candidate.size() != intervals.size()) {
            return false;
        }
        if (!isInOffsetOrder()) {
            return false;
        }
        for (int position = 0; position < candidate.size(); position++) {
            if (candidate.get(position) != intervals.get(position)) {
                return false;
            }
        }
        return true;
    }

    /**
     * True unless {@link #sort(Comparator)} moved some offset away from its natural position
     */
    private boolean isInOffsetOrder() {
        for (int position = 0; position < order.size(); position++) {
            if (order.get(position) != position) {
                return false;
            }
        }
        return true;
    }

    private void reset(Collection<? extends I> values) {
        intervals.clear();
        order.clear();
        for (I value : values) {
            append(checkNotNull(value));
        }
    }

    private void append(I value) {
        order.add(intervals.size());
        intervals.add(value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("intervals", toList()).toString();
    }
}
