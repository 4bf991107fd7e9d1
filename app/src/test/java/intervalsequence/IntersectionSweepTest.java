package intervalsequence;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

public class IntersectionSweepTest {

    private static LongInterval interval(long min, long max) {
        return new LongInterval(min, max);
    }

    @Test
    public void testSimpleOverlap() {
        IntervalSequence<LongInterval> sequence = IntervalSequence.of(interval(0, 10),
                interval(5, 15),
                interval(20, 30));
        assertEquals(List.of(interval(5, 10)), sequence.intersections().toList());
    }

    @Test
    public void testContainedIntervalStillIntersects() {
        IntervalSequence<LongInterval> sequence = IntervalSequence.of(interval(0, 20),
                interval(5, 10),
                interval(15, 25));
        assertEquals(List.of(interval(5, 10), interval(15, 20)), sequence.intersections().toList());
    }

    @Test
    public void testContainedIntervalsSkippedWhileComparisonPending() {
        IntervalSequence<LongInterval> sequence = IntervalSequence.of(interval(0, 100),
                interval(10, 20),
                interval(30, 40),
                interval(90, 110));
        assertEquals(List.of(interval(10, 20), interval(90, 100)), sequence.intersections().toList());
    }

    @Test
    public void testOneIntersectionPerReferenceChange() {
        // [4, 10) is shared by all three but only consecutive references are compared
        IntervalSequence<LongInterval> sequence = IntervalSequence.of(interval(0, 10),
                interval(2, 12),
                interval(4, 14));
        assertEquals(List.of(interval(2, 10), interval(4, 12)), sequence.intersections().toList());
    }

    @Test
    public void testAbuttingAndDisjoint() {
        IntervalSequence<LongInterval> sequence = IntervalSequence.of(interval(0, 10),
                interval(10, 20),
                interval(30, 40));
        assertTrue(sequence.intersections().isEmpty());
    }

    @Test
    public void testEmptyAndSingle() {
        assertTrue(new IntervalSequence<LongInterval>().intersections().isEmpty());
        assertTrue(IntervalSequence.of(interval(0, 10)).intersections().isEmpty());
    }

    @Test
    public void testUnsortedInputIsNotModified() {
        IntervalSequence<LongInterval> sequence = IntervalSequence.of(interval(20, 30),
                interval(5, 15),
                interval(0, 10));

        IntervalSequence<LongInterval> intersections = sequence.intersections();
        assertEquals(List.of(interval(5, 10)), intersections.toList());
        assertNotSame(sequence, intersections);
        assertEquals(List.of(interval(20, 30), interval(5, 15), interval(0, 10)), sequence.toList());
    }

    @Test
    public void testDuplicates() {
        IntervalSequence<LongInterval> sequence = IntervalSequence.of(interval(0, 10), interval(0, 10));
        assertEquals(List.of(interval(0, 10)), sequence.intersections().toList());
    }
}
