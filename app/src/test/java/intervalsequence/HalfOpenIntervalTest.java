package intervalsequence;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class HalfOpenIntervalTest {

    private static LongInterval interval(long min, long max) {
        return new LongInterval(min, max);
    }

    @Test
    public void testOverlaps() {
        assertTrue(interval(0, 10).overlaps(interval(5, 15)));
        assertTrue(interval(5, 15).overlaps(interval(0, 10)));
        assertTrue(interval(0, 10).overlaps(interval(2, 3)));
        assertFalse(interval(0, 10).overlaps(interval(10, 20)));
        assertFalse(interval(0, 10).overlaps(interval(11, 20)));
    }

    @Test
    public void testAbuts() {
        assertTrue(interval(0, 10).abuts(interval(10, 20)));
        assertTrue(interval(10, 20).abuts(interval(0, 10)));
        assertFalse(interval(0, 10).abuts(interval(11, 20)));
        assertFalse(interval(0, 10).abuts(interval(5, 20)));
    }

    @Test
    public void testContains() {
        assertTrue(interval(0, 10).contains(interval(0, 10)));
        assertTrue(interval(0, 10).contains(interval(2, 8)));
        assertFalse(interval(0, 10).contains(interval(2, 11)));
        assertFalse(interval(2, 8).contains(interval(0, 10)));
    }

    @Test
    public void testGap() {
        assertEquals(interval(10, 20), interval(0, 10).gap(interval(20, 30)));
        assertEquals(interval(10, 20), interval(20, 30).gap(interval(0, 10)));
        assertEquals(interval(10, 10), interval(0, 10).gap(interval(10, 30)));
        assertThrows(IllegalArgumentException.class, () -> interval(0, 10).gap(interval(5, 30)));
    }

    @Test
    public void testIntersect() {
        assertEquals(interval(5, 10), interval(0, 10).intersect(interval(5, 15)));
        assertEquals(interval(2, 3), interval(0, 10).intersect(interval(2, 3)));
        assertThrows(IllegalArgumentException.class, () -> interval(0, 10).intersect(interval(10, 30)));
    }

    @Test
    public void testMerge() {
        assertEquals(interval(0, 30), interval(0, 10).merge(interval(20, 30)));
        assertEquals(interval(0, 30), interval(20, 30).merge(interval(0, 10)));
        assertEquals(interval(0, 10), interval(0, 10).merge(interval(2, 3)));
    }

    @Test
    public void testCompareStart() {
        assertTrue(interval(0, 10).compareStart(interval(5, 6)) < 0);
        assertTrue(interval(5, 10).compareStart(interval(0, 6)) > 0);
        assertEquals(0, interval(0, 10).compareStart(interval(0, 6)));
        assertTrue(Interval.<LongInterval>byStart().compare(interval(0, 1), interval(3, 4)) < 0);
    }

    @Test
    public void testInvalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> interval(10, 0));
        assertEquals(0, interval(3, 3).length());
    }
}
