package intervalsequence;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class IntervalLoaderTest {

    @TempDir
    Path tempDir;

    private static IntervalSequence<TimeInterval> loadResource(String name) throws IOException {
        try (InputStream in = IntervalLoaderTest.class.getResourceAsStream("/" + name)) {
            assertNotNull(in, name);
            return new IntervalLoader().load(in);
        }
    }

    @Test
    public void testLoad() throws IOException {
        IntervalSequence<TimeInterval> intervals = loadResource("intervals.jsonl");

        assertEquals(3, intervals.count());
        assertEquals(TimeInterval.parse("2020-01-01", "2020-01-05"), intervals.get(0));
        assertEquals(TimeInterval.parse("2020-01-03", "2020-01-10"), intervals.get(2));
        assertEquals(TimeInterval.parse("2020-01-01", "2020-01-25"), intervals.getBoundingInterval().get());
        assertEquals(List.of(TimeInterval.parse("2020-01-10", "2020-01-20")), intervals.gaps().toList());
        assertEquals(List.of(TimeInterval.parse("2020-01-03", "2020-01-05")), intervals.intersections().toList());
    }

    @Test
    public void testBadLine() {
        assertThrows(TimeInterval.BadIntervalException.class, () -> loadResource("bad-intervals.jsonl"));
    }

    @Test
    public void testLoadGzipFile() throws IOException {
        Path file = tempDir.resolve("input.json.gz");
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(file))) {
            out.write("{\"start\": \"2021-06-01\", \"end\": \"2021-06-02\"}\n".getBytes(StandardCharsets.UTF_8));
        }

        IntervalSequence<TimeInterval> intervals = new IntervalLoader().load(file.toString());
        assertEquals(List.of(TimeInterval.parse("2021-06-01", "2021-06-02")), intervals.toList());
    }

    @Test
    public void testLoadEmptyFile() throws IOException {
        Path file = tempDir.resolve("empty.jsonl");
        Files.writeString(file, "");
        assertTrue(new IntervalLoader().load(file.toString()).isEmpty());
    }
}
