package intervalsequence;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.GZIPInputStream;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

/**
 * Reads time intervals from newline-delimited JSON, one <code>{"start": ..., "end": ...}</code>
 * object per line, in the same format the tool writes its results
 */
public class IntervalLoader {

    private final ObjectReader reader;

    public IntervalLoader() {
        this.reader = new ObjectMapper().readerFor(IntervalInput.class);
    }

    /**
     * Load a file, gunzipping it first if its name ends with <code>.gz</code>
     */
    public IntervalSequence<TimeInterval> load(String fileName) throws IOException {
        try (InputStream fileStream = new FileInputStream(fileName)) {
            if (fileName.endsWith(".gz")) {
                try (InputStream gzipStream = new GZIPInputStream(fileStream)) {
                    return load(gzipStream);
                }
            }
            return load(fileStream);
        }
    }

    public IntervalSequence<TimeInterval> load(InputStream inputStream) throws IOException {
        IntervalSequence<TimeInterval> sequence = new IntervalSequence<>();
        try (MappingIterator<IntervalInput> it = reader.readValues(inputStream)) {
            while (it.hasNextValue()) {
                IntervalInput input = it.nextValue();
                TimeInterval interval = input.toTimeInterval();
                if (interval.min().equals(interval.max())) {
                    System.out.format("WARNING: interval %s is empty\n", interval);
                }
                sequence.push(interval);
            }
        }
        return sequence;
    }
}
