package intervalsequence;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One line of an input file, for deserialization purposes
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IntervalInput {

    /** ISO 8601 instant or date, inclusive */
    private String start;
    /** ISO 8601 instant or date, exclusive */
    private String end;

    public IntervalInput() {
    }

    public IntervalInput(String start, String end) {
        this.start = start;
        this.end = end;
    }

    public TimeInterval toTimeInterval() {
        return TimeInterval.parse(start, end);
    }

    public String getStart() {
        return start;
    }

    public void setStart(String start) {
        this.start = start;
    }

    public String getEnd() {
        return end;
    }

    public void setEnd(String end) {
        this.end = end;
    }
}
