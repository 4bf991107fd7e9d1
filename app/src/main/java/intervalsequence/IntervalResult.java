package intervalsequence;

import java.time.Instant;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * An interval found by the tool, for serialization purposes
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IntervalResult {

    /** ISO 8601 date time string */
    private String resultTime;
    /** gap, intersection or bounds */
    private String kind;
    private int offset;
    private String start;
    private String end;

    public IntervalResult() {
    }

    public IntervalResult(Instant resultTime, String kind, int offset, TimeInterval interval) {
        this(resultTime.toString(),
                kind,
                offset,
                interval.min().toInstant().toString(),
                interval.max().toInstant().toString());
    }

    public IntervalResult(String resultTime, String kind, int offset, String start, String end) {
        this.resultTime = resultTime;
        this.kind = kind;
        this.offset = offset;
        this.start = start;
        this.end = end;
    }

    public String getResultTime() {
        return resultTime;
    }

    public void setResultTime(String resultTime) {
        this.resultTime = resultTime;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public int getOffset() {
        return offset;
    }

    public void setOffset(int offset) {
        this.offset = offset;
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
