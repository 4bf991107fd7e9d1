package intervalsequence;

import java.time.OffsetDateTime;

/**
 * Config settings controlling what the interval tool computes and where it writes results
 */
record IntervalToolConfig(String inputFile,
        OffsetDateTime from,
        OffsetDateTime to,
        boolean findGaps,
        boolean findIntersections,
        boolean saveOutput,
        String outputPrefix) {

    /**
     * True if only the intervals overlapping <code>[from, to)</code> should be analysed
     */
    boolean hasWindow() {
        return from != null || to != null;
    }
}
