package intervalsequence;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.zip.GZIPOutputStream;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.google.common.annotations.VisibleForTesting;

public class IntervalSequenceApp {

    static final String KIND_BOUNDS = "bounds";
    static final String KIND_GAP = "gap";
    static final String KIND_INTERSECTION = "intersection";

    // Command line options
    private static final String OPT_SHORT_HELP = "h";
    private static final String OPT_LONG_HELP = "help";
    private static final String OPT_LONG_INPUT = "input";
    private static final String OPT_LONG_FROM = "from";
    private static final String OPT_LONG_TO = "to";
    private static final String OPT_LONG_NO_GAPS = "noGaps";
    private static final String OPT_LONG_NO_INTERSECTIONS = "noIntersections";
    private static final String OPT_LONG_NO_OUTPUT = "noOutput";
    private static final String OPT_LONG_OUTPUT_PREFIX = "outputPrefix";

    public static void main(String[] args) {
        // Process command line options
        Options options = getCommandLineOptions();
        CommandLine commandLine = parseCommandLine(options, args);

        IntervalToolConfig config;
        try {
            config = getConfig(commandLine);
        } catch (RuntimeException e) {
            // There was a problem with the options, exit with non-zero status
            System.out.println(e.getMessage());
            System.exit(1);
            return;
        }

        IntervalSequenceApp app = new IntervalSequenceApp(config);
        try {
            app.run();
        } catch (IOException | RuntimeException e) {
            System.out.println("Failed to process " + config.inputFile() + ": " + e.getMessage());
            System.exit(1);
        }
    }

    private final IntervalToolConfig config;
    private final Instant runTime;
    private final String localRunTime;

    @VisibleForTesting
    IntervalSequenceApp(IntervalToolConfig config) {
        this.config = config;

        var nowLocal = ZonedDateTime.now().truncatedTo(ChronoUnit.SECONDS);
        // filename friendly version of now
        localRunTime = DateTimeFormatter.ofPattern("uuuu-MM-dd-HH-mm-ss").format(nowLocal);
        runTime = nowLocal.toInstant();
    }

    private void run() throws IOException {
        IntervalSequence<TimeInterval> intervals = new IntervalLoader().load(config.inputFile());
        intervals = applyWindow(intervals);

        long start = System.currentTimeMillis();
        Optional<TimeInterval> bounds = intervals.getBoundingInterval();
        IntervalSequence<TimeInterval> gaps = config.findGaps() ? intervals.gaps() : new IntervalSequence<>();
        IntervalSequence<TimeInterval> intersections = config.findIntersections() ? intervals.intersections()
                : new IntervalSequence<>();
        long end = System.currentTimeMillis();
        System.out.format("\nAnalysing %,d intervals took %,dms\n", intervals.count(), end - start);

        printTable("Intervals", intervals);
        System.out.println("Bounding interval: " + bounds.map(TimeInterval::toString).orElse("none"));
        if (config.findGaps()) {
            printTable("Gaps", gaps);
        }
        if (config.findIntersections()) {
            printTable("Intersections", intersections);
        }

        if (config.saveOutput()) {
            if (bounds.isPresent()) {
                saveResults(KIND_BOUNDS, IntervalSequence.of(bounds.get()));
            }
            if (config.findGaps()) {
                saveResults(KIND_GAP, gaps);
            }
            if (config.findIntersections()) {
                saveResults(KIND_INTERSECTION, intersections);
            }
        }
    }

    /**
     * Keep only the intervals overlapping the configured window, if there is one
     */
    @VisibleForTesting
    IntervalSequence<TimeInterval> applyWindow(IntervalSequence<TimeInterval> intervals) {
        if (!config.hasWindow()) {
            return intervals;
        }
        OffsetDateTime windowMin = config.from();
        OffsetDateTime windowMax = config.to();
        if (windowMin == null || windowMax == null) {
            Optional<TimeInterval> bounds = intervals.getBoundingInterval();
            if (bounds.isEmpty()) {
                return intervals;
            }
            windowMin = windowMin == null ? bounds.get().min() : windowMin;
            windowMax = windowMax == null ? bounds.get().max() : windowMax;
        }
        if (!windowMin.isBefore(windowMax)) {
            // the window lies entirely before or after the data
            return intervals.filteredCopy(interval -> false);
        }
        TimeInterval window = new TimeInterval(windowMin, windowMax);
        return intervals.filteredCopy(window::overlaps);
    }

    private void printTable(String title, IntervalSequence<TimeInterval> intervals) {
        System.out.format("%s (%,d)\n", title, intervals.count());
        // First pass to get width
        int offsetWidth = 1;
        for (IntervalSequence.Entry<TimeInterval> entry : intervals) {
            offsetWidth = Math.max(offsetWidth, String.valueOf(entry.offset()).length());
        }

        String format = "%" + offsetWidth + "d: %s  %s\n";
        for (IntervalSequence.Entry<TimeInterval> entry : intervals) {
            TimeInterval interval = entry.interval();
            System.out.format(format, entry.offset(), interval, ChronoUnit.SECONDS.between(interval.min(), interval.max()) + "s");
        }
        System.out.println();
    }

    private String filenameFor(String kind) {
        return config.outputPrefix() + "-" + kind + "-" + localRunTime + ".json.gz";
    }

    @VisibleForTesting
    void saveResults(String kind, IntervalSequence<TimeInterval> intervals) throws IOException {
        ObjectWriter ow = new ObjectMapper().writer().withRootValueSeparator("\n");
        try (OutputStream resultStream = new GZIPOutputStream(new FileOutputStream(filenameFor(kind)));
                SequenceWriter seq = ow.writeValues(resultStream)) {
            for (IntervalSequence.Entry<TimeInterval> entry : intervals) {
                seq.write(new IntervalResult(runTime, kind, entry.offset(), entry.interval()));
            }
        }
    }

    /**
     * Return the command line options
     */
    @VisibleForTesting
    static Options getCommandLineOptions() {
        Options options = new Options();

        options.addOption(Option.builder(OPT_SHORT_HELP).longOpt(OPT_LONG_HELP).desc("Show help").build());

        options.addOption(Option.builder()
                .longOpt(OPT_LONG_INPUT)
                .hasArg()
                .required(true)
                .desc("Newline-delimited JSON file of {\"start\": ..., \"end\": ...} intervals, optionally gzipped")
                .build());

        options.addOption(Option.builder()
                .longOpt(OPT_LONG_FROM)
                .hasArg()
                .required(false)
                .desc("Only analyse intervals overlapping a window starting at this time (inclusive)")
                .build());

        options.addOption(Option.builder()
                .longOpt(OPT_LONG_TO)
                .hasArg()
                .required(false)
                .desc("Only analyse intervals overlapping a window ending at this time (exclusive)")
                .build());

        options.addOption(Option.builder()
                .longOpt(OPT_LONG_NO_GAPS)
                .required(false)
                .desc("Do not look for gaps between intervals")
                .build());

        options.addOption(Option.builder()
                .longOpt(OPT_LONG_NO_INTERSECTIONS)
                .required(false)
                .desc("Do not look for intersections between intervals")
                .build());

        options.addOption(Option.builder()
                .longOpt(OPT_LONG_NO_OUTPUT)
                .required(false)
                .desc("Do not save output to files")
                .build());

        options.addOption(Option.builder()
                .longOpt(OPT_LONG_OUTPUT_PREFIX)
                .hasArg()
                .required(false)
                .desc("Prefix to give to output files")
                .build());

        return options;
    }

    /**
     * Parse command line options. A help request, or a problem with the options, prints the usage
     * and exits the process, so this only returns a usable command line.
     */
    private static CommandLine parseCommandLine(Options options, String[] args) {
        if (isHelpRequested(args)) {
            printUsageAndExit(options, 0);
        }
        try {
            return new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            System.out.println(e.getMessage());
            printUsageAndExit(options, 1);
            return null;
        }
    }

    /**
     * True if help was asked for anywhere on the command line, whether or not the other options are
     * valid, so that <code>--help</code> works without <code>--input</code>
     */
    @VisibleForTesting
    static boolean isHelpRequested(String[] args) {
        Options helpOnly = new Options();
        helpOnly.addOption(Option.builder(OPT_SHORT_HELP).longOpt(OPT_LONG_HELP).build());
        CommandLineParser parser = new DefaultParser();
        for (String arg : args) {
            try {
                if (parser.parse(helpOnly, new String[] { arg }).hasOption(OPT_SHORT_HELP)) {
                    return true;
                }
            } catch (ParseException e) {
                // any other option, the full parse reports it
                continue;
            }
        }
        return false;
    }

    private static void printUsageAndExit(Options options, int exitCode) {
        new HelpFormatter().printHelp(IntervalSequenceApp.class.getName(),
                "Find gaps and intersections in a list of time intervals. Options:",
                options,
                "",
                true);
        System.exit(exitCode);
    }

    /**
     * Turn parsed command line arguments into usable object
     *
     * @throws TimeInterval.BadIntervalException
     *         if a window bound is not a valid time
     * @throws IllegalArgumentException
     *         if the window starts after it ends
     */
    @VisibleForTesting
    static IntervalToolConfig getConfig(CommandLine commandLine) {
        String inputFile = commandLine.getOptionValue(OPT_LONG_INPUT);

        OffsetDateTime from = null;
        if (commandLine.hasOption(OPT_LONG_FROM)) {
            from = TimeInterval.parseTime(commandLine.getOptionValue(OPT_LONG_FROM));
        }

        OffsetDateTime to = null;
        if (commandLine.hasOption(OPT_LONG_TO)) {
            to = TimeInterval.parseTime(commandLine.getOptionValue(OPT_LONG_TO));
        }

        boolean findGaps = !commandLine.hasOption(OPT_LONG_NO_GAPS);
        boolean findIntersections = !commandLine.hasOption(OPT_LONG_NO_INTERSECTIONS);

        boolean saveOutput = true;
        if (commandLine.hasOption(OPT_LONG_NO_OUTPUT)) {
            saveOutput = false;
        }

        String outputPrefix = "intervals";
        if (commandLine.hasOption(OPT_LONG_OUTPUT_PREFIX)) {
            outputPrefix = commandLine.getOptionValue(OPT_LONG_OUTPUT_PREFIX);
        }

        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("--" + OPT_LONG_FROM + " " + from.toInstant() + " is after --"
                    + OPT_LONG_TO + " " + to.toInstant());
        }

        return new IntervalToolConfig(inputFile, from, to, findGaps, findIntersections, saveOutput, outputPrefix);
    }
}
