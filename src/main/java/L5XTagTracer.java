import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

/**
 * Traces where each monitored SCADA tag gets its value in an L5X ladder logic export
 * and writes one mapping row per (tag, source) pair.
 *
 * <p>Resolution runs in three phases, each only seeing tags the earlier ones left open:
 * rung scan (COP/CPS, MOV, FFL, message requests), bit-output sweep over INT/DINT tags,
 * then a "Not Found" row for whatever is left.
 */
public class L5XTagTracer {

    private static final Logger logger = LoggerFactory.getLogger(L5XTagTracer.class);

    static final int EXIT_INPUT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE =
        "Usage: java L5XTagTracer --tags <file.csv|file.xlsx> --program <file.L5X>"
        + " [--output <file.xlsx|file.csv>] [--column <name>] [--topic <name>] [--quiet]";

    public static void main(String[] args) {
        TracerOptions options;
        try {
            options = parseArguments(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            System.exit(EXIT_USAGE);
            return;
        }

        try {
            L5XTagTracer tracer = new L5XTagTracer();
            long startTime = System.currentTimeMillis();
            TagTraceResult result = tracer.run(options);
            long endTime = System.currentTimeMillis();
            if (!options.isQuiet()) {
                tracer.printResults(result, options, endTime - startTime);
            }
        } catch (L5XInputException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(EXIT_INPUT_ERROR);
        }
    }

    static TracerOptions parseArguments(String[] args) {
        Path tags = null;
        Path program = null;
        Path output = null;
        String column = TracerOptions.DEFAULT_COLUMN;
        String topic = TracerOptions.DEFAULT_TOPIC;
        boolean quiet = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--tags":
                    tags = Paths.get(value(args, ++i, "--tags"));
                    break;
                case "--program":
                    program = Paths.get(value(args, ++i, "--program"));
                    break;
                case "--output":
                    output = Paths.get(value(args, ++i, "--output"));
                    break;
                case "--column":
                    column = value(args, ++i, "--column");
                    break;
                case "--topic":
                    topic = value(args, ++i, "--topic");
                    break;
                case "--quiet":
                    quiet = true;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        if (tags == null || program == null) {
            throw new IllegalArgumentException("Both --tags and --program are required");
        }
        if (column.trim().isEmpty()) {
            throw new IllegalArgumentException("--column must not be empty");
        }
        if (output == null) {
            Path parent = program.toAbsolutePath().getParent();
            output = parent == null
                ? Paths.get(TracerOptions.DEFAULT_OUTPUT_NAME)
                : parent.resolve(TracerOptions.DEFAULT_OUTPUT_NAME);
        }
        return new TracerOptions(tags, program, output, column, topic, quiet);
    }

    private static String value(String[] args, int i, String option) {
        if (i >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[i];
    }

    // =====================================================================
    // RUN
    // =====================================================================

    /**
     * Loads both inputs, traces the tags and writes the mapping table.
     */
    public TagTraceResult run(TracerOptions options) throws L5XInputException {
        checkPath(options.getTagsPath(), "Tags");
        checkPath(options.getProgramPath(), "L5X");

        MonitoredTags monitored = new L5XTagListLoader(options.getColumn(), options.getTopic())
            .load(options.getTagsPath());

        L5XDocumentLoader documentLoader = new L5XDocumentLoader();
        Document document = documentLoader.load(options.getProgramPath());
        ProgramIndex index = new L5XProgramIndexBuilder().build(document, documentLoader.isRecovered());

        TagTraceResult result = trace(monitored, index);
        new L5XMappingWriter(options.getColumn()).write(result.getRecords(), options.getOutputPath());
        return result;
    }

    /**
     * Runs the three resolution phases and consolidates their records.
     * Every monitored tag ends up with at least one record.
     */
    public TagTraceResult trace(MonitoredTags monitored, ProgramIndex index) {
        RungScanResult scan = new L5XRungScanner(index, monitored).scan();

        Set<String> resolved = new HashSet<>(scan.getResolved());
        PhaseResult bits = new L5XBitOutputSweep(index, scan).sweep(monitored, resolved);
        resolved.addAll(bits.getResolved());

        PhaseResult missing = new L5XUnresolvedReporter(index).report(monitored, resolved);

        List<MappingRecord> records = new L5XResultConsolidator().consolidate(Arrays.asList(scan, bits, missing));
        logger.info("Traced {} monitored tags into {} mapping rows", monitored.size(), records.size());

        return new TagTraceResult(records, monitored.size(), index.getDeclarations().size(),
            index.getRungs().size(), scan.getFallbackRungs(), index.isRecovered());
    }

    static void checkPath(Path path, String label) throws L5XInputException {
        logger.info("Checking {} file: {}", label, path.toAbsolutePath());
        if (!Files.exists(path)) {
            throw new L5XInputException(label + " file not found: " + path);
        }
        if (!Files.isRegularFile(path)) {
            throw new L5XInputException(label + " path is not a file: " + path);
        }
    }

    private void printResults(TagTraceResult result, TracerOptions options, long totalTime) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("L5X TAG TRACE RESULTS");
        System.out.println("=".repeat(60));

        System.out.println("Program file: " + options.getProgramPath());
        System.out.println("Tags file: " + options.getTagsPath() + " (column " + options.getColumn() + ")");
        System.out.println("Total Processing Time: " + totalTime + "ms");
        if (result.isDocumentRecovered()) {
            System.out.println("Note: L5X was malformed; traced after repair or partial recovery");
        }

        System.out.println("\n" + "-".repeat(40));
        System.out.println("INPUTS");
        System.out.println("-".repeat(40));
        System.out.println("Monitored tags: " + result.getMonitoredTags());
        System.out.println("Declared tags: " + result.getDeclaredTags());
        System.out.println("Rungs scanned: " + result.getRungsScanned());
        System.out.println("Rungs matched by fallback patterns: " + result.getFallbackRungs());

        System.out.println("\n" + "-".repeat(40));
        System.out.println("MAPPING ROWS BY INSTRUCTION");
        System.out.println("-".repeat(40));
        for (Map.Entry<String, Integer> entry : result.getInstructionCounts().entrySet()) {
            System.out.println(String.format("  %-10s %d", entry.getKey(), entry.getValue()));
        }
        System.out.println("Total rows: " + result.getRecords().size());

        System.out.println("\nMapping written to: " + options.getOutputPath());
    }
}
