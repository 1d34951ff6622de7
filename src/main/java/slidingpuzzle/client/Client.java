package slidingpuzzle.client;

import slidingpuzzle.domain.*;
import slidingpuzzle.planning.*;
import slidingpuzzle.planning.heuristic.HeuristicType;

import java.io.*;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

/**
 * Command line entry point.
 *
 * Usage:
 * <pre>
 * --algorithm best-first|astar --heuristic misplaced|manhattan|linear_conflict [--state "1 2 3 ..."]
 *     runs one experiment
 * --all (or no algorithm/heuristic)
 *     runs every algorithm x heuristic combination over --state, or over the loaded states
 * </pre>
 *
 * Results go to stdout; diagnostics go to stderr.
 *
 * Exit codes: 0 on success, 1 for invalid/unsolvable input or I/O failure,
 * 2 for bad command line arguments.
 */
public class Client {

    /** Default states file, resolved against the working directory */
    private static final String DEFAULT_STATES_FILE = "data/initial_states_%d.txt";

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    /** Results output */
    private final PrintStream out;

    /** Debug output stream */
    private final PrintStream debugOut;

    /**
     * Creates a new Client with standard output streams.
     */
    public Client() {
        this(System.out, System.err);
    }

    /**
     * Creates a new Client with custom output streams (for testing).
     *
     * @param out   results stream
     * @param debug debug output stream
     */
    public Client(PrintStream out, PrintStream debug) {
        this.out = out;
        this.debugOut = debug;
    }

    /**
     * Main entry point.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        int status = new Client().run(args);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Parses the arguments and runs the requested experiments.
     *
     * @param args command line arguments
     * @return process exit code
     */
    public int run(String[] args) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            debugOut.println("Error: " + e.getMessage());
            printUsage(debugOut);
            return EXIT_USAGE;
        }

        if (options.help) {
            printUsage(out);
            return EXIT_OK;
        }

        try {
            if (!options.all && options.algorithm != null && options.heuristic != null) {
                runSingle(options);
            } else {
                runBulk(options);
            }
            return EXIT_OK;
        } catch (UnsolvableStateException | InvalidStateException e) {
            debugOut.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            debugOut.println("Error reading states: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private void runSingle(Options options) throws IOException {
        PuzzleState state;
        if (options.state != null) {
            state = PuzzleState.parse(options.state);
        } else {
            List<PuzzleState> states = ExperimentRunner.collectStates(options.statesFile(), options.gridSize, 1,
                    options.seed);
            state = states.isEmpty() ? PuzzleState.goal(options.gridSize) : states.get(0);
        }

        out.println("Running " + options.algorithm + " search with " + options.heuristic
                + " heuristic on state: " + state.toTileString());
        out.println();

        ExperimentRunner runner = new ExperimentRunner(options.maxSteps);
        ExperimentRecord record = runner.runExperiment(options.algorithm, options.heuristic, state);
        ExperimentReport.printSingle(out, record);
    }

    private void runBulk(Options options) throws IOException {
        List<PuzzleState> states = options.state != null
                ? List.of(PuzzleState.parse(options.state))
                : ExperimentRunner.collectStates(options.statesFile(), options.gridSize, options.count, options.seed);
        debugOut.println("[Client] Running all experiments on " + states.size() + " initial states ("
                + options.gridSize + "x" + options.gridSize + " grid)...");

        ExperimentReport report = new ExperimentRunner(options.maxSteps).runAll(states);
        if (options.markdown) {
            report.printMarkdown(out, options.gridSize);
        } else {
            report.printText(out);
        }
    }

    static void printUsage(PrintStream stream) {
        stream.println("Usage: Client [options]");
        stream.println("  --algorithm <best-first|astar>                     search algorithm");
        stream.println("  --heuristic <misplaced|manhattan|linear_conflict>  heuristic function");
        stream.println("  --state \"<tiles>\"                                  initial state, 0 for the blank");
        stream.println("  --max-steps <n>                                    expansion limit (default "
                + SearchConfig.DEFAULT_MAX_STEPS + ")");
        stream.println("  --all                                              run every combination");
        stream.println("  --size <8|15>                                      puzzle size (default 8)");
        stream.println("  --states <file>                                    initial states file for bulk runs");
        stream.println("  --count <n>                                        minimum number of bulk states (default "
                + SearchConfig.DEFAULT_EXPERIMENT_STATES + ")");
        stream.println("  --seed <n>                                         seed for generated puzzles");
        stream.println("  --markdown                                         print the bulk report as Markdown");
        stream.println("  --help                                             show this message");
    }

    /**
     * Parsed command line options.
     */
    static class Options {
        Algorithm algorithm;
        HeuristicType heuristic;
        String state;
        int maxSteps = SearchConfig.DEFAULT_MAX_STEPS;
        boolean all;
        int gridSize = 3;
        String statesPath;
        int count = SearchConfig.DEFAULT_EXPERIMENT_STATES;
        long seed = SearchConfig.RANDOM_SEED;
        boolean markdown;
        boolean help;

        /**
         * @throws IllegalArgumentException on unknown options or bad values
         */
        static Options parse(String[] args) {
            Options options = new Options();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--algorithm" -> options.algorithm = Algorithm.fromName(value(args, ++i, arg));
                    case "--heuristic" -> options.heuristic = HeuristicType.fromName(value(args, ++i, arg));
                    case "--state" -> options.state = value(args, ++i, arg);
                    case "--max-steps" -> options.maxSteps = positive(value(args, ++i, arg), arg);
                    case "--all" -> options.all = true;
                    case "--size" -> options.gridSize = gridSizeFor(value(args, ++i, arg));
                    case "--states" -> options.statesPath = value(args, ++i, arg);
                    case "--count" -> options.count = positive(value(args, ++i, arg), arg);
                    case "--seed" -> options.seed = number(value(args, ++i, arg), arg);
                    case "--markdown" -> options.markdown = true;
                    case "--help", "-h" -> options.help = true;
                    default -> throw new IllegalArgumentException("Unknown option: " + arg);
                }
            }
            if ((options.algorithm == null) != (options.heuristic == null) && !options.all) {
                throw new IllegalArgumentException("--algorithm and --heuristic must be given together");
            }
            return options;
        }

        Path statesFile() {
            String path = statesPath != null ? statesPath : String.format(DEFAULT_STATES_FILE, gridSize * gridSize - 1);
            return Paths.get(path);
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            return args[index];
        }

        private static long number(String value, String option) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + option + ": " + value, e);
            }
        }

        private static int positive(String value, String option) {
            long n = number(value, option);
            if (n <= 0 || n > Integer.MAX_VALUE) {
                throw new IllegalArgumentException(option + " must be a positive integer, got " + value);
            }
            return (int) n;
        }

        private static int gridSizeFor(String value) {
            return switch (value.trim()) {
                case "8" -> 3;
                case "15" -> 4;
                default -> throw new IllegalArgumentException("--size must be 8 or 15, got " + value);
            };
        }
    }
}
