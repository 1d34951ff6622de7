package slidingpuzzle.client;

import slidingpuzzle.planning.Algorithm;
import slidingpuzzle.planning.SearchResult;
import slidingpuzzle.planning.heuristic.HeuristicType;

import java.io.PrintStream;
import java.util.*;

/**
 * Results of a bulk experiment grouped by algorithm-heuristic combination, with
 * plain text and Markdown renderings.
 */
public class ExperimentReport {

    /** Records per "algorithm-heuristic" key, in the order combinations were run */
    private final Map<String, List<ExperimentRecord>> records = new LinkedHashMap<>();
    private final Map<String, Algorithm> algorithms = new HashMap<>();
    private final Map<String, HeuristicType> heuristics = new HashMap<>();

    /**
     * Registers a combination so it shows up in the report even if every run failed.
     */
    public void addCombination(Algorithm algorithm, HeuristicType heuristic) {
        String key = algorithm.getOptionName() + "-" + heuristic.getOptionName();
        records.computeIfAbsent(key, k -> new ArrayList<>());
        algorithms.put(key, algorithm);
        heuristics.put(key, heuristic);
    }

    public void add(ExperimentRecord record) {
        addCombination(record.algorithm, record.heuristic);
        records.get(record.getKey()).add(record);
    }

    /**
     * @return combination keys in run order
     */
    public Set<String> getKeys() {
        return Collections.unmodifiableSet(records.keySet());
    }

    public List<ExperimentRecord> getRecords(String key) {
        return Collections.unmodifiableList(records.getOrDefault(key, List.of()));
    }

    public List<ExperimentRecord> getRecords(Algorithm algorithm, HeuristicType heuristic) {
        return getRecords(algorithm.getOptionName() + "-" + heuristic.getOptionName());
    }

    /**
     * @param key combination key
     * @return aggregate statistics for the combination
     */
    public Summary summarize(String key) {
        return new Summary(getRecords(key));
    }

    /**
     * Aggregate statistics of one combination.
     */
    public static class Summary {
        public final int runs;
        public final int solved;
        /** Average solution length over solved runs, empty if none was solved */
        public final OptionalDouble averageSolutionLength;
        public final double averageNodesExpanded;
        public final double averageNodesGenerated;
        public final double averageSeconds;

        Summary(List<ExperimentRecord> records) {
            this.runs = records.size();
            this.solved = (int) records.stream().filter(r -> r.result.isSolved()).count();
            this.averageSolutionLength = records.stream()
                    .filter(r -> r.result.isSolved())
                    .mapToInt(r -> r.result.getSolutionLength())
                    .average();
            this.averageNodesExpanded = records.stream().mapToInt(r -> r.result.getNodesExpanded()).average().orElse(0);
            this.averageNodesGenerated = records.stream().mapToInt(r -> r.result.getNodesGenerated()).average().orElse(0);
            this.averageSeconds = records.stream().mapToDouble(r -> r.result.getElapsedSeconds()).average().orElse(0);
        }
    }

    /**
     * Prints the report as plain text.
     */
    public void printText(PrintStream out) {
        for (Map.Entry<String, List<ExperimentRecord>> entry : records.entrySet()) {
            String key = entry.getKey();
            Summary summary = summarize(key);

            out.println();
            out.println(algorithms.get(key).getOptionName().toUpperCase() + " SEARCH:");
            out.println("Heuristic: " + heuristics.get(key).getOptionName());
            out.println(averageLine(summary));
            out.println(String.format("Solved: %d/%d, average nodes expanded: %.1f, average nodes generated: %.1f, "
                    + "average time: %.3f seconds", summary.solved, summary.runs, summary.averageNodesExpanded,
                    summary.averageNodesGenerated, summary.averageSeconds));
            out.println();

            List<ExperimentRecord> experiments = entry.getValue();
            for (int i = 0; i < experiments.size(); i++) {
                ExperimentRecord record = experiments.get(i);
                out.println("Initial state " + (i + 1) + ": " + record.initialState);
                printResult(out, record.result);
                out.println();
            }
        }
    }

    /**
     * Prints a single run the way the command line shows it.
     */
    public static void printSingle(PrintStream out, ExperimentRecord record) {
        out.println("Initial state: " + record.initialState);
        printResult(out, record.result);
    }

    private static void printResult(PrintStream out, SearchResult result) {
        if (result.isSolved()) {
            out.println("Solution found in " + result.getSolutionLength() + " steps");
            out.println("Solution path: " + result.formatPath());
        } else {
            out.println("No solution found within the step limit.");
        }
        out.println("Nodes expanded: " + result.getNodesExpanded());
        out.println("Nodes generated: " + result.getNodesGenerated());
        out.println(String.format("Time taken: %.3f seconds", result.getElapsedSeconds()));
    }

    /**
     * Prints the report as Markdown: one section per algorithm, one sub-section per heuristic.
     *
     * @param out target stream
     * @param size grid width, used for the title
     */
    public void printMarkdown(PrintStream out, int size) {
        int tiles = size * size - 1;
        out.println("# " + tiles + "-Puzzle Solver Experiment Results");
        out.println();
        out.println("## Heuristics Used");
        out.println();
        out.println("### Misplaced Tiles");
        out.println("Counts the number of tiles that are not in their goal position.");
        out.println();
        out.println("### Manhattan Distance");
        out.println("Sums the Manhattan distance (|x1 - x2| + |y1 - y2|) of each tile from its goal position.");
        out.println();
        out.println("### Linear Conflict");
        out.println("Manhattan distance plus two moves for every tile that must leave its goal row or column "
                + "to let reversed tiles pass.");
        out.println();

        Algorithm current = null;
        for (Map.Entry<String, List<ExperimentRecord>> entry : records.entrySet()) {
            String key = entry.getKey();
            Algorithm algorithm = algorithms.get(key);
            if (algorithm != current) {
                out.println("## " + algorithm.getOptionName().toUpperCase() + " Search");
                out.println();
                current = algorithm;
            }

            Summary summary = summarize(key);
            out.println("### Heuristic: " + heuristics.get(key).getOptionName());
            out.println();
            out.println(averageLine(summary));
            out.println();
            out.println("| Solved | Avg. nodes expanded | Avg. nodes generated | Avg. time (s) |");
            out.println("|---|---|---|---|");
            out.println(String.format("| %d/%d | %.1f | %.1f | %.3f |", summary.solved, summary.runs,
                    summary.averageNodesExpanded, summary.averageNodesGenerated, summary.averageSeconds));
            out.println();

            List<ExperimentRecord> experiments = entry.getValue();
            for (int i = 0; i < experiments.size(); i++) {
                ExperimentRecord record = experiments.get(i);
                SearchResult result = record.result;
                out.println("#### Initial state " + (i + 1) + ": " + record.initialState);
                if (result.isSolved()) {
                    out.println("Solution found in " + result.getSolutionLength() + " steps");
                    out.println();
                    out.println("Solution path:");
                    out.println("```");
                    out.println(result.formatPath());
                    out.println("```");
                } else {
                    out.println("No solution found within the step limit.");
                }
                out.println();
                out.println("Nodes expanded: " + result.getNodesExpanded());
                out.println("Nodes generated: " + result.getNodesGenerated());
                out.println(String.format("Time taken: %.3f seconds", result.getElapsedSeconds()));
                out.println();
            }
        }
    }

    private static String averageLine(Summary summary) {
        if (summary.averageSolutionLength.isPresent()) {
            return String.format("Average number of steps: %.2f", summary.averageSolutionLength.getAsDouble());
        }
        return "No successful solutions found.";
    }
}
