package slidingpuzzle.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import slidingpuzzle.domain.PuzzleState;
import slidingpuzzle.domain.UnsolvableStateException;
import slidingpuzzle.planning.Algorithm;
import slidingpuzzle.planning.heuristic.HeuristicType;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExperimentRunner Tests")
class ExperimentRunnerTest {

    private static final PuzzleState EASY = PuzzleState.parse("1 2 3 4 5 6 7 0 8");
    private static final PuzzleState MEDIUM = PuzzleState.parse("1 2 3 4 0 8 7 6 5");
    private static final PuzzleState UNSOLVABLE = PuzzleState.parse("8 1 2 0 4 3 7 6 5");

    private final ExperimentRunner runner = new ExperimentRunner(10_000);

    @Nested
    @DisplayName("Running experiments")
    class RunTests {

        @Test
        @DisplayName("Should record configuration and result of a single run")
        void testRunExperiment() {
            ExperimentRecord record = runner.runExperiment(Algorithm.ASTAR, HeuristicType.MANHATTAN, MEDIUM);

            assertEquals("astar-manhattan", record.getKey());
            assertEquals(MEDIUM, record.initialState);
            assertTrue(record.result.isSolved());
            assertEquals(6, record.result.getSolutionLength());
        }

        @Test
        @DisplayName("Should propagate unsolvable input from a single run")
        void testRunExperimentUnsolvable() {
            assertThrows(UnsolvableStateException.class,
                    () -> runner.runExperiment(Algorithm.BEST_FIRST, HeuristicType.MISPLACED, UNSOLVABLE));
        }

        @Test
        @DisplayName("Should run every combination and skip unsolvable states")
        void testRunAll() {
            ExperimentReport report = runner.runAll(List.of(EASY, UNSOLVABLE, MEDIUM));

            assertEquals(List.of(
                    "best-first-misplaced", "best-first-manhattan", "best-first-linear_conflict",
                    "astar-misplaced", "astar-manhattan", "astar-linear_conflict"),
                    new ArrayList<>(report.getKeys()));

            for (String key : report.getKeys()) {
                List<ExperimentRecord> records = report.getRecords(key);
                assertEquals(2, records.size(), key);
                assertEquals(EASY, records.get(0).initialState);
                assertEquals(MEDIUM, records.get(1).initialState);
            }

            ExperimentReport.Summary summary = report.summarize("astar-manhattan");
            assertEquals(2, summary.runs);
            assertEquals(2, summary.solved);
            assertEquals(3.5, summary.averageSolutionLength.getAsDouble(), 1e-9);
            assertTrue(summary.averageNodesExpanded > 0);
        }
    }

    @Nested
    @DisplayName("Reports")
    class ReportTests {

        private String render(boolean markdown) {
            ExperimentReport report = runner.runAll(List.of(EASY, MEDIUM));
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
            if (markdown) {
                report.printMarkdown(out, 3);
            } else {
                report.printText(out);
            }
            return buffer.toString(StandardCharsets.UTF_8);
        }

        @Test
        @DisplayName("Should print each combination with its runs")
        void testPrintText() {
            String text = render(false);

            assertTrue(text.contains("BEST-FIRST SEARCH:"));
            assertTrue(text.contains("ASTAR SEARCH:"));
            assertTrue(text.contains("Heuristic: linear_conflict"));
            assertTrue(text.contains("Initial state 2: (1 2 3 4 b 8 7 6 5)"));
            assertTrue(text.contains("Solution found in 6 steps"));
            assertTrue(text.contains("Solution path: (1 2 3 4 5 6 7 b 8) → (1 2 3 4 5 6 7 8 b)"));
            assertTrue(text.contains("Nodes expanded: 1"));
        }

        @Test
        @DisplayName("Should print Markdown sections per algorithm and heuristic")
        void testPrintMarkdown() {
            String markdown = render(true);

            assertTrue(markdown.startsWith("# 8-Puzzle Solver Experiment Results"));
            assertTrue(markdown.contains("## BEST-FIRST Search"));
            assertTrue(markdown.contains("## ASTAR Search"));
            assertTrue(markdown.contains("### Heuristic: misplaced"));
            assertTrue(markdown.contains("#### Initial state 1: (1 2 3 4 5 6 7 b 8)"));
            assertTrue(markdown.contains("```\n(1 2 3 4 5 6 7 b 8) → (1 2 3 4 5 6 7 8 b)\n```")
                    || markdown.contains("```\r\n(1 2 3 4 5 6 7 b 8) → (1 2 3 4 5 6 7 8 b)\r\n```"));
        }

        @Test
        @DisplayName("Should report combinations without solutions")
        void testNoSolutions() {
            ExperimentReport report = new ExperimentRunner(1).runAll(List.of(MEDIUM));
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            report.printText(new PrintStream(buffer, true, StandardCharsets.UTF_8));
            String text = buffer.toString(StandardCharsets.UTF_8);

            assertTrue(text.contains("No successful solutions found."));
            assertTrue(text.contains("No solution found within the step limit."));
            assertFalse(report.summarize("astar-misplaced").averageSolutionLength.isPresent());
        }
    }

    @Nested
    @DisplayName("Collecting initial states")
    class CollectStatesTests {

        @Test
        @DisplayName("Should top up file states with generated puzzles")
        void testTopUp(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("states.txt");
            Files.writeString(file, "# two states\n1 2 3 4 0 8 7 6 5\n1 2 3 4 5 6 7 0 8\n");

            List<PuzzleState> states = ExperimentRunner.collectStates(file, 3, 5, 42);

            assertEquals(5, states.size());
            assertEquals(MEDIUM, states.get(0));
            assertEquals(EASY, states.get(1));
            assertEquals(5, new HashSet<>(states).size());
            states.forEach(state -> assertTrue(state.isSolvable()));
            // the file is only read
            assertEquals(3, Files.readAllLines(file).size());
        }

        @Test
        @DisplayName("Should generate all states when the file is missing")
        void testMissingFile(@TempDir Path dir) throws IOException {
            List<PuzzleState> states = ExperimentRunner.collectStates(dir.resolve("missing.txt"), 4, 3, 42);

            assertEquals(3, states.size());
            states.forEach(state -> assertEquals(4, state.getSize()));
            assertFalse(Files.exists(dir.resolve("missing.txt")));
        }

        @Test
        @DisplayName("Should keep every file state when there are more than needed")
        void testNoTopUpNeeded(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("states.txt");
            Files.writeString(file, "1 2 3 4 0 8 7 6 5\n1 2 3 4 5 6 7 0 8\n");

            assertEquals(List.of(MEDIUM, EASY), ExperimentRunner.collectStates(file, 3, 1, 42));
        }
    }

    @Test
    @DisplayName("Should reject a non-positive step limit")
    void testInvalidLimit() {
        assertThrows(IllegalArgumentException.class, () -> new ExperimentRunner(0));
    }
}
