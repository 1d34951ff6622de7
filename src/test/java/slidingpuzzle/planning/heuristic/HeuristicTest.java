package slidingpuzzle.planning.heuristic;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import slidingpuzzle.domain.PuzzleState;
import slidingpuzzle.planning.GoalDistances;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Heuristic Tests")
class HeuristicTest {

    private final Heuristic misplaced = new MisplacedTilesHeuristic();
    private final Heuristic manhattan = new ManhattanHeuristic();
    private final LinearConflictHeuristic linearConflict = new LinearConflictHeuristic();

    @ParameterizedTest(name = "{0}")
    @CsvSource({
            // state,                                       misplaced, manhattan, linear conflict
            "1 2 3 4 5 6 7 8 0,                              0, 0, 0",
            "1 2 3 4 5 6 7 0 8,                              1, 1, 1",
            "1 2 3 0 5 6 4 7 8,                              3, 3, 3",
            "1 2 3 4 0 8 7 6 5,                              3, 6, 6",
            "8 1 2 7 0 3 6 5 4,                              8, 14, 14",
            "8 7 6 5 4 3 2 1 0,                              8, 16, 20",
            "1 2 3 4 5 6 8 7 0,                              2, 2, 4",
            "1 2 3 4 5 6 7 8 9 10 11 12 13 14 15 0,          0, 0, 0",
            "1 2 3 4 5 6 7 8 9 10 11 12 13 14 0 15,          1, 1, 1",
            "1 2 3 4 5 6 7 8 9 0 11 12 13 14 10 15,          2, 3, 3",
            "2 1 3 4 5 6 7 8 9 10 11 12 13 14 15 0,          2, 2, 4",
            "4 3 2 1 5 6 7 8 9 10 11 12 13 14 15 0,          4, 8, 14"
    })
    @DisplayName("Should match hand-computed values")
    void testKnownValues(String tiles, int expectedMisplaced, int expectedManhattan, int expectedLinearConflict) {
        PuzzleState state = PuzzleState.parse(tiles);

        assertEquals(expectedMisplaced, misplaced.estimate(state), "misplaced");
        assertEquals(expectedManhattan, manhattan.estimate(state), "manhattan");
        assertEquals(expectedLinearConflict, linearConflict.estimate(state), "linear conflict");
    }

    @Nested
    @DisplayName("Linear conflicts")
    class LinearConflictTests {

        @Test
        @DisplayName("Should count one conflict for a swapped pair in a row")
        void testRowPair() {
            assertEquals(1, linearConflict.countConflicts(PuzzleState.parse("2 1 3 4 5 6 7 8 0")));
        }

        @Test
        @DisplayName("Should count row and column conflicts independently")
        void testRowAndColumn() {
            // 5 and 4 reversed in the middle row, 6 and 3 reversed in the right column
            assertEquals(2, linearConflict.countConflicts(PuzzleState.parse("8 7 6 5 4 3 2 1 0")));
        }

        @Test
        @DisplayName("Should need three removals, not six pairs, for a fully reversed row")
        void testReversedRow() {
            // 4 3 2 1: every pair is reversed, but keeping one tile and moving three out suffices
            assertEquals(3, linearConflict.countConflicts(
                    PuzzleState.parse("4 3 2 1 5 6 7 8 9 10 11 12 13 14 15 0")));
        }

        @Test
        @DisplayName("Should ignore tiles whose goal is in another line")
        void testForeignTiles() {
            // 4, 7 and 8 are out of place, but every line they share with a goal-mate is in order
            assertEquals(0, linearConflict.countConflicts(PuzzleState.parse("1 2 3 0 5 6 4 7 8")));
        }
    }

    @Test
    @DisplayName("Should never overestimate and grow more informed on every solvable 8-puzzle state")
    void testAdmissibleAndOrderedOnWholeStateSpace() {
        Map<PuzzleState, Integer> distances = GoalDistances.eightPuzzle();
        assertEquals(181_440, distances.size());

        for (Map.Entry<PuzzleState, Integer> entry : distances.entrySet()) {
            PuzzleState state = entry.getKey();
            int trueDistance = entry.getValue();
            int h1 = misplaced.estimate(state);
            int h2 = manhattan.estimate(state);
            int h3 = linearConflict.estimate(state);

            assertTrue(h1 >= 0, () -> "negative estimate for " + state);
            assertTrue(h1 <= h2, () -> "misplaced > manhattan for " + state);
            assertTrue(h2 <= h3, () -> "manhattan > linear conflict for " + state);
            assertTrue(h3 <= trueDistance, () -> "linear conflict overestimates " + state
                    + ": " + h3 + " > " + trueDistance);
        }
    }

    @Test
    @DisplayName("Should never overestimate near the 15-puzzle goal")
    void testAdmissibleNearFifteenGoal() {
        for (Map.Entry<PuzzleState, Integer> entry : GoalDistances.withinDepth(4, 10).entrySet()) {
            PuzzleState state = entry.getKey();
            assertTrue(linearConflict.estimate(state) <= entry.getValue(), () -> "overestimates " + state);
            assertTrue(misplaced.estimate(state) <= manhattan.estimate(state));
            assertTrue(manhattan.estimate(state) <= linearConflict.estimate(state));
        }
    }

    @Test
    @DisplayName("Should resolve heuristic option names")
    void testHeuristicType() {
        assertEquals(HeuristicType.LINEAR_CONFLICT, HeuristicType.fromName("linear_conflict"));
        assertEquals(HeuristicType.LINEAR_CONFLICT, HeuristicType.fromName("Linear-Conflict"));
        assertEquals(HeuristicType.MISPLACED, HeuristicType.fromName("misplaced"));
        assertInstanceOf(ManhattanHeuristic.class, HeuristicType.MANHATTAN.create());
        assertInstanceOf(LinearConflictHeuristic.class, HeuristicType.LINEAR_CONFLICT.create());
        assertThrows(IllegalArgumentException.class, () -> HeuristicType.fromName("euclidean"));
    }
}
