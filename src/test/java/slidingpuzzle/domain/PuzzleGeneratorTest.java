package slidingpuzzle.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PuzzleGenerator Tests")
class PuzzleGeneratorTest {

    @ParameterizedTest
    @ValueSource(ints = {3, 4})
    @DisplayName("Should generate the requested number of distinct solvable puzzles")
    void testGenerateRandomSolvable(int size) {
        for (long seed = 1; seed <= 3; seed++) {
            List<PuzzleState> puzzles = new PuzzleGenerator(seed).generate(10, size);

            assertEquals(10, puzzles.size());
            assertEquals(10, new HashSet<>(puzzles).size());
            for (PuzzleState puzzle : puzzles) {
                assertEquals(size, puzzle.getSize());
                assertTrue(puzzle.isSolvable(), "unsolvable puzzle generated: " + puzzle);
            }
        }
    }

    @Test
    @DisplayName("Should be reproducible for a fixed seed")
    void testSeeded() {
        assertEquals(new PuzzleGenerator(42).generate(5, 3), new PuzzleGenerator(42).generate(5, 3));
    }

    @Test
    @DisplayName("Should reject non-positive counts and unsupported sizes")
    void testInvalidArguments() {
        PuzzleGenerator generator = new PuzzleGenerator(42);

        assertThrows(IllegalArgumentException.class, () -> generator.generate(0, 3));
        assertThrows(IllegalArgumentException.class, () -> generator.generate(-1, 3));
        assertThrows(IllegalArgumentException.class, () -> generator.generate(5, 2));
        assertThrows(IllegalArgumentException.class, () -> generator.generate(5, 5));
    }
}
