package slidingpuzzle.planning;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Algorithm and OrderingPolicy Tests")
class AlgorithmTest {

    @Test
    @DisplayName("Should resolve algorithm option names")
    void testFromName() {
        assertEquals(Algorithm.ASTAR, Algorithm.fromName("astar"));
        assertEquals(Algorithm.ASTAR, Algorithm.fromName("A*"));
        assertEquals(Algorithm.BEST_FIRST, Algorithm.fromName("best-first"));
        assertEquals(Algorithm.BEST_FIRST, Algorithm.fromName("BEST_FIRST"));
        assertThrows(IllegalArgumentException.class, () -> Algorithm.fromName("ida*"));
        assertThrows(IllegalArgumentException.class, () -> Algorithm.fromName(null));
    }

    @Test
    @DisplayName("Should differ only in the ordering key")
    void testPolicies() {
        assertEquals(OrderingPolicy.BY_HEURISTIC, Algorithm.BEST_FIRST.getPolicy());
        assertEquals(OrderingPolicy.BY_COST_PLUS_HEURISTIC, Algorithm.ASTAR.getPolicy());

        assertEquals(4, OrderingPolicy.BY_HEURISTIC.key(7, 4));
        assertEquals(11, OrderingPolicy.BY_COST_PLUS_HEURISTIC.key(7, 4));
    }

    @Test
    @DisplayName("Should default to A* with Manhattan distance")
    void testConfigDefaults() {
        SearchConfig config = SearchConfig.defaults();

        assertEquals(Algorithm.ASTAR, config.getAlgorithm());
        assertEquals(SearchConfig.DEFAULT_MAX_STEPS, config.getMaxSteps());
        assertThrows(NullPointerException.class, () -> config.setAlgorithm(null));
        assertThrows(IllegalArgumentException.class, () -> config.setMaxSteps(-5));
    }
}
