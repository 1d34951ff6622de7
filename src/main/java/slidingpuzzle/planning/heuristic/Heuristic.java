package slidingpuzzle.planning.heuristic;

import slidingpuzzle.domain.PuzzleState;

/**
 * Interface for heuristic functions used in search algorithms.
 * 
 * A heuristic provides an estimate of the number of moves needed to reach the goal
 * from a given state. For A* search to be optimal, the heuristic must be admissible
 * (never overestimate the true cost). Implementations are pure: no side effects,
 * non-negative results.
 */
public interface Heuristic {
    
    /**
     * Estimates the number of moves to reach the goal from the given state.
     * 
     * @param state the current state
     * @return estimated cost to reach goal (lower bound)
     */
    int estimate(PuzzleState state);
}
