package slidingpuzzle.planning.heuristic;

import slidingpuzzle.domain.Position;
import slidingpuzzle.domain.PuzzleState;

/**
 * Manhattan distance heuristic.
 * 
 * Sums, over every tile except the blank, the Manhattan distance from the tile's
 * current cell to its goal cell.
 * 
 * This is an admissible heuristic (never overestimates) because:
 * - each move slides exactly one tile by one cell
 * - so every tile needs at least its Manhattan distance in moves
 */
public class ManhattanHeuristic implements Heuristic {
    
    @Override
    public int estimate(PuzzleState state) {
        int size = state.getSize();
        int totalDistance = 0;
        
        for (int i = 0; i < state.getCellCount(); i++) {
            int tile = state.getTileAt(i);
            if (tile == PuzzleState.BLANK) {
                continue;
            }
            totalDistance += distanceToGoal(tile, Position.fromIndex(i, size), size);
        }
        
        return totalDistance;
    }
    
    /**
     * Calculates the Manhattan distance for a single tile to its goal cell.
     * 
     * @param tile the tile value
     * @param current the tile's current position
     * @param size the grid width
     * @return the distance to the goal cell
     */
    public static int distanceToGoal(int tile, Position current, int size) {
        return current.manhattanDistance(PuzzleState.goalPositionOf(tile, size));
    }
}
