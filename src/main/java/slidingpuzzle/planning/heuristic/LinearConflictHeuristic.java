package slidingpuzzle.planning.heuristic;

import slidingpuzzle.domain.PuzzleState;

/**
 * Linear conflict heuristic: Manhattan distance plus 2 per tile that has to step
 * out of its goal line.
 * 
 * Two tiles are in linear conflict when both sit in the row (or column) that holds
 * their goal cells but appear in reversed order. Resolving the conflict forces one
 * of them out of the line and back, two moves the Manhattan distance does not count.
 * 
 * For each row and each column independently, the tiles belonging to that line are
 * taken in their current order and the minimum number of them that must leave the
 * line is computed as (tiles in line) - (longest run already in goal order).
 * Counting every reversed pair instead would overestimate when three or more tiles
 * are mutually reversed; for two tiles both counts agree.
 */
public class LinearConflictHeuristic implements Heuristic {
    
    private final ManhattanHeuristic manhattan = new ManhattanHeuristic();
    
    @Override
    public int estimate(PuzzleState state) {
        return manhattan.estimate(state) + 2 * countConflicts(state);
    }
    
    /**
     * Counts the tiles that must leave their goal row or column, summed over all lines.
     * 
     * @param state the state to inspect
     * @return number of linear conflicts
     */
    public int countConflicts(PuzzleState state) {
        int size = state.getSize();
        int conflicts = 0;
        int[] line = new int[size];
        
        for (int row = 0; row < size; row++) {
            int count = 0;
            for (int col = 0; col < size; col++) {
                int tile = state.getTile(row, col);
                if (tile != PuzzleState.BLANK && (tile - 1) / size == row) {
                    line[count++] = (tile - 1) % size; // goal column
                }
            }
            conflicts += count - longestIncreasingRun(line, count);
        }
        
        for (int col = 0; col < size; col++) {
            int count = 0;
            for (int row = 0; row < size; row++) {
                int tile = state.getTile(row, col);
                if (tile != PuzzleState.BLANK && (tile - 1) % size == col) {
                    line[count++] = (tile - 1) / size; // goal row
                }
            }
            conflicts += count - longestIncreasingRun(line, count);
        }
        
        return conflicts;
    }
    
    /**
     * Length of the longest strictly increasing subsequence of the first {@code count}
     * values. Lines hold at most four tiles, so the quadratic scan is enough.
     */
    private static int longestIncreasingRun(int[] values, int count) {
        if (count == 0) {
            return 0;
        }
        int[] best = new int[count];
        int longest = 1;
        for (int i = 0; i < count; i++) {
            best[i] = 1;
            for (int j = 0; j < i; j++) {
                if (values[j] < values[i] && best[j] + 1 > best[i]) {
                    best[i] = best[j] + 1;
                }
            }
            longest = Math.max(longest, best[i]);
        }
        return longest;
    }
}
