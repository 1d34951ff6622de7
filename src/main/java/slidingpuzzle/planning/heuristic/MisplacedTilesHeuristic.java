package slidingpuzzle.planning.heuristic;

import slidingpuzzle.domain.PuzzleState;

/**
 * Misplaced tiles heuristic.
 * 
 * Counts the tiles (blank excluded) that are not on their goal cell.
 * Admissible because every misplaced tile needs at least one move.
 */
public class MisplacedTilesHeuristic implements Heuristic {

    @Override
    public int estimate(PuzzleState state) {
        int misplaced = 0;
        for (int i = 0; i < state.getCellCount(); i++) {
            int tile = state.getTileAt(i);
            // tile t belongs at index t - 1
            if (tile != PuzzleState.BLANK && tile != i + 1) {
                misplaced++;
            }
        }
        return misplaced;
    }
}
