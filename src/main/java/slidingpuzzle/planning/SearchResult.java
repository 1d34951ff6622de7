package slidingpuzzle.planning;

import slidingpuzzle.domain.Move;
import slidingpuzzle.domain.PuzzleState;

import java.time.Duration;
import java.util.*;

/**
 * Outcome of one search run.
 * 
 * Statistics are filled in for every terminal status; the move and state paths
 * are empty unless the search was solved.
 */
public final class SearchResult {
    
    private final SearchStatus status;
    private final List<Move> moves;
    private final List<PuzzleState> statePath;
    private final int nodesExpanded;
    private final int nodesGenerated;
    private final Duration elapsed;
    
    SearchResult(SearchStatus status, List<Move> moves, List<PuzzleState> statePath,
                 int nodesExpanded, int nodesGenerated, Duration elapsed) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("A result needs a terminal status, got " + status);
        }
        this.status = status;
        this.moves = Collections.unmodifiableList(new ArrayList<>(moves));
        this.statePath = Collections.unmodifiableList(new ArrayList<>(statePath));
        this.nodesExpanded = nodesExpanded;
        this.nodesGenerated = nodesGenerated;
        this.elapsed = elapsed;
    }
    
    static SearchResult solved(List<Move> moves, List<PuzzleState> statePath,
                               int nodesExpanded, int nodesGenerated, Duration elapsed) {
        return new SearchResult(SearchStatus.SOLVED, moves, statePath, nodesExpanded, nodesGenerated, elapsed);
    }
    
    static SearchResult unsolved(SearchStatus status, int nodesExpanded, int nodesGenerated, Duration elapsed) {
        return new SearchResult(status, List.of(), List.of(), nodesExpanded, nodesGenerated, elapsed);
    }
    
    public boolean isSolved() {
        return status == SearchStatus.SOLVED;
    }
    
    public SearchStatus getStatus() {
        return status;
    }
    
    /**
     * @return the moves of the blank from start to goal, empty if not solved
     */
    public List<Move> getMoves() {
        return moves;
    }
    
    /**
     * @return every state from start to goal inclusive, empty if not solved
     */
    public List<PuzzleState> getStatePath() {
        return statePath;
    }
    
    /**
     * @return number of moves in the solution (0 if not solved)
     */
    public int getSolutionLength() {
        return moves.size();
    }
    
    public int getNodesExpanded() {
        return nodesExpanded;
    }
    
    public int getNodesGenerated() {
        return nodesGenerated;
    }
    
    public Duration getElapsed() {
        return elapsed;
    }
    
    /**
     * @return elapsed time in seconds, as printed in reports
     */
    public double getElapsedSeconds() {
        return elapsed.toNanos() / 1_000_000_000.0;
    }
    
    /**
     * Joins the state path with arrows, e.g. {@code (1 2 3 4 5 6 7 b 8) → (1 2 3 4 5 6 7 8 b)}.
     * 
     * @return the formatted path, or an empty string if not solved
     */
    public String formatPath() {
        StringBuilder sb = new StringBuilder();
        for (PuzzleState state : statePath) {
            if (sb.length() > 0) sb.append(" → ");
            sb.append(state);
        }
        return sb.toString();
    }
    
    @Override
    public String toString() {
        return String.format("SearchResult{status=%s, length=%d, expanded=%d, generated=%d, time=%.3fs}",
                status, getSolutionLength(), nodesExpanded, nodesGenerated, getElapsedSeconds());
    }
}
