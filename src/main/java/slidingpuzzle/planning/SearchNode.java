package slidingpuzzle.planning;

import slidingpuzzle.domain.Move;
import slidingpuzzle.domain.PuzzleState;

/**
 * Node in the search tree, containing state and path cost information.
 * 
 * Nodes live in a {@link NodeArena} and refer to their parent by arena id instead of
 * by reference. The id is also the insertion sequence, used to break ties FIFO.
 */
public final class SearchNode {
    
    /** Marks the root's parent */
    public static final int NO_PARENT = -1;
    
    final int id;
    final PuzzleState state;
    final int parentId;
    final Move move;  // Move that led here from the parent, null at the root
    final int g;      // Moves from the start to this node
    final int h;      // Heuristic estimate from this node to the goal
    final int depth;
    
    SearchNode(int id, PuzzleState state, int parentId, Move move, int g, int h, int depth) {
        this.id = id;
        this.state = state;
        this.parentId = parentId;
        this.move = move;
        this.g = g;
        this.h = h;
        this.depth = depth;
    }
    
    public int getId() { return id; }
    public PuzzleState getState() { return state; }
    public int getParentId() { return parentId; }
    public Move getMove() { return move; }
    public int getCost() { return g; }
    public int getHeuristic() { return h; }
    public int getDepth() { return depth; }
    
    public boolean isRoot() {
        return parentId == NO_PARENT;
    }
    
    @Override
    public String toString() {
        return "SearchNode{id=" + id + ", g=" + g + ", h=" + h + ", move=" + move + ", state=" + state + "}";
    }
}
