package slidingpuzzle.planning;

import slidingpuzzle.domain.Move;
import slidingpuzzle.domain.PuzzleState;

import java.util.*;

/**
 * Append-only store of the nodes created by one search. Owned by that search and
 * dropped with it.
 */
final class NodeArena {
    
    private final List<SearchNode> nodes = new ArrayList<>();
    
    SearchNode addRoot(PuzzleState state, int h) {
        SearchNode root = new SearchNode(nodes.size(), state, SearchNode.NO_PARENT, null, 0, h, 0);
        nodes.add(root);
        return root;
    }
    
    SearchNode addChild(SearchNode parent, Move move, PuzzleState state, int h) {
        SearchNode child = new SearchNode(nodes.size(), state, parent.id, move,
                parent.g + 1, h, parent.depth + 1);
        nodes.add(child);
        return child;
    }
    
    SearchNode get(int id) {
        return nodes.get(id);
    }
    
    int size() {
        return nodes.size();
    }
    
    /**
     * Follows parent ids from the given node back to the root.
     * 
     * @param nodeId the last node of the path
     * @return nodes from the root to {@code nodeId}, inclusive
     */
    List<SearchNode> pathTo(int nodeId) {
        List<SearchNode> path = new ArrayList<>();
        SearchNode current = nodes.get(nodeId);
        path.add(current);
        while (!current.isRoot()) {
            current = nodes.get(current.parentId);
            path.add(current);
        }
        Collections.reverse(path);
        return path;
    }
}
