package slidingpuzzle.planning;

/**
 * Frontier ordering key. The only difference between the supported algorithms.
 */
public enum OrderingPolicy {
    
    /** Greedy best-first: f(n) = h(n), path cost is tracked but ignored for ordering */
    BY_HEURISTIC {
        @Override
        public int key(int g, int h) {
            return h;
        }
    },
    
    /** A*: f(n) = g(n) + h(n) */
    BY_COST_PLUS_HEURISTIC {
        @Override
        public int key(int g, int h) {
            return g + h;
        }
    };
    
    /**
     * @param g moves from the start
     * @param h heuristic estimate to the goal
     * @return the priority, lower is expanded first
     */
    public abstract int key(int g, int h);
    
    public int key(SearchNode node) {
        return key(node.g, node.h);
    }
}
