package slidingpuzzle.planning;

/**
 * States of a single search run. Every state except {@code RUNNING} is terminal.
 */
public enum SearchStatus {
    /** Frontier being processed */
    RUNNING,
    
    /** Goal popped from the frontier; a path is available */
    SOLVED,
    
    /** Frontier emptied without reaching the goal */
    EXHAUSTED,
    
    /** Expansion bound hit first. A resource limit, not an error */
    STEP_LIMIT_REACHED;
    
    public boolean isTerminal() {
        return this != RUNNING;
    }
}
