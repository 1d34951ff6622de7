package slidingpuzzle.planning;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Search algorithms selectable by name. Both run on {@link SearchEngine};
 * they differ only in their {@link OrderingPolicy}.
 */
public enum Algorithm {
    BEST_FIRST("best-first", OrderingPolicy.BY_HEURISTIC),
    ASTAR("astar", OrderingPolicy.BY_COST_PLUS_HEURISTIC);
    
    private final String optionName;
    private final OrderingPolicy policy;
    
    Algorithm(String optionName, OrderingPolicy policy) {
        this.optionName = optionName;
        this.policy = policy;
    }
    
    public String getOptionName() {
        return optionName;
    }
    
    public OrderingPolicy getPolicy() {
        return policy;
    }
    
    /**
     * Resolves an option name: "best-first" or "astar".
     *
     * @throws IllegalArgumentException if no algorithm has that name
     */
    public static Algorithm fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase().replace('_', '-');
        if (normalized.equals("a*")) {
            return ASTAR;
        }
        for (Algorithm algorithm : values()) {
            if (algorithm.optionName.equals(normalized)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown algorithm: " + name + " (expected one of "
                + Arrays.stream(values()).map(Algorithm::getOptionName).collect(Collectors.joining(", ")) + ")");
    }
    
    @Override
    public String toString() {
        return optionName;
    }
}
