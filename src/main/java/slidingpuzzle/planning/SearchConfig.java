package slidingpuzzle.planning;

import slidingpuzzle.planning.heuristic.HeuristicType;

import java.util.Objects;

/**
 * Configuration for search runs.
 * Centralizes all configurable parameters to avoid hardcoding.
 */
public class SearchConfig {
    
    /** Default maximum number of node expansions per search */
    public static final int DEFAULT_MAX_STEPS = 10_000;
    
    /** Progress logging interval (log every N expansions) */
    public static final int PROGRESS_LOG_INTERVAL = 10_000;
    
    /** Random seed for reproducible puzzle generation */
    public static final int RANDOM_SEED = 42;
    
    /** Minimum number of initial states in a bulk experiment (topped up with random puzzles) */
    public static final int DEFAULT_EXPERIMENT_STATES = 5;
    
    /** Environment variable overriding {@link #LOG_LEVEL} */
    public static final String LOG_LEVEL_ENV = "PUZZLE_LOG_LEVEL";

    // ========== Logging Configuration ==========
    
    /**
     * Log level for controlling stderr verbosity.
     * 0 = SILENT (no output except critical errors)
     * 1 = MINIMAL (only rejected inputs and skipped runs)
     * 2 = NORMAL (+ one line per finished search)
     * 3 = VERBOSE (+ expansion progress)
     */
    public static final int LOG_LEVEL = readLogLevel(1);
    
    /** Helper method to check if verbose logging is enabled */
    public static boolean isVerbose() { return LOG_LEVEL >= 3; }
    
    /** Helper method to check if normal logging is enabled */
    public static boolean isNormal() { return LOG_LEVEL >= 2; }
    
    /** Helper method to check if minimal logging is enabled */
    public static boolean isMinimal() { return LOG_LEVEL >= 1; }
    
    private static int readLogLevel(int fallback) {
        String value = System.getenv(LOG_LEVEL_ENV);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            System.err.println("[SearchConfig] Ignoring " + LOG_LEVEL_ENV + "=" + value + ", using " + fallback);
            return fallback;
        }
    }
    
    // Instance configuration
    private Algorithm algorithm = Algorithm.ASTAR;
    private HeuristicType heuristic = HeuristicType.MANHATTAN;
    private int maxSteps = DEFAULT_MAX_STEPS;
    
    public SearchConfig() {}
    
    public SearchConfig(Algorithm algorithm, HeuristicType heuristic, int maxSteps) {
        setAlgorithm(algorithm);
        setHeuristic(heuristic);
        setMaxSteps(maxSteps);
    }
    
    /**
     * Creates a SearchConfig with default values (A*, Manhattan, 10 000 steps).
     * Factory method for cleaner API.
     */
    public static SearchConfig defaults() {
        return new SearchConfig();
    }
    
    public Algorithm getAlgorithm() { return algorithm; }
    public void setAlgorithm(Algorithm algorithm) { this.algorithm = Objects.requireNonNull(algorithm, "algorithm"); }
    
    public HeuristicType getHeuristic() { return heuristic; }
    public void setHeuristic(HeuristicType heuristic) { this.heuristic = Objects.requireNonNull(heuristic, "heuristic"); }
    
    public int getMaxSteps() { return maxSteps; }
    
    public void setMaxSteps(int maxSteps) {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("max steps must be positive, got " + maxSteps);
        }
        this.maxSteps = maxSteps;
    }
    
    @Override
    public String toString() {
        return "SearchConfig{algorithm=" + algorithm + ", heuristic=" + heuristic + ", maxSteps=" + maxSteps + "}";
    }
}
