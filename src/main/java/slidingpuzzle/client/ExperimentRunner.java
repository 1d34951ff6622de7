package slidingpuzzle.client;

import slidingpuzzle.domain.*;
import slidingpuzzle.planning.*;
import slidingpuzzle.planning.heuristic.HeuristicType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Runs search experiments: a single configuration, or every algorithm x heuristic
 * combination over a list of initial states.
 * 
 * Runs are independent; each builds its own engine state, so results do not depend
 * on the order in which combinations are tried.
 */
public class ExperimentRunner {
    
    private final int maxSteps;
    
    public ExperimentRunner(int maxSteps) {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("max steps must be positive, got " + maxSteps);
        }
        this.maxSteps = maxSteps;
    }
    
    public int getMaxSteps() {
        return maxSteps;
    }
    
    /**
     * Runs one experiment.
     * 
     * @param algorithm the search algorithm
     * @param heuristic the heuristic
     * @param initialState the start state
     * @return the record of the run
     * @throws UnsolvableStateException if the start state cannot reach the goal
     */
    public ExperimentRecord runExperiment(Algorithm algorithm, HeuristicType heuristic, PuzzleState initialState) {
        SearchConfig config = new SearchConfig(algorithm, heuristic, maxSteps);
        SearchResult result = SearchEngine.solve(initialState, config);
        return new ExperimentRecord(algorithm, heuristic, initialState, result);
    }
    
    /**
     * Runs all combinations of algorithms and heuristics on all states.
     * A state the engine rejects is logged and skipped for that combination.
     * 
     * @param states the initial states
     * @return the collected report
     */
    public ExperimentReport runAll(List<PuzzleState> states) {
        ExperimentReport report = new ExperimentReport();
        
        for (Algorithm algorithm : Algorithm.values()) {
            for (HeuristicType heuristic : HeuristicType.values()) {
                report.addCombination(algorithm, heuristic);
                
                for (PuzzleState state : states) {
                    try {
                        report.add(runExperiment(algorithm, heuristic, state));
                    } catch (IllegalArgumentException e) {
                        if (SearchConfig.isMinimal()) {
                            System.err.println("[Experiment] Error running " + algorithm + "-" + heuristic
                                    + " on " + state + ": " + e.getMessage());
                        }
                    }
                }
            }
        }
        
        return report;
    }
    
    /**
     * Collects initial states for a bulk experiment: the states of the given size found
     * in {@code file} (if it exists), topped up with distinct random solvable puzzles
     * until there are at least {@code minCount}.
     * 
     * @param file states file, may be null
     * @param size grid width (3 or 4)
     * @param minCount minimum number of states to return
     * @param seed seed for the random top-up
     * @return the states, file states first
     * @throws IOException if the file exists but cannot be read
     */
    public static List<PuzzleState> collectStates(Path file, int size, int minCount, long seed) throws IOException {
        List<PuzzleState> states = new ArrayList<>();
        if (file != null) {
            if (Files.exists(file)) {
                states.addAll(new StateParser().parse(file, size));
            } else if (SearchConfig.isMinimal()) {
                System.err.println("[Experiment] States file " + file + " not found, generating puzzles");
            }
        }
        
        int needed = minCount - states.size();
        if (needed > 0) {
            if (SearchConfig.isMinimal()) {
                System.err.println("[Experiment] Found only " + states.size() + " " + size + "x" + size
                        + " initial states, generating " + needed + " more random solvable puzzles...");
            }
            Set<PuzzleState> known = new HashSet<>(states);
            PuzzleGenerator generator = new PuzzleGenerator(seed);
            while (states.size() < minCount) {
                for (PuzzleState candidate : generator.generate(minCount - states.size(), size)) {
                    if (known.add(candidate)) {
                        states.add(candidate);
                    }
                }
            }
        }
        
        return states;
    }
}
