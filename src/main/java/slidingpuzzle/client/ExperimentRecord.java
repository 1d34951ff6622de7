package slidingpuzzle.client;

import slidingpuzzle.domain.PuzzleState;
import slidingpuzzle.planning.Algorithm;
import slidingpuzzle.planning.SearchResult;
import slidingpuzzle.planning.heuristic.HeuristicType;

/**
 * One experiment: the configuration that was run and what the search returned.
 */
public class ExperimentRecord {
    
    public final Algorithm algorithm;
    public final HeuristicType heuristic;
    public final PuzzleState initialState;
    public final SearchResult result;
    
    public ExperimentRecord(Algorithm algorithm, HeuristicType heuristic,
                            PuzzleState initialState, SearchResult result) {
        this.algorithm = algorithm;
        this.heuristic = heuristic;
        this.initialState = initialState;
        this.result = result;
    }
    
    /**
     * @return "algorithm-heuristic", the key used to group records in reports
     */
    public String getKey() {
        return algorithm.getOptionName() + "-" + heuristic.getOptionName();
    }
    
    @Override
    public String toString() {
        return "ExperimentRecord{" + getKey() + ", state=" + initialState + ", " + result + "}";
    }
}
