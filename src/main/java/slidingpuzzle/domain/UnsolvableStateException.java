package slidingpuzzle.domain;

/**
 * Thrown when a well-formed configuration lies in the half of the state space
 * from which the goal cannot be reached. Raised before any search starts.
 */
public class UnsolvableStateException extends IllegalArgumentException {

    /** The rejected configuration */
    private final PuzzleState state;

    public UnsolvableStateException(PuzzleState state) {
        super("Puzzle is not solvable: " + state + " (" + state.countInversions() + " inversions)");
        this.state = state;
    }

    /**
     * @return the configuration that failed the parity check
     */
    public PuzzleState getState() {
        return state;
    }
}
