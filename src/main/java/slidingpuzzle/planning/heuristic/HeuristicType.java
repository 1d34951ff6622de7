package slidingpuzzle.planning.heuristic;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Supported heuristics, listed from least to most informed.
 *
 * <p>Each constant carries the option name used on the command line and in reports.</p>
 */
public enum HeuristicType {
    MISPLACED("misplaced"),
    MANHATTAN("manhattan"),
    LINEAR_CONFLICT("linear_conflict");

    private final String optionName;

    HeuristicType(String optionName) {
        this.optionName = optionName;
    }

    public String getOptionName() {
        return optionName;
    }

    /**
     * @return a new heuristic instance of this type
     */
    public Heuristic create() {
        return switch (this) {
            case MISPLACED -> new MisplacedTilesHeuristic();
            case MANHATTAN -> new ManhattanHeuristic();
            case LINEAR_CONFLICT -> new LinearConflictHeuristic();
        };
    }

    /**
     * Resolves an option name such as "linear_conflict".
     *
     * @param name the option name (case-insensitive, '-' accepted for '_')
     * @return the matching type
     * @throws IllegalArgumentException if no heuristic has that name
     */
    public static HeuristicType fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase().replace('-', '_');
        for (HeuristicType type : values()) {
            if (type.optionName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown heuristic: " + name + " (expected one of "
                + Arrays.stream(values()).map(HeuristicType::getOptionName).collect(Collectors.joining(", ")) + ")");
    }

    @Override
    public String toString() {
        return optionName;
    }
}
