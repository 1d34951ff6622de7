package slidingpuzzle.domain;

import java.util.*;

/**
 * Generates distinct, solvable random puzzles by shuffling the goal tiles and
 * keeping the shuffles that pass the parity check.
 */
public class PuzzleGenerator {

    private final Random random;

    /**
     * @param seed random seed for reproducible results
     */
    public PuzzleGenerator(long seed) {
        this(new Random(seed));
    }

    public PuzzleGenerator(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Generates {@code count} distinct solvable states.
     *
     * @param count number of states to generate
     * @param size grid width (3 for the 8-puzzle, 4 for the 15-puzzle)
     * @return the generated states, in generation order
     * @throws IllegalArgumentException if count is not positive or the size is unsupported
     */
    public List<PuzzleState> generate(int count, int size) {
        if (count <= 0) {
            throw new IllegalArgumentException("Number of puzzles must be positive");
        }
        if (size < PuzzleState.MIN_SIZE || size > PuzzleState.MAX_SIZE) {
            throw new IllegalArgumentException("Only puzzles of size 3 (8-puzzle) or 4 (15-puzzle) are supported");
        }

        List<Integer> tiles = new ArrayList<>();
        for (int tile : PuzzleState.goal(size).getTiles()) {
            tiles.add(tile);
        }

        Set<PuzzleState> unique = new LinkedHashSet<>();
        while (unique.size() < count) {
            Collections.shuffle(tiles, random);
            int[] values = new int[tiles.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = tiles.get(i);
            }
            PuzzleState candidate = new PuzzleState(values);
            if (candidate.isSolvable()) {
                unique.add(candidate);
            }
        }
        return new ArrayList<>(unique);
    }
}
