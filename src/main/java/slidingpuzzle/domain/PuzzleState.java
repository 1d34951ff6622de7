package slidingpuzzle.domain;

import java.util.*;

/**
 * Immutable tile configuration of an 8-puzzle (3x3) or 15-puzzle (4x4).
 * Tiles are stored row-major; 0 is the blank.
 *
 * States are used as keys of the search's visited maps, so equals() and hashCode()
 * compare the tile sequence by value. Applying a move always copies the tiles:
 * a state is never changed after construction.
 */
public final class PuzzleState {

    /** Smallest supported grid width (8-puzzle) */
    public static final int MIN_SIZE = 3;

    /** Largest supported grid width (15-puzzle) */
    public static final int MAX_SIZE = 4;

    /** Value of the blank tile */
    public static final int BLANK = 0;

    /** Tiles in row-major order */
    private final int[] tiles;

    /** Grid width */
    private final int size;

    /** Index of the blank in {@link #tiles} */
    private final int blankIndex;

    /** Cached hash code for performance (states are immutable) */
    private int cachedHashCode = 0;
    private boolean hashCodeComputed = false;

    /**
     * Creates a new state from a tile sequence.
     *
     * @param tiles 9 or 16 values forming a permutation of 0..N²-1 (will be copied)
     * @throws InvalidStateException if the sequence is malformed
     */
    public PuzzleState(int[] tiles) {
        if (tiles == null) {
            throw new InvalidStateException("Tile sequence must not be null");
        }
        this.size = sizeFor(tiles.length);
        this.tiles = Arrays.copyOf(tiles, tiles.length);
        this.blankIndex = validatePermutation(this.tiles);
    }

    /**
     * Private constructor for moves (the tile array is already a fresh, valid copy).
     */
    private PuzzleState(int[] tiles, int size, int blankIndex) {
        this.tiles = tiles;
        this.size = size;
        this.blankIndex = blankIndex;
    }

    /**
     * Parses a state from whitespace-separated integers, e.g. "4 5 0 6 1 8 7 3 2".
     *
     * @param text the tile list
     * @return the parsed state
     * @throws InvalidStateException if the text is not a valid tile configuration
     */
    public static PuzzleState parse(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidStateException("Empty state string");
        }
        String[] tokens = text.trim().split("\\s+");
        int[] values = new int[tokens.length];
        for (int i = 0; i < tokens.length; i++) {
            try {
                values[i] = Integer.parseInt(tokens[i]);
            } catch (NumberFormatException e) {
                throw new InvalidStateException("Invalid tile value '" + tokens[i] + "' in state: " + text, e);
            }
        }
        return new PuzzleState(values);
    }

    /**
     * Returns the goal configuration: tiles in ascending order, blank last.
     *
     * @param size grid width (3 or 4)
     * @return the goal state
     */
    public static PuzzleState goal(int size) {
        if (size < MIN_SIZE || size > MAX_SIZE) {
            throw new InvalidStateException("Unsupported puzzle size: " + size + "x" + size);
        }
        int[] values = new int[size * size];
        for (int i = 0; i < values.length - 1; i++) {
            values[i] = i + 1;
        }
        values[values.length - 1] = BLANK;
        return new PuzzleState(values);
    }

    private static int sizeFor(int length) {
        for (int size = MIN_SIZE; size <= MAX_SIZE; size++) {
            if (size * size == length) {
                return size;
            }
        }
        throw new InvalidStateException("State must have exactly 9 elements (8-puzzle) or 16 elements (15-puzzle), got "
                + length);
    }

    /**
     * Checks that the tiles are exactly 0..N²-1 and returns the blank index.
     */
    private static int validatePermutation(int[] tiles) {
        boolean[] seen = new boolean[tiles.length];
        int blank = -1;
        for (int i = 0; i < tiles.length; i++) {
            int tile = tiles[i];
            if (tile < 0 || tile >= tiles.length) {
                throw new InvalidStateException("Tile value " + tile + " out of range 0-" + (tiles.length - 1));
            }
            if (seen[tile]) {
                throw new InvalidStateException("Duplicate tile value " + tile);
            }
            seen[tile] = true;
            if (tile == BLANK) {
                blank = i;
            }
        }
        // length N² with no duplicates in range means every value is present
        return blank;
    }

    /**
     * @return the grid width (3 or 4)
     */
    public int getSize() {
        return size;
    }

    /**
     * @return the number of cells (N²)
     */
    public int getCellCount() {
        return tiles.length;
    }

    /**
     * @return a copy of the tiles in row-major order
     */
    public int[] getTiles() {
        return Arrays.copyOf(tiles, tiles.length);
    }

    /**
     * @param index row-major cell index
     * @return the tile at that cell (0 for the blank)
     */
    public int getTileAt(int index) {
        return tiles[index];
    }

    /**
     * @param row the row
     * @param col the column
     * @return the tile at that cell (0 for the blank)
     */
    public int getTile(int row, int col) {
        return tiles[row * size + col];
    }

    /**
     * @return the position of the blank
     */
    public Position getBlankPosition() {
        return Position.fromIndex(blankIndex, size);
    }

    /**
     * Gets the current position of a tile.
     *
     * @param tile the tile value (0 for the blank)
     * @return where the tile currently is
     */
    public Position positionOf(int tile) {
        for (int i = 0; i < tiles.length; i++) {
            if (tiles[i] == tile) {
                return Position.fromIndex(i, size);
            }
        }
        throw new IllegalArgumentException("No tile " + tile + " in " + this);
    }

    /**
     * Gets the position a tile occupies in the goal configuration.
     *
     * @param tile the tile value
     * @param size the grid width
     * @return goal position (the blank belongs in the last cell)
     */
    public static Position goalPositionOf(int tile, int size) {
        if (tile == BLANK) {
            return new Position(size - 1, size - 1);
        }
        return Position.fromIndex(tile - 1, size);
    }

    /**
     * @param tile the tile value
     * @return goal position of the tile on this state's grid
     */
    public Position goalPositionOf(int tile) {
        return goalPositionOf(tile, size);
    }

    /**
     * Checks if the tiles are in ascending order with the blank last.
     *
     * @return true if this is the goal configuration
     */
    public boolean isGoal() {
        if (blankIndex != tiles.length - 1) {
            return false;
        }
        for (int i = 0; i < tiles.length - 1; i++) {
            if (tiles[i] != i + 1) {
                return false;
            }
        }
        return true;
    }

    /**
     * Counts pairs of tiles (blank excluded) that appear in the opposite order
     * to the goal ordering.
     *
     * @return the inversion count
     */
    public int countInversions() {
        int inversions = 0;
        for (int i = 0; i < tiles.length; i++) {
            if (tiles[i] == BLANK) continue;
            for (int j = i + 1; j < tiles.length; j++) {
                if (tiles[j] != BLANK && tiles[i] > tiles[j]) {
                    inversions++;
                }
            }
        }
        return inversions;
    }

    /**
     * Checks whether the goal is reachable from this configuration.
     *
     * Odd width: solvable iff the inversion count is even.
     * Even width: solvable iff inversions plus the blank's row distance from the
     * last row is even.
     *
     * @return true if the goal can be reached
     */
    public boolean isSolvable() {
        int inversions = countInversions();
        if (size % 2 == 1) {
            return inversions % 2 == 0;
        }
        int blankRowFromBottom = size - 1 - blankIndex / size;
        return (inversions + blankRowFromBottom) % 2 == 0;
    }

    /**
     * Checks if the blank can move in the given direction.
     *
     * @param move the move to check
     * @return true if the blank stays on the grid
     */
    public boolean canMove(Move move) {
        return getBlankPosition().move(move).isInside(size);
    }

    /**
     * @return the legal moves in the order UP, DOWN, LEFT, RIGHT
     */
    public List<Move> getLegalMoves() {
        List<Move> moves = new ArrayList<>(4);
        for (Move move : Move.values()) {
            if (canMove(move)) {
                moves.add(move);
            }
        }
        return moves;
    }

    /**
     * Applies a move and returns the resulting state. This state is left untouched.
     *
     * @param move the move of the blank
     * @return the new state after swapping the blank with its neighbour
     * @throws IllegalArgumentException if the move would leave the grid
     */
    public PuzzleState apply(Move move) {
        Position target = getBlankPosition().move(move);
        if (!target.isInside(size)) {
            throw new IllegalArgumentException("Illegal move " + move + " for " + this);
        }
        int swapIndex = target.toIndex(size);
        int[] newTiles = Arrays.copyOf(tiles, tiles.length);
        newTiles[blankIndex] = newTiles[swapIndex];
        newTiles[swapIndex] = BLANK;
        return new PuzzleState(newTiles, size, swapIndex);
    }

    /**
     * Generates all neighbouring states. The list is rebuilt on every call.
     *
     * @return list of (move, resulting state) pairs, at most four
     */
    public List<Map.Entry<Move, PuzzleState>> neighbors() {
        List<Map.Entry<Move, PuzzleState>> neighbors = new ArrayList<>(4);
        for (Move move : getLegalMoves()) {
            neighbors.add(new AbstractMap.SimpleImmutableEntry<>(move, apply(move)));
        }
        return neighbors;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        PuzzleState other = (PuzzleState) obj;
        return Arrays.equals(tiles, other.tiles);
    }

    @Override
    public int hashCode() {
        if (!hashCodeComputed) {
            cachedHashCode = Arrays.hashCode(tiles);
            hashCodeComputed = true;
        }
        return cachedHashCode;
    }

    /**
     * @return the tiles separated by spaces with 0 for the blank, as accepted by {@link #parse}
     */
    public String toTileString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < tiles.length; i++) {
            if (i > 0) sb.append(' ');
            sb.append(tiles[i]);
        }
        return sb.toString();
    }

    /**
     * Compact form used in reports, e.g. {@code (1 2 3 4 5 6 7 8 b)}.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < tiles.length; i++) {
            if (i > 0) sb.append(' ');
            sb.append(tiles[i] == BLANK ? "b" : String.valueOf(tiles[i]));
        }
        return sb.append(')').toString();
    }

    /**
     * Creates a grid representation of this state, one row per line.
     * Useful for debugging.
     *
     * @return multi-line string representation
     */
    public String toGridString() {
        int width = String.valueOf(tiles.length - 1).length();
        StringBuilder sb = new StringBuilder();
        for (int row = 0; row < size; row++) {
            if (row > 0) sb.append('\n');
            for (int col = 0; col < size; col++) {
                if (col > 0) sb.append(' ');
                int tile = getTile(row, col);
                String cell = tile == BLANK ? "b" : String.valueOf(tile);
                sb.append(" ".repeat(width - cell.length())).append(cell);
            }
        }
        return sb.toString();
    }
}
