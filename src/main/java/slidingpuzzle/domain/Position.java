package slidingpuzzle.domain;

/**
 * Immutable class representing a cell on the puzzle grid.
 * Uses row and column indices where (0,0) is the top-left corner.
 * Row increases downward, column increases rightward.
 */
public final class Position {
    
    /** The row index (0-indexed from top) */
    public final int row;
    
    /** The column index (0-indexed from left) */
    public final int col;
    
    /**
     * Creates a new Position with the specified row and column.
     * 
     * @param row the row index (0-indexed)
     * @param col the column index (0-indexed)
     */
    public Position(int row, int col) {
        this.row = row;
        this.col = col;
    }
    
    /**
     * Converts a row-major index into a position on a grid of the given width.
     * 
     * @param index the flat index into the tile sequence
     * @param size the grid width
     * @return the matching position
     */
    public static Position fromIndex(int index, int size) {
        return new Position(index / size, index % size);
    }
    
    /**
     * @param size the grid width
     * @return the row-major index of this position
     */
    public int toIndex(int size) {
        return row * size + col;
    }
    
    /**
     * Returns the Position reached by moving the blank in the given direction.
     * The result may lie outside the grid; callers check bounds.
     * 
     * @param move the move to apply
     * @return the adjacent position
     */
    public Position move(Move move) {
        return new Position(row + move.dRow, col + move.dCol);
    }
    
    /**
     * @param size the grid width
     * @return true if this position lies on a size x size grid
     */
    public boolean isInside(int size) {
        return row >= 0 && row < size && col >= 0 && col < size;
    }
    
    /**
     * Calculates the Manhattan distance from this position to another position.
     * Manhattan distance is |row1 - row2| + |col1 - col2|.
     * 
     * @param other the other position
     * @return the Manhattan distance
     */
    public int manhattanDistance(Position other) {
        return Math.abs(this.row - other.row) + Math.abs(this.col - other.col);
    }
    
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Position position = (Position) obj;
        return row == position.row && col == position.col;
    }
    
    @Override
    public int hashCode() {
        return 31 * row + col;
    }
    
    @Override
    public String toString() {
        return "(" + row + "," + col + ")";
    }
}
