package slidingpuzzle.domain;

/**
 * Enum representing the four moves of the blank tile.
 * Each move has associated row and column deltas.
 * A move slides the blank into the neighbouring cell, so the tile in that cell
 * travels the opposite way.
 */
public enum Move {
    /** Up - blank moves to the row above (decrease row) */
    UP(-1, 0),
    
    /** Down - blank moves to the row below (increase row) */
    DOWN(1, 0),
    
    /** Left - blank moves to the previous column */
    LEFT(0, -1),
    
    /** Right - blank moves to the next column */
    RIGHT(0, 1);
    
    /** Row delta when the blank moves this way */
    public final int dRow;
    
    /** Column delta when the blank moves this way */
    public final int dCol;
    
    Move(int dRow, int dCol) {
        this.dRow = dRow;
        this.dCol = dCol;
    }
    
    /**
     * Returns the move that undoes this one.
     * UP <-> DOWN, LEFT <-> RIGHT
     * 
     * @return the opposite move
     */
    public Move opposite() {
        return switch (this) {
            case UP -> DOWN;
            case DOWN -> UP;
            case LEFT -> RIGHT;
            case RIGHT -> LEFT;
        };
    }
    
    /**
     * @return the lowercase name used in printed solution paths ("up", "down", ...)
     */
    public String label() {
        return name().toLowerCase();
    }
    
    /**
     * Parses a move from its string representation.
     * 
     * @param s the string representation (up, down, left or right, any case)
     * @return the corresponding Move
     * @throws IllegalArgumentException if the string is not a valid move
     */
    public static Move fromString(String s) {
        return switch (s.trim().toUpperCase()) {
            case "UP", "U" -> UP;
            case "DOWN", "D" -> DOWN;
            case "LEFT", "L" -> LEFT;
            case "RIGHT", "R" -> RIGHT;
            default -> throw new IllegalArgumentException("Invalid move: " + s);
        };
    }
}
