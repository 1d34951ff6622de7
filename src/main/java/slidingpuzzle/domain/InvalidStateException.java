package slidingpuzzle.domain;

/**
 * Thrown when a tile configuration is malformed: wrong length, a value outside
 * 0..N²-1, a duplicated or missing tile, or text that is not a list of integers.
 */
public class InvalidStateException extends IllegalArgumentException {

    public InvalidStateException(String message) {
        super(message);
    }

    public InvalidStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
