package slidingpuzzle.client;

import slidingpuzzle.domain.*;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads lists of initial states from the plain text format used for experiments.
 * 
 * Format:
 * <pre>
 * # Format: Each line represents one initial state
 * # Use 0 to represent the blank tile
 * 4 5 0 6 1 8 7 3 2
 * 8 1 2 7 0 3 6 5 4
 * </pre>
 * 
 * - Lines starting with '#' and blank lines are ignored
 * - Lines with a different number of tiles than the requested grid are skipped,
 *   so one file can hold 8-puzzle and 15-puzzle states side by side
 */
public class StateParser {
    
    /**
     * Parses all states of the given size from a reader.
     * 
     * @param reader the reader to read from
     * @param size grid width to keep (3 or 4)
     * @return the states, in file order
     * @throws IOException if reading fails
     * @throws InvalidStateException if a line with the right tile count is malformed
     */
    public List<PuzzleState> parse(BufferedReader reader, int size) throws IOException {
        List<PuzzleState> states = new ArrayList<>();
        int expectedTiles = size * size;
        String line;
        int lineNumber = 0;
        
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            
            String[] tokens = trimmed.split("\\s+");
            if (tokens.length != expectedTiles) {
                continue;
            }
            
            try {
                states.add(PuzzleState.parse(trimmed));
            } catch (InvalidStateException e) {
                throw new InvalidStateException("Line " + lineNumber + ": " + e.getMessage(), e);
            }
        }
        
        return states;
    }
    
    /**
     * Parses all states of the given size from a file.
     * 
     * @param file path of the states file
     * @param size grid width to keep (3 or 4)
     * @return the states, in file order
     * @throws IOException if the file cannot be read
     */
    public List<PuzzleState> parse(Path file, int size) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader, size);
        }
    }
}
