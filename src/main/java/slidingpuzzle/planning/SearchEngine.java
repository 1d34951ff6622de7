package slidingpuzzle.planning;

import slidingpuzzle.domain.*;
import slidingpuzzle.planning.heuristic.Heuristic;

import java.time.Duration;
import java.util.*;

/**
 * Graph search over puzzle states, shared by Best-First and A*.
 *
 * The engine pops the frontier node with the lowest {@link OrderingPolicy} key
 * (ties go to the node generated first), stops when that node is the goal, and
 * otherwise expands it into its neighbours:
 * - Best-First orders by h(n) only, but still tracks g(n) for path length
 * - A* orders by f(n) = g(n) + h(n); with an admissible heuristic the path is optimal
 *
 * Each call to {@link #solve} owns its own frontier, visited maps and node arena,
 * so one engine can run any number of searches one after another.
 */
public class SearchEngine {

    /** Frontier ordering: the only thing that differs between algorithms */
    private final OrderingPolicy policy;

    /**
     * Creates a new search engine.
     *
     * @param policy the frontier ordering key
     */
    public SearchEngine(OrderingPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * @param algorithm the algorithm to run
     * @return an engine using the algorithm's ordering policy
     */
    public static SearchEngine forAlgorithm(Algorithm algorithm) {
        return new SearchEngine(algorithm.getPolicy());
    }

    /**
     * Runs the search described by a configuration.
     *
     * @param initialState the starting state
     * @param config algorithm, heuristic and step bound
     * @return the search result
     * @throws UnsolvableStateException if the goal is unreachable from the start
     */
    public static SearchResult solve(PuzzleState initialState, SearchConfig config) {
        return forAlgorithm(config.getAlgorithm())
                .solve(initialState, config.getHeuristic().create(), config.getMaxSteps());
    }

    public OrderingPolicy getPolicy() {
        return policy;
    }

    /**
     * @return the name of this algorithm (for logging)
     */
    public String getName() {
        return policy == OrderingPolicy.BY_HEURISTIC ? "Best-First" : "A*";
    }

    /**
     * Searches for a path from the initial state to the goal.
     *
     * @param initialState the starting state
     * @param heuristic the heuristic function
     * @param maxSteps maximum number of node expansions
     * @return the result; not solved when the frontier empties or the step bound is hit
     * @throws UnsolvableStateException if the goal is unreachable from the start
     * @throws IllegalArgumentException if maxSteps is not positive
     */
    public SearchResult solve(PuzzleState initialState, Heuristic heuristic, int maxSteps) {
        Objects.requireNonNull(initialState, "initialState");
        Objects.requireNonNull(heuristic, "heuristic");
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("max steps must be positive, got " + maxSteps);
        }
        if (!initialState.isSolvable()) {
            if (SearchConfig.isMinimal()) {
                System.err.println("[SearchEngine] Rejected unsolvable state " + initialState);
            }
            throw new UnsolvableStateException(initialState);
        }
        return explore(initialState, heuristic, maxSteps);
    }

    /**
     * The search loop proper, without the solvability check.
     */
    SearchResult explore(PuzzleState initialState, Heuristic heuristic, int maxSteps) {
        long startNanos = System.nanoTime();

        NodeArena arena = new NodeArena();
        PriorityQueue<SearchNode> frontier = new PriorityQueue<>(
                Comparator.comparingInt((SearchNode node) -> policy.key(node))
                        .thenComparingInt(SearchNode::getId));

        // Lowest g pushed so far, per state
        Map<PuzzleState, Integer> bestCost = new HashMap<>();

        // Expanded states and the g they were expanded at
        Map<PuzzleState, Integer> closed = new HashMap<>();

        SearchNode root = arena.addRoot(initialState, heuristic.estimate(initialState));
        frontier.add(root);
        bestCost.put(initialState, 0);

        int nodesGenerated = 1;
        int nodesExpanded = 0;
        int steps = 0;
        SearchStatus status = SearchStatus.RUNNING;

        while (status == SearchStatus.RUNNING) {
            if (frontier.isEmpty()) {
                status = SearchStatus.EXHAUSTED;
                break;
            }
            if (steps >= maxSteps) {
                status = SearchStatus.STEP_LIMIT_REACHED;
                break;
            }

            SearchNode current = frontier.poll();

            if (current.state.isGoal()) {
                status = SearchStatus.SOLVED;
                Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
                logOutcome(status, initialState, current.g, nodesExpanded, nodesGenerated, elapsed);
                return buildSolution(arena, current, nodesExpanded, nodesGenerated, elapsed);
            }

            // Skip stale entries and states already expanded at an equal or better cost
            Integer expandedAt = closed.get(current.state);
            if (expandedAt != null && expandedAt <= current.g) {
                continue;
            }
            if (bestCost.get(current.state) < current.g) {
                continue;
            }

            closed.put(current.state, current.g);
            nodesExpanded++;

            for (Map.Entry<Move, PuzzleState> successor : current.state.neighbors()) {
                PuzzleState next = successor.getValue();
                int newG = current.g + 1;

                Integer known = bestCost.get(next);
                if (known != null && known <= newG) {
                    continue; // Existing path is better or equal
                }

                bestCost.put(next, newG);
                frontier.add(arena.addChild(current, successor.getKey(), next, heuristic.estimate(next)));
                nodesGenerated++;
            }

            steps++;
            if (SearchConfig.isVerbose() && steps % SearchConfig.PROGRESS_LOG_INTERVAL == 0) {
                System.err.println("[SearchEngine] " + getName() + ": " + steps + " expansions, frontier="
                        + frontier.size() + ", f=" + policy.key(current));
            }
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        logOutcome(status, initialState, -1, nodesExpanded, nodesGenerated, elapsed);
        return SearchResult.unsolved(status, nodesExpanded, nodesGenerated, elapsed);
    }

    /**
     * Reconstructs the path from start to goal by following parent ids.
     */
    private SearchResult buildSolution(NodeArena arena, SearchNode goalNode,
                                       int nodesExpanded, int nodesGenerated, Duration elapsed) {
        List<Move> moves = new ArrayList<>();
        List<PuzzleState> states = new ArrayList<>();
        for (SearchNode node : arena.pathTo(goalNode.id)) {
            if (!node.isRoot()) {
                moves.add(node.move);
            }
            states.add(node.state);
        }
        return SearchResult.solved(moves, states, nodesExpanded, nodesGenerated, elapsed);
    }

    private void logOutcome(SearchStatus status, PuzzleState start, int length,
                            int expanded, int generated, Duration elapsed) {
        if (!SearchConfig.isNormal()) {
            return;
        }
        String outcome = status == SearchStatus.SOLVED ? "Solution of " + length + " moves" : status.name();
        System.err.println("[SearchEngine] " + getName() + " on " + start + ": " + outcome
                + " after " + expanded + " expansions (" + generated + " generated, "
                + elapsed.toMillis() + " ms)");
    }
}
