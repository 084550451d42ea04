package corridor.algorithms;

import corridor.core.CapacityMatrix;
import corridor.core.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: maximum sustained throughput from a set of source rooms to a set of sink rooms.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Validate the matrix and the terminal sets.</li>
 *   <li>Reduce to a single super-source / super-sink graph with {@link GraphReducer}; capacity that runs
 *       directly from a source to a sink is split off as bypass flow.</li>
 *   <li>Run {@link EdmondsKarp} on the reduced graph.</li>
 *   <li>Report bypass flow plus routed flow.</li>
 * </ol>
 *
 * <p>Stateless and safe to share between threads.</p>
 */
public class CorridorMaxFlow {

    private static final Logger log = LoggerFactory.getLogger(CorridorMaxFlow.class);

    private final GraphReducer reducer;
    private final EdmondsKarp engine;

    public CorridorMaxFlow() {
        this(new GraphReducer(), new EdmondsKarp());
    }

    public CorridorMaxFlow(GraphReducer reducer, EdmondsKarp engine) {
        this.reducer = reducer;
        this.engine = engine;
    }

    /**
     * Breakdown of one multi-terminal solve.
     */
    public static final class Solution {
        /** Capacity running directly from a source to a sink. */
        public final long bypassFlow;

        /** Flow routed through intermediate rooms. */
        public final long routedFlow;

        /** Number of augmenting paths used for {@link #routedFlow}. */
        public final int augmentations;

        /** The reduction this solution was computed on. */
        public final GraphReducer.Result reduction;

        /** Engine output on {@link GraphReducer.Result#reduced}. */
        public final FlowResult flow;

        Solution(GraphReducer.Result reduction, FlowResult flow) {
            this.bypassFlow = reduction.bypassFlow;
            this.routedFlow = flow.value;
            this.augmentations = flow.augmentations;
            this.reduction = reduction;
            this.flow = flow;
        }

        public long total() {
            return Math.addExact(bypassFlow, routedFlow);
        }
    }

    /**
     * Computes the maximum flow from {@code sources} to {@code sinks}.
     *
     * @param sources  non-empty set of source indices
     * @param sinks    non-empty set of sink indices, disjoint from {@code sources}
     * @param capacity square matrix of non-negative capacities, at least 2×2
     * @return maximum total flow, never negative
     * @throws InvalidInputException if any precondition is violated
     */
    public long maxFlow(int[] sources, int[] sinks, long[][] capacity) {
        return maxFlow(sources, sinks, CapacityMatrix.of(capacity));
    }

    /**
     * Same as {@link #maxFlow(int[], int[], long[][])} for an already validated matrix.
     */
    public long maxFlow(int[] sources, int[] sinks, CapacityMatrix capacity) {
        return solve(sources, sinks, capacity).total();
    }

    /**
     * Solves and returns the full breakdown.
     *
     * @throws InvalidInputException if any precondition is violated
     */
    public Solution solve(int[] sources, int[] sinks, CapacityMatrix capacity) {
        if (capacity == null) throw new InvalidInputException("Capacity matrix must not be null.");
        requireNonEmpty(sources, "source");
        requireNonEmpty(sinks, "sink");

        GraphReducer.Result reduction = reducer.reduce(capacity, sources, sinks);
        FlowResult flow = engine.solve(reduction.reduced, reduction.source(), reduction.sink());

        Solution solution = new Solution(reduction, flow);
        log.debug("Solved {} sources -> {} sinks on {} nodes: bypass={} routed={} total={}",
                sources.length, sinks.length, capacity.size(),
                solution.bypassFlow, solution.routedFlow, solution.total());
        return solution;
    }

    private static void requireNonEmpty(int[] indices, String role) {
        if (indices == null || indices.length == 0) {
            throw new InvalidInputException("At least one " + role + " index is required.");
        }
    }
}
