package corridor.algorithms;

import corridor.core.CapacityMatrix;
import corridor.core.FlowMatrix;
import corridor.core.FlowValidators;
import org.eclipse.collections.api.list.primitive.ImmutableIntList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Edmonds–Karp algorithm (Ford–Fulkerson with BFS) for computing a maximum s-t flow.
 *
 * <p>Key idea:
 * Repeatedly find a shortest (in number of edges) augmenting path in the residual network using BFS,
 * augment along it by the path bottleneck, and update the flow skew-symmetrically.
 *
 * <p>Complexity:
 * O(V * E) augmentations, each costing O(V^2) on the matrix representation. The bound does not depend on
 * the magnitude of the capacities, which may be many orders of magnitude larger than the node count.
 *
 * <p>The capacity matrix is never modified. Each call allocates its own {@link FlowMatrix}, so one instance
 * can serve concurrent solves.</p>
 */
public class EdmondsKarp {

    private static final Logger log = LoggerFactory.getLogger(EdmondsKarp.class);

    private final AugmentingPathFinder pathFinder;
    private final FlowAugmenter augmenter;

    public EdmondsKarp() {
        this(new AugmentingPathFinder(), new FlowAugmenter());
    }

    public EdmondsKarp(AugmentingPathFinder pathFinder, FlowAugmenter augmenter) {
        this.pathFinder = pathFinder;
        this.augmenter = augmenter;
    }

    /**
     * Computes the maximum flow value from {@code s} to {@code t}.
     *
     * @param capacity capacity matrix (not modified)
     * @param s        source node index
     * @param t        sink node index
     * @return maximum s-t flow value
     */
    public long maxFlow(CapacityMatrix capacity, int s, int t) {
        return solve(capacity, s, t).value;
    }

    /**
     * Computes the maximum flow and keeps the final flow state for inspection.
     *
     * @param capacity capacity matrix (not modified)
     * @param s        source node index
     * @param t        sink node index
     * @return value, final flow, augmentation count and minimum-cut source side
     */
    public FlowResult solve(CapacityMatrix capacity, int s, int t) {
        final int n = capacity.size();
        if (s < 0 || s >= n || t < 0 || t >= n) {
            throw new IllegalArgumentException("Terminals (" + s + ", " + t + ") outside [0, " + n + ").");
        }

        FlowMatrix flow = new FlowMatrix(n);
        int augmentations = 0;

        while (true) {
            ImmutableIntList path = pathFinder.find(capacity, flow, s, t);

            // No augmenting path exists -> current flow is maximum.
            if (path == null) break;

            long pushed = augmenter.augment(capacity, flow, path);
            augmentations++;

            if (log.isTraceEnabled()) {
                log.trace("Augmentation #{}: path={} bottleneck={}", augmentations, path, pushed);
            }
        }

        // Total flow entering the sink.
        long value = 0L;
        for (int v = 0; v < n; v++) value += flow.flow(v, t);

        log.debug("Max flow {} -> {} on {} nodes: value={} after {} augmentations", s, t, n, value, augmentations);

        boolean[] sourceSide = FlowValidators.residualReachable(capacity, flow, s);
        return new FlowResult(value, flow, augmentations, sourceSide);
    }
}
