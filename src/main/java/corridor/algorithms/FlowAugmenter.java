package corridor.algorithms;

import corridor.core.CapacityMatrix;
import corridor.core.FlowMatrix;
import org.eclipse.collections.api.list.primitive.IntList;

/**
 * Pushes the bottleneck amount along an augmenting path.
 *
 * <p>For each consecutive edge (u, v) on the path, {@code flow(u, v)} grows by the bottleneck and
 * {@code flow(v, u)} shrinks by the same amount, which keeps the flow skew-symmetric and opens residual
 * capacity on the reverse direction for later cancellation.</p>
 */
public class FlowAugmenter {

    /**
     * Minimum residual capacity over the consecutive edges of {@code path}.
     *
     * @throws IllegalArgumentException if the path has fewer than two nodes
     */
    public long bottleneck(CapacityMatrix capacity, FlowMatrix flow, IntList path) {
        if (path.size() < 2) {
            throw new IllegalArgumentException("An augmenting path needs at least two nodes, got " + path.size() + ".");
        }
        long bottleneck = Long.MAX_VALUE;
        for (int i = 1; i < path.size(); i++) {
            long r = flow.residual(capacity, path.get(i - 1), path.get(i));
            if (r < bottleneck) bottleneck = r;
        }
        return bottleneck;
    }

    /**
     * Augments {@code flow} in place along {@code path}.
     *
     * <p>Afterwards the bottleneck edge has zero residual capacity and no edge has negative residual
     * capacity.</p>
     *
     * @return the amount pushed
     * @throws IllegalArgumentException if the path is too short or some edge has no residual capacity
     */
    public long augment(CapacityMatrix capacity, FlowMatrix flow, IntList path) {
        final long bottleneck = bottleneck(capacity, flow, path);
        if (bottleneck <= 0L) {
            throw new IllegalArgumentException("Path " + path + " has no residual capacity (bottleneck "
                    + bottleneck + ").");
        }

        for (int i = 1; i < path.size(); i++) {
            flow.push(path.get(i - 1), path.get(i), bottleneck);
        }
        return bottleneck;
    }
}
