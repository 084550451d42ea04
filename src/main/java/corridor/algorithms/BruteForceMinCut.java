package corridor.algorithms;

import corridor.core.CapacityMatrix;
import corridor.core.InvalidInputException;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.impl.list.mutable.primitive.IntArrayList;

/**
 * Exact multi-terminal minimum cut by exhaustive enumeration.
 *
 * <p>Every source is fixed on the source side, every sink on the sink side, and each of the k remaining
 * nodes is tried on both sides (2^k assignments). The cut value is the total capacity of edges from the
 * source side to the sink side, clamped to {@link Long#MAX_VALUE}. Only meant for cross-checking the flow
 * engine on small graphs.</p>
 */
public class BruteForceMinCut {

    /** Enumeration is refused above this many free nodes. */
    public static final int MAX_FREE_NODES = 20;

    /**
     * @return minimum capacity over all cuts separating {@code sources} from {@code sinks}
     * @throws InvalidInputException    on invalid terminal sets
     * @throws IllegalArgumentException if more than {@link #MAX_FREE_NODES} nodes are free
     */
    public long minCut(CapacityMatrix capacity, int[] sources, int[] sinks) {
        final int n = capacity.size();
        final boolean[] fixedSource = new boolean[n];
        final boolean[] fixedSink = new boolean[n];
        for (int s : sources) {
            checkIndex(n, s);
            fixedSource[s] = true;
        }
        for (int t : sinks) {
            checkIndex(n, t);
            if (fixedSource[t]) throw new InvalidInputException("Node " + t + " is listed as both a source and a sink.");
            fixedSink[t] = true;
        }

        MutableIntList free = new IntArrayList();
        for (int v = 0; v < n; v++) {
            if (!fixedSource[v] && !fixedSink[v]) free.add(v);
        }
        final int k = free.size();
        if (k > MAX_FREE_NODES) {
            throw new IllegalArgumentException("Too many free nodes for enumeration: " + k
                    + " (limit " + MAX_FREE_NODES + ").");
        }

        boolean[] side = new boolean[n];
        long best = Long.MAX_VALUE;
        for (long mask = 0; mask < (1L << k); mask++) {
            for (int v = 0; v < n; v++) side[v] = fixedSource[v];
            for (int i = 0; i < k; i++) {
                if ((mask & (1L << i)) != 0) side[free.get(i)] = true;
            }

            long cut = 0L;
            for (int u = 0; u < n; u++) {
                if (!side[u]) continue;
                for (int v = 0; v < n; v++) {
                    if (!side[v]) cut = saturatingAdd(cut, capacity.capacity(u, v));
                }
            }
            if (cut < best) best = cut;
        }
        return best;
    }

    /** Non-negative addition clamped to {@link Long#MAX_VALUE}. */
    private static long saturatingAdd(long a, long b) {
        long sum = a + b;
        return sum < 0L ? Long.MAX_VALUE : sum;
    }

    private static void checkIndex(int n, int idx) {
        if (idx < 0 || idx >= n) {
            throw new InvalidInputException("Terminal index " + idx + " is outside [0, " + n + ").");
        }
    }
}
