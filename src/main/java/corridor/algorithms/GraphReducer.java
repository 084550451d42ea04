package corridor.algorithms;

import corridor.core.CapacityMatrix;
import corridor.core.InvalidInputException;
import org.eclipse.collections.api.list.primitive.ImmutableIntList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.impl.list.mutable.primitive.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collapses a multi-source / multi-sink corridor network into a single-source / single-sink one.
 *
 * <p>Layout of the reduced matrix (size {@code n - |S| - |T| + 2}):
 * <ul>
 *   <li>index 0 is the super-source; its edge to a surviving node {@code m} is the sum over all sources
 *       {@code s} of {@code capacity(s, m)};</li>
 *   <li>indices 1..k are the surviving nodes (neither source nor sink) in ascending original order, with
 *       their mutual edges unchanged;</li>
 *   <li>index k+1 is the super-sink; the edge from a surviving node {@code m} is the sum over all sinks
 *       {@code t} of {@code capacity(m, t)}; its own row is all zero.</li>
 * </ul>
 *
 * <p>Sources and sinks are removed from the reduced graph entirely. Capacity running directly from a source
 * to a sink is reported as {@link Result#bypassFlow} and never appears inside the reduced matrix, so it
 * cannot be counted twice.</p>
 */
public class GraphReducer {

    private static final Logger log = LoggerFactory.getLogger(GraphReducer.class);

    /**
     * Output of a reduction.
     */
    public static final class Result {
        /** Capacity connecting a source directly to a sink. */
        public final long bypassFlow;

        /** Single-source / single-sink matrix. */
        public final CapacityMatrix reduced;

        /** {@code originalIndex.get(i)} is the original node behind reduced index {@code i + 1}. */
        public final ImmutableIntList originalIndex;

        Result(long bypassFlow, CapacityMatrix reduced, ImmutableIntList originalIndex) {
            this.bypassFlow = bypassFlow;
            this.reduced = reduced;
            this.originalIndex = originalIndex;
        }

        /** @return index of the super-source, always 0 */
        public int source() {
            return 0;
        }

        /** @return index of the super-sink, always the last index */
        public int sink() {
            return reduced.size() - 1;
        }
    }

    /**
     * Reduces {@code capacity} around the given terminal sets.
     *
     * <p>Either set may be empty: the bypass is then 0 and the corresponding synthetic node has no edges.</p>
     *
     * @param capacity validated capacity matrix
     * @param sources  source node indices (distinct, in range)
     * @param sinks    sink node indices (distinct, in range, disjoint from sources)
     * @return bypass flow and reduced matrix
     * @throws InvalidInputException on duplicate, out-of-range or overlapping indices, or if capacity sums
     *                               overflow a {@code long}
     */
    public Result reduce(CapacityMatrix capacity, int[] sources, int[] sinks) {
        final int n = capacity.size();
        final boolean[] isSource = markTerminals(n, sources, "source");
        final boolean[] isSink = markTerminals(n, sinks, "sink");
        for (int v = 0; v < n; v++) {
            if (isSource[v] && isSink[v]) {
                throw new InvalidInputException("Node " + v + " is listed as both a source and a sink.");
            }
        }

        try {
            // Upper bound of any total flow; must fit in a long.
            long sourceOut = 0L;
            for (int s : sources) sourceOut = Math.addExact(sourceOut, capacity.outCapacity(s));

            // 1) Capacity that bypasses the graph entirely.
            long bypass = 0L;
            for (int s : sources) {
                for (int t : sinks) bypass = Math.addExact(bypass, capacity.capacity(s, t));
            }

            // 2) Surviving nodes in ascending original order.
            MutableIntList survivors = new IntArrayList(n);
            for (int v = 0; v < n; v++) {
                if (!isSource[v] && !isSink[v]) survivors.add(v);
            }
            final int k = survivors.size();
            final int superSink = k + 1;

            CapacityMatrix.Builder b = new CapacityMatrix.Builder(k + 2);
            for (int i = 0; i < k; i++) {
                int m = survivors.get(i);

                long fromSources = 0L;
                for (int s : sources) fromSources = Math.addExact(fromSources, capacity.capacity(s, m));
                b.set(0, i + 1, fromSources);

                long toSinks = 0L;
                for (int t : sinks) toSinks = Math.addExact(toSinks, capacity.capacity(m, t));
                b.set(i + 1, superSink, toSinks);

                for (int j = 0; j < k; j++) {
                    b.set(i + 1, j + 1, capacity.capacity(m, survivors.get(j)));
                }
            }

            if (log.isDebugEnabled()) {
                log.debug("Reduced {} nodes ({} sources, {} sinks) to {} nodes, bypass={}, source capacity={}",
                        n, sources.length, sinks.length, k + 2, bypass, sourceOut);
            }
            return new Result(bypass, b.build(), survivors.toImmutable());
        } catch (ArithmeticException e) {
            throw new InvalidInputException("Capacity sum overflows a 64-bit integer.", e);
        }
    }

    /**
     * Checks a terminal index set and returns its membership mask.
     */
    private static boolean[] markTerminals(int n, int[] indices, String role) {
        if (indices == null) throw new InvalidInputException("The " + role + " index set must not be null.");
        boolean[] mask = new boolean[n];
        for (int idx : indices) {
            if (idx < 0 || idx >= n) {
                throw new InvalidInputException("The " + role + " index " + idx + " is outside [0, " + n + ").");
            }
            if (mask[idx]) {
                throw new InvalidInputException("The " + role + " index " + idx + " is listed more than once.");
            }
            mask[idx] = true;
        }
        return mask;
    }
}
