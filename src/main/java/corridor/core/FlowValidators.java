package corridor.core;

import java.util.ArrayDeque;

/**
 * Utility validators for max-flow solutions in the project's matrix representation.
 *
 * <p>These checks are used by the testbed and the unit tests to verify correctness properties:
 * <ol>
 *   <li><b>Skew symmetry</b> of the flow matrix</li>
 *   <li><b>Capacity constraints</b>: no residual capacity below zero</li>
 *   <li><b>Flow conservation</b> at all intermediate vertices</li>
 *   <li><b>Existence of a saturated s-t cut</b> in the final residual network</li>
 * </ol>
 *
 * <p>Unlike an adjacency-list residual graph there are no artificial reverse edges here: cell {@code (v, u)}
 * of the flow matrix is the mirror of {@code (u, v)}, and every cell is checked against the capacity at the
 * same position.</p>
 */
public final class FlowValidators {

    private FlowValidators() {
    }

    /**
     * For every ordered pair, {@code flow(u, v) == -flow(v, u)}.
     */
    public static boolean skewSymmetry(FlowMatrix flow) {
        final int n = flow.size();
        for (int u = 0; u < n; u++) {
            for (int v = u; v < n; v++) {
                if (flow.flow(u, v) != -flow.flow(v, u)) return false;
            }
        }
        return true;
    }

    /**
     * For every ordered pair, {@code flow(u, v) <= capacity(u, v)}.
     *
     * <p>Negative flow is allowed on any edge as long as the mirrored direction respects its own capacity,
     * which the same loop checks when it reaches {@code (v, u)}.</p>
     */
    public static boolean capacityConstraints(CapacityMatrix capacity, FlowMatrix flow) {
        requireSameSize(capacity, flow);
        final int n = capacity.size();
        for (int u = 0; u < n; u++) {
            for (int v = 0; v < n; v++) {
                if (flow.residual(capacity, u, v) < 0L) return false;
            }
        }
        return true;
    }

    /**
     * Net outflow is zero at every vertex other than {@code s} and {@code t}.
     */
    public static boolean flowConservation(FlowMatrix flow, int s, int t) {
        final int n = flow.size();
        for (int u = 0; u < n; u++) {
            if (u == s || u == t) continue;
            if (flow.outflow(u) != 0L) return false;
        }
        return true;
    }

    /**
     * Saturated cut existence check (a standard max-flow optimality certificate):
     *
     * <p>Compute the set S of vertices reachable from {@code s} in the residual network. Then require
     * that {@code t} is not in S and that every edge with positive capacity crossing from S to V\S has zero
     * residual capacity.</p>
     */
    public static boolean saturatedCutExists(CapacityMatrix capacity, FlowMatrix flow, int s, int t) {
        requireSameSize(capacity, flow);
        final boolean[] inS = residualReachable(capacity, flow, s);

        // In a max-flow, the sink must be unreachable from s in the final residual network.
        if (inS[t]) return false;

        final int n = capacity.size();
        for (int u = 0; u < n; u++) {
            if (!inS[u]) continue;
            for (int v = 0; v < n; v++) {
                if (inS[v] || capacity.capacity(u, v) <= 0L) continue;
                if (flow.residual(capacity, u, v) > 0L) return false;
            }
        }
        return true;
    }

    /**
     * Residual reachability from {@code s} using only edges with positive residual capacity.
     *
     * @return {@code vis[v] == true} iff v is reachable from s in the current residual network
     */
    public static boolean[] residualReachable(CapacityMatrix capacity, FlowMatrix flow, int s) {
        final int n = capacity.size();
        boolean[] vis = new boolean[n];
        ArrayDeque<Integer> q = new ArrayDeque<>();

        vis[s] = true;
        q.add(s);

        while (!q.isEmpty()) {
            int u = q.poll();
            for (int v = 0; v < n; v++) {
                if (!vis[v] && flow.residual(capacity, u, v) > 0L) {
                    vis[v] = true;
                    q.add(v);
                }
            }
        }
        return vis;
    }

    private static void requireSameSize(CapacityMatrix capacity, FlowMatrix flow) {
        if (capacity.size() != flow.size()) {
            throw new IllegalArgumentException("Flow matrix has " + flow.size()
                    + " nodes but capacity matrix has " + capacity.size() + ".");
        }
    }
}
