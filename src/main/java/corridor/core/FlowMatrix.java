package corridor.core;

/**
 * Signed net flow between every ordered pair of nodes, same dimension as the capacity matrix it belongs to.
 *
 * <p>Typical invariants maintained by the algorithms in this project:
 * <ul>
 *   <li>skew symmetry: {@code flow(u, v) == -flow(v, u)};</li>
 *   <li>{@code flow(u, v) <= capacity(u, v)}, i.e. residual capacity never becomes negative;</li>
 *   <li>an edge with zero capacity may still carry negative flow, which represents cancelling flow that
 *       was sent the other way.</li>
 * </ul>
 *
 * <p>A flow matrix is created zero-initialized at the start of a solve and mutated in place once per
 * augmentation. It is not thread-safe.</p>
 */
public final class FlowMatrix {

    private final int n;
    private final long[][] flow;

    /**
     * Creates an all-zero flow for {@code n} nodes.
     */
    public FlowMatrix(int n) {
        this.n = n;
        this.flow = new long[n][n];
    }

    /**
     * @return number of vertices
     */
    public int size() {
        return n;
    }

    public long flow(int u, int v) {
        return flow[u][v];
    }

    /**
     * Residual capacity of u -> v with respect to {@code capacity}.
     *
     * <p>Saturates at {@link Long#MAX_VALUE} when cancellable flow on a near-maximal corridor would leave
     * the {@code long} range.</p>
     */
    public long residual(CapacityMatrix capacity, int u, int v) {
        long c = capacity.capacity(u, v);
        long f = flow[u][v];
        if (f < 0L && c > Long.MAX_VALUE + f) return Long.MAX_VALUE;
        return c - f;
    }

    /**
     * Sends {@code amount} units along u -> v and records the cancelling amount on v -> u.
     */
    public void push(int u, int v, long amount) {
        flow[u][v] += amount;
        flow[v][u] -= amount;
    }

    /**
     * Net flow entering {@code v}: the sum over all nodes {@code u} of {@code flow(u, v)}.
     */
    public long inflow(int v) {
        long sum = 0L;
        for (int u = 0; u < n; u++) sum += flow[u][v];
        return sum;
    }

    /**
     * Net flow leaving {@code u}: the sum over all nodes {@code v} of {@code flow(u, v)}.
     */
    public long outflow(int u) {
        long sum = 0L;
        for (int v = 0; v < n; v++) sum += flow[u][v];
        return sum;
    }

    /**
     * Overwrites a single cell without touching its mirror. Only meant for corrupting a solved state when
     * exercising the validators.
     */
    public void set(int u, int v, long value) {
        flow[u][v] = value;
    }

    /**
     * @return deep copy including the current flow state
     */
    public FlowMatrix copy() {
        FlowMatrix c = new FlowMatrix(n);
        for (int u = 0; u < n; u++) System.arraycopy(flow[u], 0, c.flow[u], 0, n);
        return c;
    }
}
