package corridor.algorithms;

import corridor.core.CapacityMatrix;
import corridor.core.FlowMatrix;
import org.eclipse.collections.api.list.primitive.ImmutableIntList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.impl.factory.primitive.IntLists;
import org.eclipse.collections.impl.list.mutable.primitive.IntArrayList;

/**
 * Breadth-first search for a fewest-hop augmenting path in the residual network.
 *
 * <p>The frontier is an arena of records, each holding a node index and the arena position of the record it
 * was reached from. The arena doubles as the FIFO queue: records are appended when discovered and expanded
 * in insertion order. The path is reconstructed only once, when the sink is reached, by following parent
 * positions back to the source.</p>
 *
 * <p>Guarantees:
 * <ul>
 *   <li>the returned path has the minimum number of edges among all augmenting paths;</li>
 *   <li>ties are broken by ascending node index at each branching point;</li>
 *   <li>each node is expanded at most once per search (one visited marker per node), so no path
 *       revisits a node;</li>
 *   <li>every consecutive edge on the path has strictly positive residual capacity.</li>
 * </ul>
 */
public class AugmentingPathFinder {

    /** Parent position of the root record. */
    private static final int NO_PARENT = -1;

    /**
     * Finds an augmenting path from {@code source} to {@code sink}.
     *
     * @param capacity capacity matrix
     * @param flow     current flow (not modified)
     * @param source   source node index
     * @param sink     sink node index
     * @return node sequence source -> ... -> sink, or {@code null} if the sink is unreachable in the residual
     *         network (the normal termination condition of a max-flow loop)
     */
    public ImmutableIntList find(CapacityMatrix capacity, FlowMatrix flow, int source, int sink) {
        if (source == sink) return null;

        final int n = capacity.size();
        boolean[] visited = new boolean[n];

        MutableIntList arenaNode = new IntArrayList(n);
        MutableIntList arenaParent = new IntArrayList(n);

        arenaNode.add(source);
        arenaParent.add(NO_PARENT);
        visited[source] = true;

        for (int head = 0; head < arenaNode.size(); head++) {
            int u = arenaNode.get(head);

            // Candidates in increasing index order; residual must be strictly positive.
            for (int v = 0; v < n; v++) {
                if (visited[v]) continue;
                if (flow.residual(capacity, u, v) <= 0L) continue;

                visited[v] = true;
                arenaNode.add(v);
                arenaParent.add(head);

                if (v == sink) {
                    return reconstruct(arenaNode, arenaParent, arenaNode.size() - 1);
                }
            }
        }
        return null;
    }

    /**
     * Walks parent positions from {@code last} back to the root record and returns the path in
     * source -> sink order.
     */
    private static ImmutableIntList reconstruct(MutableIntList arenaNode, MutableIntList arenaParent, int last) {
        // Count edges first so the array is allocated once.
        int len = 0;
        for (int pos = last; arenaParent.get(pos) != NO_PARENT; pos = arenaParent.get(pos)) len++;

        int[] path = new int[len + 1];
        int idx = len;
        for (int pos = last; pos != NO_PARENT; pos = arenaParent.get(pos)) {
            path[idx--] = arenaNode.get(pos);
        }
        return IntLists.immutable.of(path);
    }
}
