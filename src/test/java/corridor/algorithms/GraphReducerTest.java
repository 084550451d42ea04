package corridor.algorithms;

import corridor.core.CapacityMatrix;
import corridor.core.InvalidInputException;
import org.eclipse.collections.impl.factory.primitive.IntLists;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GraphReducerTest {

    private final GraphReducer reducer = new GraphReducer();

    private static CapacityMatrix twoByTwoTerminals() {
        return CapacityMatrix.of(new long[][]{
                {0, 0, 4, 6, 0, 0},
                {0, 0, 5, 2, 0, 0},
                {0, 0, 0, 0, 4, 4},
                {0, 0, 0, 0, 6, 6},
                {0, 0, 0, 0, 0, 0},
                {0, 0, 0, 0, 0, 0}
        });
    }

    @Test
    void collapsesSourcesAndSinks() {
        GraphReducer.Result r = reducer.reduce(twoByTwoTerminals(), new int[]{0, 1}, new int[]{4, 5});

        CapacityMatrix expected = CapacityMatrix.of(new long[][]{
                {0, 9, 8, 0},
                {0, 0, 0, 8},
                {0, 0, 0, 12},
                {0, 0, 0, 0}
        });
        assertEquals(expected, r.reduced);
        assertEquals(0L, r.bypassFlow);
        assertEquals(0, r.source());
        assertEquals(3, r.sink());
        assertEquals(IntLists.immutable.of(2, 3), r.originalIndex);
    }

    @Test
    void directSourceToSinkCapacityIsBypassOnly() {
        // 0 -> 2 directly (5), and 0 -> 1 -> 2 (5 each); sink 2 also points back into the graph.
        CapacityMatrix cap = CapacityMatrix.of(new long[][]{
                {0, 5, 5},
                {0, 0, 5},
                {0, 100, 0}
        });
        GraphReducer.Result r = reducer.reduce(cap, new int[]{0}, new int[]{2});

        assertEquals(5L, r.bypassFlow);
        assertEquals(CapacityMatrix.of(new long[][]{
                {0, 5, 0},
                {0, 0, 5},
                {0, 0, 0}
        }), r.reduced);
    }

    @Test
    void survivorsKeepMutualEdgesAndSelfLoops() {
        CapacityMatrix cap = CapacityMatrix.of(new long[][]{
                {0, 1, 0, 2},
                {0, 7, 3, 0},
                {0, 4, 0, 1},
                {0, 0, 0, 0}
        });
        GraphReducer.Result r = reducer.reduce(cap, new int[]{0}, new int[]{3});

        assertEquals(2L, r.bypassFlow);
        assertEquals(7L, r.reduced.capacity(1, 1));
        assertEquals(3L, r.reduced.capacity(1, 2));
        assertEquals(4L, r.reduced.capacity(2, 1));
        assertEquals(1L, r.reduced.capacity(2, 3));
    }

    @Test
    void emptyTerminalSetsGiveEdgelessSyntheticNodes() {
        GraphReducer.Result r = reducer.reduce(twoByTwoTerminals(), new int[0], new int[]{4, 5});

        assertEquals(0L, r.bypassFlow);
        assertEquals(6, r.reduced.size());
        for (int v = 0; v < r.reduced.size(); v++) {
            assertEquals(0L, r.reduced.capacity(0, v));
        }

        GraphReducer.Result noSinks = reducer.reduce(twoByTwoTerminals(), new int[]{0}, new int[0]);
        for (int u = 0; u < noSinks.reduced.size(); u++) {
            assertEquals(0L, noSinks.reduced.capacity(u, noSinks.sink()));
        }
    }

    @Test
    void onlyTerminalsLeavesTwoNodeGraph() {
        CapacityMatrix cap = CapacityMatrix.of(new long[][]{{0, 5}, {0, 0}});
        GraphReducer.Result r = reducer.reduce(cap, new int[]{0}, new int[]{1});

        assertEquals(5L, r.bypassFlow);
        assertEquals(CapacityMatrix.of(new long[][]{{0, 0}, {0, 0}}), r.reduced);
        assertTrue(r.originalIndex.isEmpty());
    }

    @Test
    void reductionIsRepeatable() {
        CapacityMatrix cap = twoByTwoTerminals();
        GraphReducer.Result a = reducer.reduce(cap, new int[]{0, 1}, new int[]{4, 5});
        GraphReducer.Result b = reducer.reduce(cap, new int[]{0, 1}, new int[]{4, 5});

        assertEquals(a.reduced, b.reduced);
        assertEquals(a.reduced.hashCode(), b.reduced.hashCode());
        assertEquals(a.bypassFlow, b.bypassFlow);
    }

    @Test
    void rejectsNodeThatIsBothSourceAndSink() {
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> reducer.reduce(twoByTwoTerminals(), new int[]{0, 4}, new int[]{4, 5}));
        assertTrue(e.getMessage().contains("Node 4"));
    }

    @Test
    void rejectsOutOfRangeAndDuplicateIndices() {
        InvalidInputException outOfRange = assertThrows(InvalidInputException.class,
                () -> reducer.reduce(twoByTwoTerminals(), new int[]{0}, new int[]{6}));
        assertTrue(outOfRange.getMessage().contains("sink index 6"));

        assertThrows(InvalidInputException.class,
                () -> reducer.reduce(twoByTwoTerminals(), new int[]{-1}, new int[]{5}));

        InvalidInputException dup = assertThrows(InvalidInputException.class,
                () -> reducer.reduce(twoByTwoTerminals(), new int[]{1, 1}, new int[]{5}));
        assertTrue(dup.getMessage().contains("more than once"));
    }

    @Test
    void rejectsCapacitySumOverflow() {
        CapacityMatrix cap = CapacityMatrix.of(new long[][]{
                {0, 0, Long.MAX_VALUE},
                {0, 0, 1},
                {0, 0, 0}
        });
        assertThrows(InvalidInputException.class, () -> reducer.reduce(cap, new int[]{0, 1}, new int[]{2}));
    }
}
