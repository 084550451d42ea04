package corridor.algorithms;

import corridor.core.CapacityMatrix;
import corridor.core.FlowValidators;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class EdmondsKarpTest {

    private final EdmondsKarp engine = new EdmondsKarp();

    /** Textbook network with max flow 23. */
    private static CapacityMatrix textbook() {
        return CapacityMatrix.of(new long[][]{
                {0, 16, 13, 0, 0, 0},
                {0, 0, 0, 12, 0, 0},
                {0, 4, 0, 0, 14, 0},
                {0, 0, 9, 0, 0, 20},
                {0, 0, 0, 7, 0, 4},
                {0, 0, 0, 0, 0, 0}
        });
    }

    @Test
    void textbookNetwork() {
        FlowResult r = engine.solve(textbook(), 0, 5);

        assertEquals(23L, r.value);
        assertTrue(FlowValidators.skewSymmetry(r.flow));
        assertTrue(FlowValidators.capacityConstraints(textbook(), r.flow));
        assertTrue(FlowValidators.flowConservation(r.flow, 0, 5));
        assertTrue(FlowValidators.saturatedCutExists(textbook(), r.flow, 0, 5));
    }

    @Test
    void minCutSideMatchesValue() {
        CapacityMatrix cap = textbook();
        FlowResult r = engine.solve(cap, 0, 5);

        assertTrue(r.onSourceSide(0));
        assertFalse(r.onSourceSide(5));

        long cut = 0L;
        boolean[] side = r.sourceSide();
        for (int u = 0; u < cap.size(); u++) {
            for (int v = 0; v < cap.size(); v++) {
                if (side[u] && !side[v]) cut += cap.capacity(u, v);
            }
        }
        assertEquals(r.value, cut);
    }

    @Test
    void iterationCountDoesNotDependOnCapacityMagnitude() {
        // Depth-first choices could bounce across the 1 -> 2 edge 2 * 10^12 times.
        long big = 1_000_000_000_000L;
        CapacityMatrix cap = CapacityMatrix.of(new long[][]{
                {0, big, big, 0},
                {0, 0, 1, big},
                {0, 0, 0, big},
                {0, 0, 0, 0}
        });
        FlowResult r = engine.solve(cap, 0, 3);

        assertEquals(2 * big, r.value);
        assertEquals(2, r.augmentations);
    }

    @Test
    void disconnectedSinkGivesZero() {
        CapacityMatrix cap = CapacityMatrix.of(new long[][]{
                {0, 4, 0},
                {4, 0, 0},
                {0, 0, 0}
        });
        FlowResult r = engine.solve(cap, 0, 2);
        assertEquals(0L, r.value);
        assertEquals(0, r.augmentations);
    }

    @Test
    void sameSourceAndSinkGivesZero() {
        assertEquals(0L, engine.maxFlow(textbook(), 2, 2));
    }

    @Test
    void capacityMatrixIsNotModified() {
        CapacityMatrix cap = textbook();
        CapacityMatrix before = CapacityMatrix.of(cap.toArray());
        engine.maxFlow(cap, 0, 5);
        assertEquals(before, cap);
    }

    @Test
    void rejectsTerminalsOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> engine.maxFlow(textbook(), 0, 6));
    }
}
