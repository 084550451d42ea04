package corridor.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FlowValidatorsTest {

    /** 0 -> 1 -> 2 with capacities 4 and 3. */
    private static CapacityMatrix chain() {
        return CapacityMatrix.of(new long[][]{
                {0, 4, 0},
                {0, 0, 3},
                {0, 0, 0}
        });
    }

    @Test
    void maximumFlowPassesEveryCheck() {
        CapacityMatrix cap = chain();
        FlowMatrix flow = new FlowMatrix(3);
        flow.push(0, 1, 3);
        flow.push(1, 2, 3);

        assertTrue(FlowValidators.skewSymmetry(flow));
        assertTrue(FlowValidators.capacityConstraints(cap, flow));
        assertTrue(FlowValidators.flowConservation(flow, 0, 2));
        assertTrue(FlowValidators.saturatedCutExists(cap, flow, 0, 2));
    }

    @Test
    void nonMaximumFlowHasNoSaturatedCut() {
        CapacityMatrix cap = chain();
        FlowMatrix flow = new FlowMatrix(3);
        flow.push(0, 1, 1);
        flow.push(1, 2, 1);

        assertTrue(FlowValidators.flowConservation(flow, 0, 2));
        assertFalse(FlowValidators.saturatedCutExists(cap, flow, 0, 2));
    }

    @Test
    void detectsOverflowAndBrokenMirror() {
        CapacityMatrix cap = chain();
        FlowMatrix flow = new FlowMatrix(3);
        flow.set(1, 2, 5);

        assertFalse(FlowValidators.capacityConstraints(cap, flow));
        assertFalse(FlowValidators.skewSymmetry(flow));
        assertFalse(FlowValidators.flowConservation(flow, 0, 2));
    }

    @Test
    void residualReachabilityFollowsCancellation() {
        CapacityMatrix cap = chain();
        FlowMatrix flow = new FlowMatrix(3);
        flow.push(0, 1, 4);

        boolean[] fromOne = FlowValidators.residualReachable(cap, flow, 1);
        assertTrue(fromOne[0], "reverse residual 1 -> 0 opened by the pushed flow");
        assertTrue(fromOne[2]);

        boolean[] fromZero = FlowValidators.residualReachable(cap, flow, 0);
        assertFalse(fromZero[1]);
    }

    @Test
    void rejectsMismatchedSizes() {
        assertThrows(IllegalArgumentException.class,
                () -> FlowValidators.capacityConstraints(chain(), new FlowMatrix(4)));
    }
}
