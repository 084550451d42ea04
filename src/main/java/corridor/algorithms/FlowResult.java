package corridor.algorithms;

import corridor.core.FlowMatrix;

/**
 * Outcome of one single-source / single-sink max-flow computation.
 */
public final class FlowResult {

    /** Total flow entering the sink. */
    public final long value;

    /** Final flow state. */
    public final FlowMatrix flow;

    /** Number of augmenting paths applied. */
    public final int augmentations;

    /** {@code sourceSide[v] == true} iff v is on the source side of the minimum cut. */
    private final boolean[] sourceSide;

    FlowResult(long value, FlowMatrix flow, int augmentations, boolean[] sourceSide) {
        this.value = value;
        this.flow = flow;
        this.augmentations = augmentations;
        this.sourceSide = sourceSide;
    }

    public boolean onSourceSide(int v) {
        return sourceSide[v];
    }

    public boolean[] sourceSide() {
        return sourceSide.clone();
    }
}
