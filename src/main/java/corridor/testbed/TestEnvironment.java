package corridor.testbed;

import corridor.algorithms.BruteForceMinCut;
import corridor.algorithms.CorridorMaxFlow;
import corridor.core.CapacityMatrix;
import corridor.core.FlowMatrix;
import corridor.core.FlowValidators;
import corridor.generator.CorridorGenerator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.function.Consumer;

/**
 * Test harness for randomized corridor max-flow instances.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Generate batches of random multi-source / multi-sink instances (delegated to
 *       {@link CorridorGenerator}).</li>
 *   <li>Solve each instance and validate the engine's final flow on the reduced graph with:
 *     <ul>
 *       <li>skew symmetry</li>
 *       <li>capacity constraints</li>
 *       <li>flow conservation</li>
 *       <li>existence of a saturated s-t cut in the final residual network</li>
 *     </ul>
 *   </li>
 *   <li>Cross-check the value against an exhaustive minimum cut on small instances, against the total
 *       source capacity, and against a copy with one corridor widened (the value must not drop).</li>
 *   <li>Corrupt a solved flow on purpose to demonstrate that the validators detect violations.</li>
 * </ul>
 *
 * <p>Output goes to a {@link Consumer} line sink; {@code System.out} when none is given.</p>
 */
public class TestEnvironment {

    /** Instances with more free rooms than this skip the exhaustive min-cut check. */
    static final int BRUTE_FORCE_LIMIT = 16;

    /**
     * One batch configuration: (numInstances, n, maxCap, density).
     */
    public static class BatchConfig {
        public final int numInstances;
        public final int n;
        public final int maxCap;
        public final double density;

        public BatchConfig(int numInstances, int n, int maxCap, double density) {
            this.numInstances = numInstances;
            this.n = n;
            this.maxCap = maxCap;
            this.density = density;
        }
    }

    /**
     * Totals over all batches of one run.
     */
    public static class Summary {
        public int instances;
        public int failed;
        public int minCutMismatches;
        public int sanityDetected;

        public boolean allPassed() {
            return failed == 0 && minCutMismatches == 0 && sanityDetected == instances;
        }
    }

    /**
     * Per-instance report. If the solver throws, {@code ranOK=false} and every check is forced to false.
     */
    static class InstanceReport {
        long maxFlow;
        long bypass;
        int augmentations;

        boolean skewOK;
        boolean capacityOK;
        boolean conservationOK;
        boolean saturatedCutOK;
        boolean boundOK;
        boolean monotoneOK;

        /** Null when the exhaustive check was skipped. */
        Long bruteForceMinCut;

        boolean ranOK;
        String errorMessage;

        boolean checksOK() {
            return ranOK && skewOK && capacityOK && conservationOK && saturatedCutOK && boundOK && monotoneOK;
        }

        boolean minCutMatches() {
            return bruteForceMinCut == null || bruteForceMinCut == maxFlow;
        }
    }

    /* ===================== Public entry points ===================== */

    /**
     * Convenience entry that prints to the console.
     */
    public static Summary runBatches(List<BatchConfig> batches, Random rng) {
        return runBatches(batches, rng, System.out::println);
    }

    /**
     * Main entry point with a log callback.
     *
     * @param batches batch configurations
     * @param rng     random generator (instance generation and monotonicity checks)
     * @param log     consumer that receives one line at a time; if null, falls back to System.out
     * @return aggregated counts
     */
    public static Summary runBatches(List<BatchConfig> batches, Random rng, Consumer<String> log) {
        if (log == null) log = System.out::println;

        log.accept("=== Corridor Max-Flow Test Report ===");
        log.accept("Total batches: " + batches.size());
        log.accept("-------------------------------------");

        Summary summary = new Summary();
        CorridorMaxFlow solver = new CorridorMaxFlow();
        int globalInstanceId = 1;

        for (BatchConfig batch : batches) {
            log.accept("");
            log.accept(">>> Batch: " + batch.numInstances + " instances, n=" + batch.n + ", maxCap=" + batch.maxCap
                    + String.format(Locale.ROOT, ", density=%.2f", batch.density));
            log.accept("------------------------------------------");

            int mismatchCnt = 0;
            int anyFailCnt = 0;
            int sanityOKCnt = 0;

            for (int instIdx = 0; instIdx < batch.numInstances; instIdx++, globalInstanceId++) {
                CorridorGenerator.Result gen = CorridorGenerator.generate(batch.n, batch.maxCap, batch.density, rng);

                InstanceReport r = runAndValidate(solver, gen, rng);
                boolean sanity = r.ranOK && sanityFlowOverflow(solver, gen);

                log.accept("Instance #" + globalInstanceId + " (idxInBatch=" + instIdx + ", n=" + batch.n
                        + ", sources=" + Arrays.toString(gen.sources) + ", sinks=" + Arrays.toString(gen.sinks) + "):");
                printReport(log, "    ", r);
                log.accept("    Sanity (flow overflow): " + (sanity ? "detected violation" : "NOT detected"));

                if (!r.checksOK()) anyFailCnt++;
                if (!r.minCutMatches()) {
                    mismatchCnt++;
                    log.accept("    >>> WARNING: max flow differs from the exhaustive minimum cut!");
                }
                if (sanity) sanityOKCnt++;
                log.accept("");
            }

            log.accept(String.format(Locale.ROOT,
                    "Batch summary: min-cut mismatches=%d / any check failed=%d / sanity OK=%d",
                    mismatchCnt, anyFailCnt, sanityOKCnt));

            summary.instances += batch.numInstances;
            summary.failed += anyFailCnt;
            summary.minCutMismatches += mismatchCnt;
            summary.sanityDetected += sanityOKCnt;
        }

        log.accept("=== End of Report ===");
        return summary;
    }

    /**
     * Convenience wrapper for running exactly one batch.
     */
    public static Summary runBatch(int count, int n, int maxCap, double density, Random rng) {
        List<BatchConfig> list = new ArrayList<>();
        list.add(new BatchConfig(count, n, maxCap, density));
        return runBatches(list, rng);
    }

    /* ===================== Internal helpers ===================== */

    /**
     * Solve -> validate -> cross-check, with exception containment.
     */
    static InstanceReport runAndValidate(CorridorMaxFlow solver, CorridorGenerator.Result gen, Random rng) {
        InstanceReport r = new InstanceReport();
        try {
            CorridorMaxFlow.Solution sol = solver.solve(gen.sources, gen.sinks, gen.capacity);
            CapacityMatrix reduced = sol.reduction.reduced;
            FlowMatrix flow = sol.flow.flow;
            int s = sol.reduction.source();
            int t = sol.reduction.sink();

            r.maxFlow = sol.total();
            r.bypass = sol.bypassFlow;
            r.augmentations = sol.augmentations;

            r.skewOK = FlowValidators.skewSymmetry(flow);
            r.capacityOK = FlowValidators.capacityConstraints(reduced, flow);
            r.conservationOK = FlowValidators.flowConservation(flow, s, t);
            r.saturatedCutOK = FlowValidators.saturatedCutExists(reduced, flow, s, t);

            long sourceOut = 0L;
            for (int src : gen.sources) sourceOut += gen.capacity.outCapacity(src);
            r.boundOK = r.maxFlow >= 0L && r.maxFlow <= sourceOut;

            int free = gen.capacity.size() - gen.sources.length - gen.sinks.length;
            if (free <= BRUTE_FORCE_LIMIT) {
                r.bruteForceMinCut = new BruteForceMinCut().minCut(gen.capacity, gen.sources, gen.sinks);
            }

            r.monotoneOK = monotone(solver, gen, r.maxFlow, rng);
            r.ranOK = true;

        } catch (RuntimeException ex) {
            r.ranOK = false;
            r.errorMessage = ex.getClass().getSimpleName() + ": " + ex.getMessage();

            r.skewOK = false;
            r.capacityOK = false;
            r.conservationOK = false;
            r.saturatedCutOK = false;
            r.boundOK = false;
            r.monotoneOK = false;
            r.maxFlow = Long.MIN_VALUE;
        }
        return r;
    }

    /**
     * Widens one random corridor and checks the value does not decrease.
     */
    private static boolean monotone(CorridorMaxFlow solver, CorridorGenerator.Result gen, long before, Random rng) {
        int n = gen.capacity.size();
        int u = rng.nextInt(n);
        int v = rng.nextInt(n - 1);
        if (v >= u) v++;

        CapacityMatrix widened = gen.capacity.withCapacity(u, v, gen.capacity.capacity(u, v) + 1L + rng.nextInt(10));
        return solver.maxFlow(gen.sources, gen.sinks, widened) >= before;
    }

    /**
     * Corrupts a solved flow by pushing one edge past its capacity without touching its mirror.
     *
     * <p>Expected: skew symmetry, capacity constraints and/or flow conservation fail.</p>
     *
     * @return true iff at least one validator detects the violation
     */
    private static boolean sanityFlowOverflow(CorridorMaxFlow solver, CorridorGenerator.Result gen) {
        CorridorMaxFlow.Solution sol = solver.solve(gen.sources, gen.sinks, gen.capacity);
        CapacityMatrix reduced = sol.reduction.reduced;
        FlowMatrix corrupted = sol.flow.flow.copy();
        int s = sol.reduction.source();
        int t = sol.reduction.sink();

        corrupted.set(s, t, reduced.capacity(s, t) + 123L);

        boolean skewOK = FlowValidators.skewSymmetry(corrupted);
        boolean capOK = FlowValidators.capacityConstraints(reduced, corrupted);
        boolean consOK = FlowValidators.flowConservation(corrupted, s, t);

        return !(skewOK && capOK && consOK);
    }

    private static void printReport(Consumer<String> log, String indent, InstanceReport r) {
        if (!r.ranOK) {
            log.accept(indent + "[FAILED]: " + r.errorMessage);
            return;
        }
        log.accept(indent + "maxFlow = " + r.maxFlow + " (bypass " + r.bypass + ", "
                + r.augmentations + " augmentations)"
                + (r.bruteForceMinCut == null ? " [min cut skipped]"
                : r.minCutMatches() ? " [min cut OK]" : " [min cut " + r.bruteForceMinCut + "]"));
        log.accept(indent + "  skew symmetry:        " + (r.skewOK ? "OK" : "FAIL"));
        log.accept(indent + "  capacity constraints: " + (r.capacityOK ? "OK" : "FAIL"));
        log.accept(indent + "  flow conservation:    " + (r.conservationOK ? "OK" : "FAIL"));
        log.accept(indent + "  saturated cut exists: " + (r.saturatedCutOK ? "OK" : "FAIL"));
        log.accept(indent + "  source bound:         " + (r.boundOK ? "OK" : "FAIL"));
        log.accept(indent + "  monotone widening:    " + (r.monotoneOK ? "OK" : "FAIL"));
    }
}
