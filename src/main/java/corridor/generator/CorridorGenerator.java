package corridor.generator;

import corridor.core.CapacityMatrix;

import java.util.Arrays;
import java.util.Random;

/**
 * Random corridor network generator for the testbed.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Shuffle the room indices and take the first rooms as sources and the next ones as sinks
 *       (1..max(1, n/4) of each, never overlapping).</li>
 *   <li>Fill every off-diagonal cell independently: with probability {@code density} it gets a capacity
 *       in [1, maxCap], otherwise 0. The diagonal stays 0.</li>
 * </ol>
 */
public class CorridorGenerator {

    public static class Result {
        public final CapacityMatrix capacity;
        public final int[] sources;
        public final int[] sinks;

        public Result(CapacityMatrix capacity, int[] sources, int[] sinks) {
            this.capacity = capacity;
            this.sources = sources;
            this.sinks = sinks;
        }
    }

    /**
     * Generates a random instance with {@code n} rooms and capacities in [1, maxCap].
     *
     * @param n       number of rooms (>= 2)
     * @param maxCap  maximum capacity bound (> 0)
     * @param density probability that a directed corridor exists, in (0, 1]
     * @param rng     random generator
     * @return generated capacity matrix with its terminal sets (each sorted ascending)
     */
    public static Result generate(int n, int maxCap, double density, Random rng) {
        if (n < 2) throw new IllegalArgumentException("At least two rooms are required.");
        if (maxCap <= 0) throw new IllegalArgumentException("maxCap must be > 0.");
        if (!(density > 0.0 && density <= 1.0)) throw new IllegalArgumentException("density must be in (0, 1].");

        // 1) Terminal selection on a shuffled index order.
        int[] order = new int[n];
        for (int i = 0; i < n; i++) order[i] = i;
        for (int i = n - 1; i > 0; i--) {
            int j = rng.nextInt(i + 1);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }

        int maxTerminals = Math.max(1, n / 4);
        int numSources = 1 + rng.nextInt(maxTerminals);
        int numSinks = 1 + rng.nextInt(Math.min(maxTerminals, n - numSources));

        int[] sources = Arrays.copyOfRange(order, 0, numSources);
        int[] sinks = Arrays.copyOfRange(order, numSources, numSources + numSinks);
        Arrays.sort(sources);
        Arrays.sort(sinks);

        // 2) Corridors.
        CapacityMatrix.Builder b = new CapacityMatrix.Builder(n);
        for (int u = 0; u < n; u++) {
            for (int v = 0; v < n; v++) {
                if (u == v) continue;
                if (rng.nextDouble() < density) b.set(u, v, 1L + rng.nextInt(maxCap));
            }
        }

        return new Result(b.build(), sources, sinks);
    }
}
