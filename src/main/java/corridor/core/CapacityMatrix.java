package corridor.core;

import java.util.Arrays;

/**
 * Immutable N×N corridor capacity matrix shared by all algorithms in this project.
 *
 * <p>Representation:
 * <ul>
 *   <li>{@code capacity(u, v)} is the maximum number of units per tick that can move from room {@code u}
 *       to room {@code v}. All entries are non-negative.</li>
 *   <li>Nodes are indexed 0..n-1 and carry no attributes beyond their position.</li>
 *   <li>Diagonal entries (self-loops) are tolerated; no algorithm ever routes flow through them.</li>
 * </ul>
 *
 * <p>Instances are created through {@link #of(long[][])}, which validates the input and takes a defensive
 * copy, so a matrix never changes while a solve is running.</p>
 */
public final class CapacityMatrix {

    /** Number of vertices. */
    private final int n;

    /** Row-major capacities, owned exclusively by this instance. */
    private final long[][] cap;

    private CapacityMatrix(long[][] cap) {
        this.n = cap.length;
        this.cap = cap;
    }

    /**
     * Validates and copies a caller-supplied matrix.
     *
     * @param rows square matrix of non-negative capacities, at least 2×2
     * @return immutable capacity matrix
     * @throws InvalidInputException if the matrix is null, smaller than 2×2, ragged/non-square,
     *                               or contains a negative entry
     */
    public static CapacityMatrix of(long[][] rows) {
        if (rows == null) throw new InvalidInputException("Capacity matrix must not be null.");

        final int n = rows.length;
        if (n < 2) {
            throw new InvalidInputException("Capacity matrix needs at least 2 nodes, got " + n + ".");
        }

        long[][] copy = new long[n][];
        for (int u = 0; u < n; u++) {
            long[] row = rows[u];
            if (row == null) throw new InvalidInputException("Row " + u + " of the capacity matrix is null.");
            if (row.length != n) {
                throw new InvalidInputException("Capacity matrix is not square: row " + u + " has "
                        + row.length + " columns, expected " + n + ".");
            }
            for (int v = 0; v < n; v++) {
                if (row[v] < 0L) {
                    throw new InvalidInputException("Negative capacity " + row[v]
                            + " at row " + u + ", column " + v + ".");
                }
            }
            copy[u] = row.clone();
        }
        return new CapacityMatrix(copy);
    }

    /**
     * Convenience factory for int-valued matrices (as typically produced by puzzle input).
     */
    public static CapacityMatrix of(int[][] rows) {
        if (rows == null) throw new InvalidInputException("Capacity matrix must not be null.");
        long[][] widened = new long[rows.length][];
        for (int u = 0; u < rows.length; u++) {
            if (rows[u] == null) throw new InvalidInputException("Row " + u + " of the capacity matrix is null.");
            widened[u] = Arrays.stream(rows[u]).asLongStream().toArray();
        }
        return of(widened);
    }

    /**
     * Wraps an array the caller has already validated and will never touch again.
     * Used by {@link Builder} to avoid a second copy.
     */
    static CapacityMatrix wrap(long[][] owned) {
        return new CapacityMatrix(owned);
    }

    /**
     * @return number of vertices
     */
    public int size() {
        return n;
    }

    /**
     * @param u tail vertex
     * @param v head vertex
     * @return capacity of the directed edge u -> v
     */
    public long capacity(int u, int v) {
        return cap[u][v];
    }

    /**
     * Sum of capacities on all edges leaving {@code u}, self-loop excluded.
     */
    public long outCapacity(int u) {
        long sum = 0L;
        for (int v = 0; v < n; v++) {
            if (v != u) sum = Math.addExact(sum, cap[u][v]);
        }
        return sum;
    }

    /**
     * Returns a copy with the single edge u -> v set to {@code value}.
     */
    public CapacityMatrix withCapacity(int u, int v, long value) {
        if (value < 0L) {
            throw new InvalidInputException("Negative capacity " + value + " at row " + u + ", column " + v + ".");
        }
        long[][] copy = toArray();
        copy[u][v] = value;
        return new CapacityMatrix(copy);
    }

    /**
     * @return a fresh deep copy of the underlying rows
     */
    public long[][] toArray() {
        long[][] copy = new long[n][];
        for (int u = 0; u < n; u++) copy[u] = cap[u].clone();
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CapacityMatrix)) return false;
        return Arrays.deepEquals(cap, ((CapacityMatrix) o).cap);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(cap);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CapacityMatrix[").append(n).append("x").append(n).append("]");
        for (long[] row : cap) sb.append(System.lineSeparator()).append(Arrays.toString(row));
        return sb.toString();
    }

    /**
     * Mutable builder for matrices assembled edge by edge (reduction, generators).
     * All cells start at zero.
     */
    public static final class Builder {
        private final long[][] cells;
        private boolean built;

        public Builder(int n) {
            if (n < 2) throw new InvalidInputException("Capacity matrix needs at least 2 nodes, got " + n + ".");
            this.cells = new long[n][n];
        }

        public Builder set(int u, int v, long value) {
            if (built) throw new IllegalStateException("Builder already used.");
            if (value < 0L) {
                throw new InvalidInputException("Negative capacity " + value + " at row " + u + ", column " + v + ".");
            }
            cells[u][v] = value;
            return this;
        }

        public CapacityMatrix build() {
            if (built) throw new IllegalStateException("Builder already used.");
            built = true;
            return wrap(cells);
        }
    }
}
