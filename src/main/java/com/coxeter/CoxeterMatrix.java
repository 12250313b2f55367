package com.coxeter;

import java.util.Arrays;

/**
 * Validated Coxeter matrix: square, symmetric, unit diagonal, and every
 * off-diagonal entry either 0 (infinite order) or at least 2.
 */
public final class CoxeterMatrix {
    /** Off-diagonal value for a pair of generators with no braid relation. */
    public static final int INFINITE = 0;

    private final int[][] m;

    private CoxeterMatrix(int[][] m) {
        this.m = m;
    }

    /** Copies and validates {@code entries}. */
    public static CoxeterMatrix of(int[][] entries) {
        if (entries == null || entries.length == 0) {
            throw new IllegalArgumentException("Coxeter matrix must have at least one row");
        }
        int dim = entries.length;
        int[][] copy = new int[dim][];
        for (int i = 0; i < dim; i++) {
            if (entries[i] == null || entries[i].length != dim) {
                throw new IllegalArgumentException("Coxeter matrix must be square: row " + i + " has "
                        + (entries[i] == null ? 0 : entries[i].length) + " entries, expected " + dim);
            }
            copy[i] = entries[i].clone();
        }
        for (int i = 0; i < dim; i++) {
            if (copy[i][i] != 1) throw new InvalidCoxeterEntryException(i, i, "diagonal must be 1, got " + copy[i][i]);
            for (int j = 0; j < i; j++) {
                int v = copy[i][j];
                if (v != copy[j][i]) {
                    throw new InvalidCoxeterEntryException(i, j, "not symmetric (" + v + " vs " + copy[j][i] + ")");
                }
                checkOrder(i, j, v);
            }
        }
        return new CoxeterMatrix(copy);
    }

    private static void checkOrder(int i, int j, int v) {
        if (v < 0) throw new InvalidCoxeterEntryException(i, j, "negative order " + v);
        if (v == 1) throw new InvalidCoxeterEntryException(i, j, "order 1 is only allowed on the diagonal");
    }

    public int dim() { return m.length; }

    /** Order of r_i r_j; 1 on the diagonal, {@link #INFINITE} for no relation. */
    public int order(int i, int j) { return m[i][j]; }

    public boolean isFinite(int i, int j) { return m[i][j] != INFINITE; }

    public int[][] toArray() {
        int[][] out = new int[m.length][];
        for (int i = 0; i < m.length; i++) out[i] = m[i].clone();
        return out;
    }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CoxeterMatrix)) return false;
        return Arrays.deepEquals(m, ((CoxeterMatrix) obj).m);
    }

    @Override public int hashCode() { return Arrays.deepHashCode(m); }

    @Override public String toString() { return Arrays.deepToString(m); }

    /**
     * Fluent construction from a Coxeter diagram: generators not joined by
     * {@link #order} commute (order 2).
     */
    public static final class Builder {
        private final int[][] m;

        public Builder(int dim) {
            if (dim <= 0) throw new IllegalArgumentException("Dimension must be positive, got " + dim);
            m = new int[dim][dim];
            for (int i = 0; i < dim; i++) {
                Arrays.fill(m[i], 2);
                m[i][i] = 1;
            }
        }

        public Builder order(int i, int j, int order) {
            if (i < 0 || j < 0 || i >= m.length || j >= m.length) {
                throw new IndexOutOfBoundsException("Generator pair (" + i + "," + j + ") outside 0.." + (m.length - 1));
            }
            if (i == j) throw new InvalidCoxeterEntryException(i, j, "diagonal is fixed at 1");
            checkOrder(i, j, order);
            m[i][j] = order;
            m[j][i] = order;
            return this;
        }

        public Builder infinite(int i, int j) { return order(i, j, INFINITE); }

        public CoxeterMatrix build() { return CoxeterMatrix.of(m); }
    }
}
