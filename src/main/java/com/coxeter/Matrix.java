package com.coxeter;

import java.util.Arrays;
import java.util.Objects;

/**
 * An immutable square matrix of {@link AlgebraicInteger} values, all lying in
 * one {@link CyclotomicField}.  Rows and columns are indexed from zero.
 * Products are only defined between operands over the same field.
 */
public final class Matrix {
    private final CyclotomicField field;
    private final int dim;
    private final AlgebraicInteger[][] data;

    /**
     * Copies {@code grid}, which must be square with every entry over
     * {@code field}.
     *
     * @throws IllegalArgumentException if the grid is empty, ragged or has null entries
     * @throws IncompatibleFieldException if an entry belongs to another field
     */
    public Matrix(CyclotomicField field, AlgebraicInteger[][] grid) {
        this.field = Objects.requireNonNull(field, "field");
        this.data = copyChecked(field, grid);
        this.dim = data.length;
    }

    private Matrix(CyclotomicField field, int dim, AlgebraicInteger[][] data) {
        this.field = field;
        this.dim = dim;
        this.data = data;
    }

    /** Takes ownership of a square grid already known to lie in {@code field}. */
    private static Matrix wrap(CyclotomicField field, AlgebraicInteger[][] data) {
        return new Matrix(field, data.length, data);
    }

    private static AlgebraicInteger[][] copyChecked(CyclotomicField field, AlgebraicInteger[][] grid) {
        if (grid == null || grid.length == 0) throw new IllegalArgumentException("Matrix must have at least one row");
        int n = grid.length;
        AlgebraicInteger[][] copy = new AlgebraicInteger[n][];
        for (int i = 0; i < n; i++) {
            if (grid[i] == null || grid[i].length != n) {
                throw new IllegalArgumentException("Matrix must be square: row " + i + " has "
                        + (grid[i] == null ? 0 : grid[i].length) + " entries, expected " + n);
            }
            for (int j = 0; j < n; j++) {
                if (grid[i][j] == null) throw new IllegalArgumentException("Null entry at (" + i + "," + j + ")");
                field.requireSame(grid[i][j].field(), "entry (" + i + "," + j + ")");
            }
            copy[i] = grid[i].clone();
        }
        return copy;
    }

    /** The {@code dim × dim} identity over {@code field}. */
    public static Matrix identity(CyclotomicField field, int dim) {
        if (dim <= 0) throw new IllegalArgumentException("Dimension must be positive, got " + dim);
        AlgebraicInteger[][] I = new AlgebraicInteger[dim][dim];
        for (int i = 0; i < dim; i++) {
            for (int j = 0; j < dim; j++) I[i][j] = i == j ? field.one() : field.zero();
        }
        return wrap(field, I);
    }

    public CyclotomicField field() { return field; }
    public int dim() { return dim; }

    /** Returns the entry at row {@code r}, column {@code c}. */
    public AlgebraicInteger get(int r, int c) {
        return data[r][c];
    }

    /** A copy of row {@code r}. */
    public AlgebraicInteger[] row(int r) {
        return data[r].clone();
    }

    /**
     * Matrix product {@code this × other}.
     *
     * @throws IncompatibleFieldException if the fields differ
     * @throws DimensionMismatchException if the dimensions differ
     */
    public Matrix multiply(Matrix other) {
        Objects.requireNonNull(other, "other");
        field.requireSame(other.field, "matrix product");
        if (other.dim != dim) {
            throw new DimensionMismatchException("Cannot multiply " + dim + "x" + dim + " by " + other.dim + "x" + other.dim);
        }
        AlgebraicInteger[][] P = new AlgebraicInteger[dim][dim];
        for (int i = 0; i < dim; i++) {
            for (int j = 0; j < dim; j++) {
                AlgebraicInteger s = field.zero();
                for (int k = 0; k < dim; k++) s = s.add(data[i][k].multiply(other.data[k][j]));
                P[i][j] = s;
            }
        }
        return wrap(field, P);
    }

    /**
     * Matrix-vector product; component {@code i} is row {@code i} dotted with
     * {@code vector}.
     *
     * @throws DimensionMismatchException if the length is not {@link #dim()},
     *         or an entry is null or lies in another field
     */
    public AlgebraicInteger[] multiply(AlgebraicInteger[] vector) {
        Objects.requireNonNull(vector, "vector");
        if (vector.length != dim) {
            throw new DimensionMismatchException("Vector of length " + vector.length + " for a " + dim + "x" + dim + " matrix");
        }
        for (int k = 0; k < dim; k++) {
            if (vector[k] == null) throw new DimensionMismatchException("Null vector entry at " + k);
            if (!field.equals(vector[k].field())) {
                throw new DimensionMismatchException("Vector entry " + k + " lies in " + vector[k].field() + ", expected " + field);
            }
        }
        AlgebraicInteger[] out = new AlgebraicInteger[dim];
        for (int i = 0; i < dim; i++) {
            AlgebraicInteger s = field.zero();
            for (int k = 0; k < dim; k++) s = s.add(data[i][k].multiply(vector[k]));
            out[i] = s;
        }
        return out;
    }

    /**
     * True iff every diagonal entry is one and every other entry is zero.
     * Both triangles are checked, so this is valid for non-symmetric matrices.
     */
    public boolean isIdentity() {
        for (int i = 0; i < dim; i++) {
            for (int j = 0; j < dim; j++) {
                AlgebraicInteger a = data[i][j];
                if (i == j ? !a.equals(field.one()) : !a.isZero()) return false;
            }
        }
        return true;
    }

    public boolean isSymmetric() {
        for (int i = 0; i < dim; i++) {
            for (int j = 0; j < i; j++) {
                if (!data[i][j].equals(data[j][i])) return false;
            }
        }
        return true;
    }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Matrix)) return false;
        Matrix o = (Matrix) obj;
        return field.equals(o.field) && Arrays.deepEquals(data, o.data);
    }

    @Override public int hashCode() { return field.hashCode() * 31 + Arrays.deepHashCode(data); }

    /** One row per line, entries separated by {@code " | "}. */
    @Override public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < dim; i++) {
            if (i > 0) sb.append(System.lineSeparator());
            sb.append('[');
            for (int j = 0; j < dim; j++) {
                if (j > 0) sb.append(" | ");
                sb.append(data[i][j]);
            }
            sb.append(']');
        }
        return sb.toString();
    }
}
