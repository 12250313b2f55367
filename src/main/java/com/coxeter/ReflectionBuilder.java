package com.coxeter;

import java.util.ArrayList;
import java.util.List;

/**
 * Matrices of the simple reflections acting on the simple-root basis.
 * Entry (i, j) of the matrix for r_k is the coefficient of a_i in
 * r_k(a_j) = a_j - C[k][j] a_k.
 */
public final class ReflectionBuilder {

    private ReflectionBuilder(){}

    /**
     * The reflection r_k over the Cartan matrix's own field.
     *
     * @throws IndexOutOfBoundsException unless {@code 0 <= k < cartan.dim()}
     */
    public static Matrix reflectionMatrix(Matrix cartan, int k) {
        int dim = cartan.dim();
        if (k < 0 || k >= dim) {
            throw new IndexOutOfBoundsException("Generator " + k + " outside 0.." + (dim - 1));
        }
        CyclotomicField field = cartan.field();
        AlgebraicInteger zero = field.zero();
        AlgebraicInteger one = field.one();

        AlgebraicInteger[][] R = new AlgebraicInteger[dim][dim];
        for (int j = 0; j < dim; j++) {
            for (int i = 0; i < dim; i++) {
                if (j == k) {
                    R[i][j] = i == k ? one.negate() : zero;
                } else if (i == j) {
                    R[i][j] = one;
                } else if (i == k) {
                    R[i][j] = cartan.get(k, j).negate();
                } else {
                    R[i][j] = zero;
                }
            }
        }
        return new Matrix(field, R);
    }

    /** r_0, ..., r_(dim-1) in generator order. */
    public static List<Matrix> reflectionMatrices(Matrix cartan) {
        List<Matrix> out = new ArrayList<>(cartan.dim());
        for (int k = 0; k < cartan.dim(); k++) out.add(reflectionMatrix(cartan, k));
        return out;
    }
}
