package com.coxeter;

/**
 * Builds the Cartan matrix of a Coxeter system with exact entries.
 *
 * For a pair of generators of finite order m_ij the entry is
 * -(z + 1/z) with z a primitive (2 m_ij)-th root of unity, i.e.
 * -2 cos(pi / m_ij); pairs of infinite order get -2; the diagonal is 2.
 * All entries are placed in the smallest cyclotomic field containing
 * every such z.
 */
public final class CartanBuilder {

    private CartanBuilder(){}

    /**
     * lcm of 2 and every finite 2 m_ij.  Entries of the Cartan matrix live
     * in the field of this index, whose degree phi(m) fixes the length of
     * every coefficient vector.  m grows with the lcm of the orders, e.g.
     * orders 3, 5, 7, 11 already give m = 2310 and degree 480.
     *
     * @throws ArithmeticException if some 2 m_ij or the index overflows an int
     */
    public static int minimalIndex(CoxeterMatrix coxeter) {
        int m = 2;
        for (int i = 0; i < coxeter.dim(); i++) {
            for (int j = 0; j < i; j++) {
                if (coxeter.isFinite(i, j)) m = Integers.lcm(m, Math.multiplyExact(2, coxeter.order(i, j)));
            }
        }
        return m;
    }

    /** Validates {@code entries} as a Coxeter matrix first. */
    public static Matrix cartanMatrix(int[][] entries) {
        return cartanMatrix(CoxeterMatrix.of(entries));
    }

    public static Matrix cartanMatrix(CoxeterMatrix coxeter) {
        int m = minimalIndex(coxeter);
        CyclotomicField field = CyclotomicField.of(m);
        int dim = coxeter.dim();

        AlgebraicInteger[][] C = new AlgebraicInteger[dim][dim];
        AlgebraicInteger two = field.element(2);
        AlgebraicInteger minusTwo = field.element(-2);
        for (int i = 0; i < dim; i++) {
            C[i][i] = two;
            for (int j = 0; j < i; j++) {
                AlgebraicInteger a = coxeter.isFinite(i, j) ? minusRootPair(field, Math.multiplyExact(2, coxeter.order(i, j))) : minusTwo;
                C[i][j] = a;
                C[j][i] = a;
            }
        }
        return new Matrix(field, C);
    }

    /** -(z_k + z_k^-1) in the m-th field, using z_k = z_m^(m/k). */
    private static AlgebraicInteger minusRootPair(CyclotomicField field, int k) {
        int m = field.index();
        int[] z = new int[m];
        z[m / k] = -1;
        z[m - m / k] = -1;
        return field.element(z);
    }
}
