package com.coxeter;

import java.math.BigInteger;

/**
 * The ring of integers of the m-th cyclotomic field, Z[z] with z a primitive
 * m-th root of unity.  Two fields are equal iff their indices and defining
 * polynomials are equal; elements of unequal fields never mix.
 */
public final class CyclotomicField {
    private final int index;
    private final IntPolynomial base;  // Phi_index, monic of degree phi(index)
    private final AlgebraicInteger zero;
    private final AlgebraicInteger one;

    private CyclotomicField(int index) {
        this.index = index;
        this.base = IntPolynomial.cyclotomic(index);
        this.zero = AlgebraicInteger.of(this, BigInteger.ZERO);
        this.one = AlgebraicInteger.of(this, BigInteger.ONE);
    }

    public static CyclotomicField of(int index) {
        if (index <= 0) throw new IllegalArgumentException("Cyclotomic index must be positive, got " + index);
        return new CyclotomicField(index);
    }

    public int index() { return index; }
    public IntPolynomial polynomial() { return base; }
    public int degree() { return base.degree(); }

    public AlgebraicInteger zero() { return zero; }
    public AlgebraicInteger one() { return one; }

    /** The rational integer {@code k} lifted into the field. */
    public AlgebraicInteger element(long k) { return AlgebraicInteger.of(this, BigInteger.valueOf(k)); }

    /**
     * The element sum_p v[p] z^p.  {@code v} may have any length: a raw
     * vector indexed by powers of the primitive root (length m) as well as
     * an already reduced one (length {@link #degree()}).
     */
    public AlgebraicInteger element(int... v) {
        BigInteger[] raw = new BigInteger[v.length];
        for (int i = 0; i < v.length; i++) raw[i] = BigInteger.valueOf(v[i]);
        return AlgebraicInteger.of(this, raw);
    }

    /** z^p, the primitive root raised to {@code p} (any integer exponent). */
    public AlgebraicInteger rootPower(int p) {
        int e = Math.floorMod(p, index);
        int[] raw = new int[e + 1];
        raw[e] = 1;
        return element(raw);
    }

    /** Throws unless {@code other} is this field. */
    void requireSame(CyclotomicField other, String what) {
        if (!equals(other)) {
            throw new IncompatibleFieldException(what + ": field " + other + " differs from " + this);
        }
    }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CyclotomicField)) return false;
        CyclotomicField o = (CyclotomicField) obj;
        return index == o.index && base.equals(o.base);
    }

    // equal indices imply equal polynomials
    @Override public int hashCode() { return Integer.hashCode(index); }

    @Override public String toString() { return "Q(zeta_" + index + ")"; }
}
