package com.coxeter;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable algebraic integer of a {@link CyclotomicField}, stored as its
 * coefficients in the power basis 1, z, ..., z^(n-1) where n is the field
 * degree.  Since the basis is reduced modulo the minimal polynomial, two
 * elements are equal iff their coefficient vectors are.
 */
public final class AlgebraicInteger implements Numeric<AlgebraicInteger> {
    private final CyclotomicField field;
    private final BigInteger[] c;      // length == field.degree()

    private AlgebraicInteger(CyclotomicField field, BigInteger[] reduced) {
        this.field = field;
        this.c = reduced;
    }

    static AlgebraicInteger of(CyclotomicField field, BigInteger k) {
        Objects.requireNonNull(k, "value");
        return of(field, new BigInteger[]{ k });
    }

    static AlgebraicInteger of(CyclotomicField field, BigInteger[] raw) {
        Objects.requireNonNull(field, "field");
        for (int i = 0; i < raw.length; i++) Objects.requireNonNull(raw[i], "coefficient " + i);
        return new AlgebraicInteger(field, IntPolynomial.reduce(raw, field.polynomial()));
    }

    public CyclotomicField field() { return field; }

    /** Coefficient of z^p in the reduced representation. */
    public BigInteger coefficient(int p) { return c[p]; }

    /** True when every coefficient except the constant one vanishes. */
    public boolean isRationalInteger() {
        for (int i = 1; i < c.length; i++) if (c[i].signum() != 0) return false;
        return true;
    }

    /**
     * The constant coefficient.  It equals the element's value only when
     * {@link #isRationalInteger()} holds.
     */
    public BigInteger rationalPart() { return c[0]; }

    // ---- Numeric ----

    @Override public AlgebraicInteger add(AlgebraicInteger o) {
        field.requireSame(o.field, "add");
        BigInteger[] r = new BigInteger[c.length];
        for (int i = 0; i < r.length; i++) r[i] = c[i].add(o.c[i]);
        return new AlgebraicInteger(field, r);
    }

    @Override public AlgebraicInteger subtract(AlgebraicInteger o) {
        field.requireSame(o.field, "subtract");
        BigInteger[] r = new BigInteger[c.length];
        for (int i = 0; i < r.length; i++) r[i] = c[i].subtract(o.c[i]);
        return new AlgebraicInteger(field, r);
    }

    @Override public AlgebraicInteger multiply(AlgebraicInteger o) {
        field.requireSame(o.field, "multiply");
        BigInteger[] raw = new BigInteger[2 * c.length - 1];
        Arrays.fill(raw, BigInteger.ZERO);
        for (int i = 0; i < c.length; i++) {
            if (c[i].signum() == 0) continue;
            for (int j = 0; j < c.length; j++) {
                raw[i + j] = raw[i + j].add(c[i].multiply(o.c[j]));
            }
        }
        return new AlgebraicInteger(field, IntPolynomial.reduce(raw, field.polynomial()));
    }

    @Override public AlgebraicInteger negate() {
        BigInteger[] r = new BigInteger[c.length];
        for (int i = 0; i < r.length; i++) r[i] = c[i].negate();
        return new AlgebraicInteger(field, r);
    }

    @Override public boolean isZero() {
        for (BigInteger x : c) if (x.signum() != 0) return false;
        return true;
    }

    // ---- Object ----
    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AlgebraicInteger)) return false;
        AlgebraicInteger o = (AlgebraicInteger) obj;
        return field.equals(o.field) && Arrays.equals(c, o.c);
    }

    @Override public int hashCode() { return field.hashCode() * 31 + Arrays.hashCode(c); }

    /** Polynomial in z, e.g. {@code -1 + z^2}; rational integers print as integers. */
    @Override public String toString() { return IntPolynomial.format(c, "z"); }
}
