package com.coxeter;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable polynomial with {@link BigInteger} coefficients.  Coefficient
 * {@code p} is the coefficient of {@code x^p}; trailing zeros are trimmed so
 * the zero polynomial has no coefficients and degree -1.
 */
public final class IntPolynomial implements Numeric<IntPolynomial> {
    public static final IntPolynomial ZERO = new IntPolynomial(new BigInteger[0]);

    // memo for cyclotomic(m); guarded by its own monitor
    private static final Map<Integer, IntPolynomial> CYCLOTOMIC = new HashMap<>();

    private final BigInteger[] c;      // c[p] = coefficient of x^p, c[last] != 0

    private IntPolynomial(BigInteger[] coefficients) {
        int len = coefficients.length;
        while (len > 0 && coefficients[len - 1].signum() == 0) len--;
        this.c = len == coefficients.length ? coefficients : Arrays.copyOf(coefficients, len);
    }

    /** Factories */
    public static IntPolynomial of(long... coefficients) {
        BigInteger[] b = new BigInteger[coefficients.length];
        for (int i = 0; i < b.length; i++) b[i] = BigInteger.valueOf(coefficients[i]);
        return new IntPolynomial(b);
    }

    public static IntPolynomial of(BigInteger... coefficients) {
        BigInteger[] b = coefficients.clone();
        for (int i = 0; i < b.length; i++) Objects.requireNonNull(b[i], "coefficient " + i);
        return new IntPolynomial(b);
    }

    /** x^n + k */
    public static IntPolynomial monomialPlus(int n, long k) {
        if (n < 0) throw new IllegalArgumentException("Negative exponent: " + n);
        BigInteger[] b = new BigInteger[n + 1];
        Arrays.fill(b, BigInteger.ZERO);
        b[n] = BigInteger.ONE;
        b[0] = b[0].add(BigInteger.valueOf(k));
        return new IntPolynomial(b);
    }

    /**
     * The m-th cyclotomic polynomial: monic, irreducible over the integers,
     * of degree phi(m), whose roots are exactly the primitive m-th roots of
     * unity.  Built from x^m - 1 = prod_{d | m} Phi_d and memoised.
     */
    public static IntPolynomial cyclotomic(int m) {
        if (m <= 0) throw new IllegalArgumentException("Cyclotomic index must be positive, got " + m);
        synchronized (CYCLOTOMIC) {
            IntPolynomial cached = CYCLOTOMIC.get(m);
            if (cached != null) return cached;
        }
        IntPolynomial phi = monomialPlus(m, -1);
        for (int d = 1; d < m; d++) {
            if (m % d == 0) phi = phi.divideExact(cyclotomic(d));
        }
        synchronized (CYCLOTOMIC) {
            IntPolynomial prev = CYCLOTOMIC.putIfAbsent(m, phi);
            return prev != null ? prev : phi;
        }
    }

    public int degree() { return c.length - 1; }

    /** Coefficient of x^p, zero beyond the degree. */
    public BigInteger coefficient(int p) {
        if (p < 0) throw new IndexOutOfBoundsException("Negative exponent: " + p);
        return p < c.length ? c[p] : BigInteger.ZERO;
    }

    public BigInteger leadingCoefficient() { return c.length == 0 ? BigInteger.ZERO : c[c.length - 1]; }

    public boolean isMonic() { return leadingCoefficient().equals(BigInteger.ONE); }

    // ---- Numeric ----

    @Override public IntPolynomial add(IntPolynomial o) {
        BigInteger[] r = new BigInteger[Math.max(c.length, o.c.length)];
        for (int i = 0; i < r.length; i++) r[i] = coefficient(i).add(o.coefficient(i));
        return new IntPolynomial(r);
    }

    @Override public IntPolynomial subtract(IntPolynomial o) {
        return add(o.negate());
    }

    @Override public IntPolynomial multiply(IntPolynomial o) {
        if (isZero() || o.isZero()) return ZERO;
        BigInteger[] r = new BigInteger[c.length + o.c.length - 1];
        Arrays.fill(r, BigInteger.ZERO);
        for (int i = 0; i < c.length; i++) {
            if (c[i].signum() == 0) continue;
            for (int j = 0; j < o.c.length; j++) {
                r[i + j] = r[i + j].add(c[i].multiply(o.c[j]));
            }
        }
        return new IntPolynomial(r);
    }

    @Override public IntPolynomial negate() {
        BigInteger[] r = new BigInteger[c.length];
        for (int i = 0; i < r.length; i++) r[i] = c[i].negate();
        return new IntPolynomial(r);
    }

    @Override public boolean isZero() { return c.length == 0; }

    // ---- division by monic polynomials ----

    /** Quotient of an exact division; throws if the remainder is nonzero. */
    public IntPolynomial divideExact(IntPolynomial monic) {
        BigInteger[][] qr = longDivision(monic);
        if (!new IntPolynomial(qr[1]).isZero()) {
            throw new ArithmeticException("(" + this + ") is not divisible by (" + monic + ")");
        }
        return new IntPolynomial(qr[0]);
    }

    /** Remainder modulo a monic polynomial; degree is below the divisor's. */
    public IntPolynomial remainder(IntPolynomial monic) {
        return new IntPolynomial(longDivision(monic)[1]);
    }

    /**
     * Reduces a raw coefficient vector modulo {@code monic}; the result has
     * exactly {@code monic.degree()} entries.  {@code raw} is not modified.
     */
    static BigInteger[] reduce(BigInteger[] raw, IntPolynomial monic) {
        requireMonic(monic);
        int n = monic.degree();
        BigInteger[] r = Arrays.copyOf(raw, Math.max(raw.length, n));
        for (int i = raw.length; i < r.length; i++) r[i] = BigInteger.ZERO;
        // x^k = x^(k-n) * x^n and x^n = -(b_0 + ... + b_{n-1} x^(n-1))
        for (int k = r.length - 1; k >= n; k--) {
            BigInteger t = r[k];
            if (t.signum() == 0) continue;
            for (int i = 0; i < n; i++) {
                r[k - n + i] = r[k - n + i].subtract(t.multiply(monic.c[i]));
            }
            r[k] = BigInteger.ZERO;
        }
        return Arrays.copyOf(r, n);
    }

    private BigInteger[][] longDivision(IntPolynomial monic) {
        requireMonic(monic);
        int n = monic.degree();
        if (c.length <= n) return new BigInteger[][]{ new BigInteger[0], c.clone() };
        BigInteger[] r = c.clone();
        BigInteger[] q = new BigInteger[c.length - n];
        Arrays.fill(q, BigInteger.ZERO);
        for (int k = r.length - 1; k >= n; k--) {
            BigInteger t = r[k];
            if (t.signum() == 0) continue;
            q[k - n] = t;
            for (int i = 0; i <= n; i++) {
                r[k - n + i] = r[k - n + i].subtract(t.multiply(monic.c[i]));
            }
        }
        return new BigInteger[][]{ q, Arrays.copyOf(r, n) };
    }

    private static void requireMonic(IntPolynomial p) {
        Objects.requireNonNull(p, "divisor");
        if (!p.isMonic()) throw new IllegalArgumentException("Divisor must be monic: " + p);
    }

    // ---- Object ----
    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof IntPolynomial)) return false;
        return Arrays.equals(c, ((IntPolynomial) obj).c);
    }

    @Override public int hashCode() { return Arrays.hashCode(c); }

    @Override public String toString() { return toString("x"); }

    /** Ascending powers, e.g. {@code 1 - x^2 + x^4}. */
    public String toString(String var) {
        return format(c, var);
    }

    static String format(BigInteger[] coeffs, String var) {
        StringBuilder sb = new StringBuilder();
        for (int p = 0; p < coeffs.length; p++) {
            BigInteger a = coeffs[p];
            if (a.signum() == 0) continue;
            if (sb.length() == 0) {
                if (a.signum() < 0) sb.append('-');
            } else {
                sb.append(a.signum() < 0 ? " - " : " + ");
            }
            BigInteger abs = a.abs();
            if (p == 0 || !abs.equals(BigInteger.ONE)) sb.append(abs);
            if (p > 0) sb.append(var);
            if (p > 1) sb.append('^').append(p);
        }
        return sb.length() == 0 ? "0" : sb.toString();
    }
}
