package com.coxeter;

/** Small integer helpers used to pick the cyclotomic index. */
public final class Integers {

    private Integers(){}

    /** Non-negative greatest common divisor; gcd(0, 0) = 0. */
    public static int gcd(int a, int b) {
        a = Math.abs(a);
        b = Math.abs(b);
        while (b != 0) {
            int t = a % b;
            a = b;
            b = t;
        }
        return a;
    }

    /**
     * Least common multiple of two positive integers.
     *
     * @throws IllegalArgumentException if either argument is not positive
     * @throws ArithmeticException if the result does not fit in an int
     */
    public static int lcm(int a, int b) {
        if (a <= 0 || b <= 0) throw new IllegalArgumentException("lcm needs positive arguments, got " + a + ", " + b);
        return Math.multiplyExact(a / gcd(a, b), b);
    }

    /** Euler's totient, the degree of the m-th cyclotomic polynomial. */
    public static int totient(int m) {
        if (m <= 0) throw new IllegalArgumentException("totient needs a positive argument, got " + m);
        int result = m;
        int n = m;
        for (int p = 2; (long) p * p <= n; p++) {
            if (n % p == 0) {
                while (n % p == 0) n /= p;
                result -= result / p;
            }
        }
        if (n > 1) result -= result / n;
        return result;
    }
}
