package com.coxeter;

/** Minimal exact commutative-ring abstraction shared by polynomials and field elements. */
public interface Numeric<T extends Numeric<T>> {
    T add(T o);
    T subtract(T o);
    T multiply(T o);
    T negate();
    boolean isZero();
}
