package com.coxeter;

/**
 * Raised when a matrix is applied to a vector of the wrong length, or to a
 * vector holding missing entries or entries of another field.
 */
public class DimensionMismatchException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public DimensionMismatchException(String message) {
        super(message);
    }
}
