package com.coxeter;

/** Raised when values over different cyclotomic fields are combined. */
public class IncompatibleFieldException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public IncompatibleFieldException(String message) {
        super(message);
    }
}
