package com.odelab.backend.ode;

public class UnsolvableEquationException extends RuntimeException {
    public UnsolvableEquationException(String message) {
        super(message);
    }
}
