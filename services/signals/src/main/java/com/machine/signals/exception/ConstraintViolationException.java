package com.machine.signals.exception;

/**
 * The store rejected a row. Readings are built from the closed set of signal
 * types, so seeing this means a bug in the producing code.
 */
public class ConstraintViolationException extends SignalStorageException {

    public ConstraintViolationException(String message) {
        super(message);
    }

    public ConstraintViolationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reason() {
        return "constraint_violation";
    }
}
