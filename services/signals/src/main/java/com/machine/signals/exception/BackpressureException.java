package com.machine.signals.exception;

/**
 * No pooled connection became free within the acquisition timeout.
 */
public class BackpressureException extends SignalStorageException {

    public BackpressureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reason() {
        return "backpressure";
    }
}
