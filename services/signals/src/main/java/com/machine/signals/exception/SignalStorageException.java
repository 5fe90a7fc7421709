package com.machine.signals.exception;

/**
 * Base type for failures of the signal storage path.
 * The reason is used as a metric tag when a reading is dropped.
 */
public abstract class SignalStorageException extends RuntimeException {

    protected SignalStorageException(String message) {
        super(message);
    }

    protected SignalStorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String reason();
}
