package com.machine.signals.exception;

/**
 * A failure worth retrying, such as a connection reset in the middle of a statement.
 */
public class TransientStorageException extends SignalStorageException {

    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reason() {
        return "transient";
    }
}
