package com.machine.signals.exception;

/**
 * An insert kept failing transiently until the retry budget ran out.
 */
public class WriteFailedException extends SignalStorageException {

    private final long attempts;

    public WriteFailedException(long attempts, Throwable cause) {
        super("Insert failed after " + attempts + " attempts: " + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.attempts = attempts;
    }

    public long getAttempts() {
        return attempts;
    }

    @Override
    public String reason() {
        return "write_failed";
    }
}
