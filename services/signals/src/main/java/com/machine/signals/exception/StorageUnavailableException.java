package com.machine.signals.exception;

/**
 * The store cannot be reached. Fatal at startup, reported per operation afterwards.
 */
public class StorageUnavailableException extends SignalStorageException {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reason() {
        return "storage_unavailable";
    }
}
