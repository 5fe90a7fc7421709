package com.machine.common.exception;

/**
 * Raised when a signal type outside the closed set is requested.
 * This is a client input error, not a server fault.
 */
public class InvalidSignalTypeException extends IllegalArgumentException {

    private final String signalType;

    public InvalidSignalTypeException(String signalType) {
        super("Unknown signal type: " + signalType);
        this.signalType = signalType;
    }

    public String getSignalType() {
        return signalType;
    }
}
