package com.machine.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.machine.common.exception.InvalidSignalTypeException;

/**
 * The closed set of telemetry streams a machine emits.
 * Each type has exactly one producing task.
 */
public enum SignalType {
    STATE_CHANGE("state_change"),
    ERROR("error"),
    POWER("power");

    private final String value;

    SignalType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SignalType fromValue(String value) {
        for (SignalType type : SignalType.values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new InvalidSignalTypeException(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
