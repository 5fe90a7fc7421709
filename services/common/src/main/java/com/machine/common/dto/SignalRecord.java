package com.machine.common.dto;

import com.machine.common.model.SignalType;

import java.time.Instant;
import java.util.Objects;

/**
 * One persisted telemetry reading.
 *
 * The id is null until the storage sink assigns it on insert.
 * The timestamp is taken at generation time, not insert time.
 */
public record SignalRecord(
    Long id,
    SignalType signalType,
    double value,
    Instant timestamp
) {
    public SignalRecord {
        Objects.requireNonNull(timestamp, "timestamp is required");
    }

    /**
     * A reading that has not been stored yet.
     */
    public static SignalRecord reading(SignalType signalType, double value, Instant timestamp) {
        return new SignalRecord(null, signalType, value, timestamp);
    }

    public SignalRecord withId(long assignedId) {
        return new SignalRecord(assignedId, signalType, value, timestamp);
    }
}
