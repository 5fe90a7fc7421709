package com.machine.common.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.machine.common.model.SignalType;

import java.time.Instant;

/**
 * Wire shape of a signal served by the read API.
 *
 * Example JSON:
 * {
 *   "id": 42,
 *   "signal_type": "power",
 *   "value": 312.7,
 *   "timestamp": "2024-01-15T10:30:00.010Z"
 * }
 */
public record SignalResponse(
    @JsonProperty("id")
    Long id,

    @JsonProperty("signal_type")
    SignalType signalType,

    @JsonProperty("value")
    double value,

    @JsonProperty("timestamp")
    Instant timestamp
) {
    public static SignalResponse from(SignalRecord record) {
        return new SignalResponse(
            record.id(),
            record.signalType(),
            record.value(),
            record.timestamp()
        );
    }
}
