package com.machine.signals.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Error body returned by the signal endpoints. Fields that do not apply to a
 * failure are left out of the JSON.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    int status;

    String error;

    String message;

    String path;

    @Builder.Default
    Instant timestamp = Instant.now();

    /**
     * Storage failure category, e.g. {@code backpressure} or {@code storage_unavailable}.
     */
    String reason;

    @JsonProperty("supported_types")
    List<String> supportedTypes;
}
