package com.machine.signals.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
    @JsonProperty("status")
    String status,

    @JsonProperty("error")
    String error
) {
    public static HealthResponse up() {
        return new HealthResponse("Service is up and running", null);
    }

    public static HealthResponse down(String error) {
        return new HealthResponse("Storage is unreachable", error);
    }
}
