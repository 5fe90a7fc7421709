package com.machine.signals.controller;

import com.machine.signals.dto.HealthResponse;
import com.machine.signals.service.StorageHealthMonitor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Health", description = "Service liveness")
public class HealthController {

    private final StorageHealthMonitor storageHealthMonitor;

    @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Health check", description = "Reports whether signal storage is reachable")
    public ResponseEntity<HealthResponse> health() {
        Health health = storageHealthMonitor.health();
        if (Status.UP.equals(health.getStatus())) {
            return ResponseEntity.ok(HealthResponse.up());
        }

        Object error = health.getDetails().getOrDefault("error", "unknown");
        log.warn("Health check failed: {}", error);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(HealthResponse.down(String.valueOf(error)));
    }
}
