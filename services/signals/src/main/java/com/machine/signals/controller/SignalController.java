package com.machine.signals.controller;

import com.machine.common.dto.SignalResponse;
import com.machine.signals.service.SignalQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Endpoints:
 * - GET /signals/{signal_type} - the ten most recent readings of one type, newest first
 */
@RestController
@RequestMapping("/signals")
@RequiredArgsConstructor
@Tag(name = "Signals", description = "Recent machine telemetry readings")
public class SignalController {

    private final SignalQueryService signalQueryService;

    @GetMapping(path = "/{signal_type}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get recent signals",
            description = "Up to ten most recent readings of state_change, error or power")
    public ResponseEntity<List<SignalResponse>> getRecentSignals(
            @PathVariable("signal_type") String signalType) {
        return ResponseEntity.ok(signalQueryService.getRecentSignals(signalType));
    }
}
