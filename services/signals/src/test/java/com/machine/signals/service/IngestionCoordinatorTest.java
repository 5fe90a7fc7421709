package com.machine.signals.service;

import com.machine.common.dto.SignalRecord;
import com.machine.common.model.SignalType;
import com.machine.signals.config.SignalProperties;
import com.machine.signals.exception.BackpressureException;
import com.machine.signals.exception.StorageUnavailableException;
import com.machine.signals.exception.TransientStorageException;
import com.machine.signals.exception.WriteFailedException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IngestionCoordinatorTest {

    private final SignalRecord reading = SignalRecord.reading(SignalType.POWER, 250.0, Instant.parse("2024-01-15T10:30:00Z"));

    private SignalSink signalSink;
    private SimpleMeterRegistry meterRegistry;
    private IngestionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        signalSink = mock(SignalSink.class);
        meterRegistry = new SimpleMeterRegistry();

        SignalProperties properties = new SignalProperties();
        properties.getIngestion().setMaxAttempts(3);
        properties.getIngestion().setMinBackoff(Duration.ofMillis(1));
        properties.getIngestion().setMaxBackoff(Duration.ofMillis(5));

        coordinator = new IngestionCoordinator(signalSink, properties, meterRegistry);
    }

    @Test
    void shouldReturnIdAssignedBySink() {
        when(signalSink.insert(reading)).thenReturn(17L);

        assertThat(coordinator.submit(reading)).isEqualTo(17L);
        assertThat(meterRegistry.counter("ingestion.signals.persisted").count()).isEqualTo(1.0);
    }

    @Test
    void shouldRetryTransientFailuresUntilInsertSucceeds() {
        when(signalSink.insert(any()))
                .thenThrow(new TransientStorageException("connection reset", null))
                .thenReturn(5L);

        assertThat(coordinator.submit(reading)).isEqualTo(5L);
        verify(signalSink, times(2)).insert(reading);
    }

    @Test
    void shouldFailWithWriteFailedOnceRetriesAreExhausted() {
        when(signalSink.insert(any())).thenThrow(new TransientStorageException("connection reset", null));

        assertThatThrownBy(() -> coordinator.submit(reading))
                .isInstanceOf(WriteFailedException.class)
                .satisfies(e -> assertThat(((WriteFailedException) e).getAttempts()).isEqualTo(3))
                .hasCauseInstanceOf(TransientStorageException.class);

        verify(signalSink, times(3)).insert(reading);
        assertThat(meterRegistry.counter("ingestion.signals.dropped",
                "signal_type", "power", "reason", "write_failed").count()).isEqualTo(1.0);
    }

    @Test
    void shouldDropOnBackpressureWithoutRetrying() {
        when(signalSink.insert(any())).thenThrow(new BackpressureException("pool exhausted", null));

        assertThatThrownBy(() -> coordinator.submit(reading)).isInstanceOf(BackpressureException.class);

        verify(signalSink, times(1)).insert(reading);
        assertThat(meterRegistry.counter("ingestion.signals.dropped",
                "signal_type", "power", "reason", "backpressure").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("ingestion.signals.persisted").count()).isZero();
    }

    @Test
    void shouldNotRetryWhenStorageIsUnavailable() {
        when(signalSink.insert(any())).thenThrow(new StorageUnavailableException("connection refused"));

        assertThatThrownBy(() -> coordinator.submit(reading)).isInstanceOf(StorageUnavailableException.class);

        verify(signalSink, times(1)).insert(reading);
    }

    @Test
    void shouldCountEverySubmission() {
        when(signalSink.insert(any()))
                .thenReturn(1L)
                .thenThrow(new BackpressureException("pool exhausted", null));

        coordinator.submit(reading);
        assertThatThrownBy(() -> coordinator.submit(reading)).isInstanceOf(BackpressureException.class);

        assertThat(meterRegistry.counter("ingestion.signals.received").count()).isEqualTo(2.0);
        assertThat(meterRegistry.timer("ingestion.insert.latency").count()).isEqualTo(2);
    }
}
