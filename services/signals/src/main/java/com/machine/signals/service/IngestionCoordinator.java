package com.machine.signals.service;

import com.machine.common.dto.SignalRecord;
import com.machine.signals.config.SignalProperties;
import com.machine.signals.exception.SignalStorageException;
import com.machine.signals.exception.TransientStorageException;
import com.machine.signals.exception.WriteFailedException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

/**
 * Single entry point for generated readings on their way into the sink.
 *
 * Every caller gets the same policy: a bounded wait for a pooled connection
 * (dropped with backpressure when it runs out), a bounded number of retries
 * with exponential backoff for transient failures, nothing queued.
 */
@Service
@Slf4j
public class IngestionCoordinator {

    private final SignalSink signalSink;
    private final MeterRegistry meterRegistry;
    private final RetryBackoffSpec retrySpec;

    // Metrics
    private final Counter signalsReceived;
    private final Counter signalsPersisted;
    private final Timer insertLatency;

    public IngestionCoordinator(SignalSink signalSink, SignalProperties properties, MeterRegistry meterRegistry) {
        this.signalSink = signalSink;
        this.meterRegistry = meterRegistry;

        SignalProperties.Ingestion ingestion = properties.getIngestion();
        this.retrySpec = Retry.backoff(ingestion.getMaxAttempts() - 1L, ingestion.getMinBackoff())
                .maxBackoff(ingestion.getMaxBackoff())
                .filter(TransientStorageException.class::isInstance)
                .doBeforeRetry(retry -> log.debug("Retrying insert (attempt {}): {}",
                        retry.totalRetries() + 2, retry.failure().getMessage()))
                .onRetryExhaustedThrow((spec, retry) ->
                        new WriteFailedException(retry.totalRetries() + 1, retry.failure()));

        this.signalsReceived = Counter.builder("ingestion.signals.received")
                .description("Number of generated readings submitted for storage")
                .register(meterRegistry);

        this.signalsPersisted = Counter.builder("ingestion.signals.persisted")
                .description("Number of readings stored")
                .register(meterRegistry);

        this.insertLatency = Timer.builder("ingestion.insert.latency")
                .description("Time taken to store one reading, retries included")
                .register(meterRegistry);
    }

    /**
     * Stores one reading and returns its id.
     *
     * @throws com.machine.signals.exception.BackpressureException when no connection became free in time
     * @throws WriteFailedException when transient failures outlasted the retry budget
     * @throws com.machine.signals.exception.StorageUnavailableException when the store cannot be reached
     */
    public long submit(SignalRecord record) {
        signalsReceived.increment();
        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            Long id = Mono.fromCallable(() -> signalSink.insert(record))
                    .retryWhen(retrySpec)
                    .block();
            signalsPersisted.increment();
            return id;
        } catch (SignalStorageException e) {
            countDropped(record, e);
            throw e;
        } finally {
            sample.stop(insertLatency);
        }
    }

    private void countDropped(SignalRecord record, SignalStorageException failure) {
        Counter.builder("ingestion.signals.dropped")
                .description("Number of readings dropped instead of stored")
                .tag("signal_type", String.valueOf(record.signalType()))
                .tag("reason", failure.reason())
                .register(meterRegistry)
                .increment();
    }
}
