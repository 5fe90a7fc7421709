package com.machine.signals.generator;

import com.machine.common.dto.SignalRecord;
import com.machine.signals.exception.BackpressureException;
import com.machine.signals.exception.ConstraintViolationException;
import com.machine.signals.exception.SignalStorageException;
import com.machine.signals.service.IngestionCoordinator;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every signal stream as its own self-rescheduling task.
 *
 * The executor has one thread per stream, so a slow insert on one stream never
 * delays the ticks of another. A tick schedules its successor only after it
 * finishes, so a stream never overlaps with itself. Failed submissions drop
 * that single tick and the loop carries on.
 */
@Slf4j
public class GeneratorScheduler {

    private final List<SignalStream> streams;
    private final IngestionCoordinator ingestionCoordinator;
    private final ScheduledThreadPoolExecutor executor;

    private volatile boolean running;

    public GeneratorScheduler(List<SignalStream> streams, IngestionCoordinator ingestionCoordinator) {
        this.streams = List.copyOf(streams);
        this.ingestionCoordinator = ingestionCoordinator;
        this.executor = new ScheduledThreadPoolExecutor(Math.max(1, this.streams.size()), generatorThreads());
        // Pending delayed ticks are discarded on shutdown; only a tick already running is drained.
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.executor.setRemoveOnCancelPolicy(true);
    }

    public void start() {
        running = true;
        for (SignalStream stream : streams) {
            log.info("Starting {} generator", stream.signalType());
            scheduleNext(stream);
        }
    }

    /**
     * Stops scheduling new ticks. A tick that is already running may finish.
     */
    public void stopScheduling() {
        running = false;
        executor.shutdown();
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return executor.awaitTermination(Math.max(0, timeout.toNanos()), TimeUnit.NANOSECONDS);
    }

    /**
     * Interrupts ticks still running after the grace period.
     */
    public int shutdownNow() {
        running = false;
        return executor.shutdownNow().size();
    }

    public boolean isRunning() {
        return running;
    }

    private void scheduleNext(SignalStream stream) {
        if (!running) {
            return;
        }
        try {
            executor.schedule(() -> tick(stream), stream.nextDelay().toNanos(), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("{} generator not rescheduled, scheduler is shutting down", stream.signalType());
        }
    }

    void tick(SignalStream stream) {
        if (!running) {
            return;
        }
        try {
            SignalRecord reading = stream.nextReading();
            long id = ingestionCoordinator.submit(reading);
            log.trace("Stored {} reading {} as id={}", reading.signalType(), reading.value(), id);
        } catch (BackpressureException e) {
            log.debug("Dropped {} tick: {}", stream.signalType(), e.getMessage());
        } catch (ConstraintViolationException e) {
            log.error("Bug: {} reading violates the signal table constraints", stream.signalType(), e);
        } catch (SignalStorageException e) {
            log.warn("Dropped {} tick ({}): {}", stream.signalType(), e.reason(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure in {} generator, tick dropped", stream.signalType(), e);
        } finally {
            scheduleNext(stream);
        }
    }

    private static ThreadFactory generatorThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "signal-generator-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
