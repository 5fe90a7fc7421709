package com.machine.signals.lifecycle;

import com.machine.signals.config.SignalProperties;
import com.machine.signals.exception.StorageUnavailableException;
import com.machine.signals.generator.GeneratorScheduler;
import com.machine.signals.service.StorageHealthMonitor;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.time.Duration;

/**
 * Owns the service lifecycle.
 *
 * <ul>
 *   <li>{@code STARTING}: storage must answer a health probe, otherwise startup fails.</li>
 *   <li>{@code READY}: generators tick and requests are admitted.</li>
 *   <li>{@code DRAINING}: entered when the context starts closing. No new ticks are
 *       scheduled and new requests are turned away; in-flight work gets the grace period.</li>
 *   <li>{@code STOPPED}: the drain is over and the pool can be closed.</li>
 * </ul>
 *
 * Runs in phase 0, so it starts before the web server accepts requests and
 * stops after the web server's own graceful shutdown.
 */
@Component
@Slf4j
public class ShutdownCoordinator implements SmartLifecycle {

    private final GeneratorScheduler generatorScheduler;
    private final StorageHealthMonitor healthMonitor;
    private final DataSource dataSource;
    private final boolean generatorsEnabled;
    private final Duration gracePeriod;

    private final Object monitor = new Object();
    private LifecycleState state = LifecycleState.STARTING;
    private int inFlightRequests;
    private long drainDeadlineNanos;
    private volatile boolean drainedCleanly = true;

    public ShutdownCoordinator(GeneratorScheduler generatorScheduler,
                               StorageHealthMonitor healthMonitor,
                               DataSource dataSource,
                               SignalProperties properties) {
        this.generatorScheduler = generatorScheduler;
        this.healthMonitor = healthMonitor;
        this.dataSource = dataSource;
        this.generatorsEnabled = properties.getGenerator().isEnabled();
        this.gracePeriod = properties.getShutdown().getGracePeriod();
    }

    @Override
    public void start() {
        log.info("Starting: checking that signal storage is reachable");
        Health health = healthMonitor.health();
        if (!Status.UP.equals(health.getStatus())) {
            throw new StorageUnavailableException("Signal storage is unreachable at startup: " + health.getDetails());
        }

        if (generatorsEnabled) {
            generatorScheduler.start();
        } else {
            log.info("Signal generators are disabled");
        }

        synchronized (monitor) {
            state = LifecycleState.READY;
        }
        log.info("Ready");
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        beginDraining();
    }

    /**
     * Moves from READY to DRAINING. Idempotent.
     */
    public void beginDraining() {
        synchronized (monitor) {
            if (state != LifecycleState.READY) {
                return;
            }
            state = LifecycleState.DRAINING;
            drainDeadlineNanos = System.nanoTime() + gracePeriod.toNanos();
        }
        log.info("Draining: no new ticks or requests, grace period {}", gracePeriod);
        generatorScheduler.stopScheduling();
    }

    /**
     * Admits a request while READY. Every admitted request must be released
     * with {@link #exitRequest()}.
     */
    public boolean tryEnterRequest() {
        synchronized (monitor) {
            if (state != LifecycleState.READY) {
                return false;
            }
            inFlightRequests++;
            return true;
        }
    }

    public void exitRequest() {
        synchronized (monitor) {
            inFlightRequests--;
            if (inFlightRequests == 0) {
                monitor.notifyAll();
            }
        }
    }

    @Override
    public void stop() {
        beginDraining();

        boolean requestsDrained;
        boolean ticksDrained;
        try {
            requestsDrained = awaitInFlightRequests();
            ticksDrained = generatorScheduler.awaitTermination(remainingGrace());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            requestsDrained = false;
            ticksDrained = false;
        }

        if (!ticksDrained) {
            int abandoned = generatorScheduler.shutdownNow();
            log.warn("Grace period exceeded, interrupted generator ticks ({} pending discarded)", abandoned);
        }
        if (!requestsDrained) {
            log.warn("Grace period exceeded with {} requests still in flight", inFlightRequests());
        }
        drainedCleanly = requestsDrained && ticksDrained;

        int active = activeConnections();
        if (active > 0) {
            log.warn("{} pooled connections still in use at shutdown", active);
        } else if (active == 0) {
            log.info("All pooled connections returned");
        }

        synchronized (monitor) {
            state = LifecycleState.STOPPED;
        }
        log.info("Stopped ({})", drainedCleanly ? "drained within grace period" : "work abandoned");
    }

    @Override
    public boolean isRunning() {
        synchronized (monitor) {
            return state == LifecycleState.READY || state == LifecycleState.DRAINING;
        }
    }

    @Override
    public int getPhase() {
        return 0;
    }

    public LifecycleState getState() {
        synchronized (monitor) {
            return state;
        }
    }

    public int inFlightRequests() {
        synchronized (monitor) {
            return inFlightRequests;
        }
    }

    /**
     * Process exit code after shutdown: 0 when the drain finished within the grace period.
     */
    public int exitCode() {
        return drainedCleanly ? 0 : 1;
    }

    /**
     * Connections currently borrowed from the pool, or -1 when the pool does not report it.
     */
    public int activeConnections() {
        if (dataSource instanceof HikariDataSource hikari) {
            HikariPoolMXBean pool = hikari.getHikariPoolMXBean();
            if (pool != null) {
                return pool.getActiveConnections();
            }
        }
        return -1;
    }

    private boolean awaitInFlightRequests() throws InterruptedException {
        synchronized (monitor) {
            while (inFlightRequests > 0) {
                long remaining = drainDeadlineNanos - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                // wait(millis) treats 0 as forever
                monitor.wait(Math.max(1, Duration.ofNanos(remaining).toMillis()));
            }
            return true;
        }
    }

    private Duration remainingGrace() {
        synchronized (monitor) {
            return Duration.ofNanos(Math.max(0, drainDeadlineNanos - System.nanoTime()));
        }
    }
}
