package com.machine.signals.lifecycle;

import com.machine.signals.config.SignalProperties;
import com.machine.signals.exception.StorageUnavailableException;
import com.machine.signals.generator.GeneratorScheduler;
import com.machine.signals.service.StorageHealthMonitor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ShutdownCoordinatorTest {

    @Mock
    private GeneratorScheduler generatorScheduler;

    @Mock
    private StorageHealthMonitor healthMonitor;

    @Mock
    private DataSource dataSource;

    private SignalProperties properties;

    @BeforeEach
    void setUp() {
        properties = new SignalProperties();
        properties.getShutdown().setGracePeriod(Duration.ofSeconds(2));
    }

    @Test
    void startFailsWhenStorageIsUnreachable() {
        when(healthMonitor.health()).thenReturn(Health.down().withDetail("error", "Connection refused").build());
        ShutdownCoordinator coordinator = coordinator();

        assertThatThrownBy(coordinator::start)
                .isInstanceOf(StorageUnavailableException.class)
                .hasMessageContaining("Connection refused");

        assertThat(coordinator.getState()).isEqualTo(LifecycleState.STARTING);
        assertThat(coordinator.tryEnterRequest()).isFalse();
        verify(generatorScheduler, never()).start();
    }

    @Test
    void startStartsGeneratorsAndBecomesReady() {
        ShutdownCoordinator coordinator = started();

        assertThat(coordinator.getState()).isEqualTo(LifecycleState.READY);
        assertThat(coordinator.isRunning()).isTrue();
        verify(generatorScheduler).start();
    }

    @Test
    void disabledGeneratorsAreNotStarted() {
        properties.getGenerator().setEnabled(false);

        ShutdownCoordinator coordinator = started();

        assertThat(coordinator.getState()).isEqualTo(LifecycleState.READY);
        verify(generatorScheduler, never()).start();
    }

    @Test
    void drainingStopsTicksAndRejectsNewRequests() {
        ShutdownCoordinator coordinator = started();
        assertThat(coordinator.tryEnterRequest()).isTrue();

        coordinator.onContextClosed();
        coordinator.beginDraining();

        assertThat(coordinator.getState()).isEqualTo(LifecycleState.DRAINING);
        assertThat(coordinator.tryEnterRequest()).isFalse();
        assertThat(coordinator.inFlightRequests()).isEqualTo(1);
        verify(generatorScheduler).stopScheduling();
    }

    @Test
    void drainWithinGracePeriodExitsZero() throws Exception {
        when(generatorScheduler.awaitTermination(any())).thenReturn(true);
        ShutdownCoordinator coordinator = started();
        assertThat(coordinator.tryEnterRequest()).isTrue();
        coordinator.beginDraining();

        CompletableFuture<Void> slowRequest = CompletableFuture.runAsync(() -> {
            sleep(100);
            coordinator.exitRequest();
        });
        coordinator.stop();

        assertThat(slowRequest).succeedsWithin(1, TimeUnit.SECONDS);
        assertThat(coordinator.getState()).isEqualTo(LifecycleState.STOPPED);
        assertThat(coordinator.isRunning()).isFalse();
        assertThat(coordinator.inFlightRequests()).isZero();
        assertThat(coordinator.exitCode()).isZero();
        verify(generatorScheduler, never()).shutdownNow();
    }

    @Test
    void stuckRequestExitsNonZero() throws Exception {
        properties.getShutdown().setGracePeriod(Duration.ofMillis(150));
        when(generatorScheduler.awaitTermination(any())).thenReturn(true);
        ShutdownCoordinator coordinator = started();
        assertThat(coordinator.tryEnterRequest()).isTrue();

        long begin = System.nanoTime();
        coordinator.stop();
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);

        assertThat(elapsedMillis).isLessThan(1_500);
        assertThat(coordinator.getState()).isEqualTo(LifecycleState.STOPPED);
        assertThat(coordinator.exitCode()).isEqualTo(1);
    }

    @Test
    void stuckTickIsInterruptedAndExitsNonZero() throws Exception {
        when(generatorScheduler.awaitTermination(any())).thenReturn(false);
        ShutdownCoordinator coordinator = started();

        coordinator.stop();

        verify(generatorScheduler).stopScheduling();
        verify(generatorScheduler).shutdownNow();
        assertThat(coordinator.exitCode()).isEqualTo(1);
    }

    @Test
    void poolWithoutMetricsReportsUnknownActiveConnections() {
        assertThat(coordinator().activeConnections()).isEqualTo(-1);
    }

    private ShutdownCoordinator started() {
        when(healthMonitor.health()).thenReturn(Health.up().withDetail("database", "H2").build());
        ShutdownCoordinator coordinator = coordinator();
        coordinator.start();
        return coordinator;
    }

    private ShutdownCoordinator coordinator() {
        return new ShutdownCoordinator(generatorScheduler, healthMonitor, dataSource, properties);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
