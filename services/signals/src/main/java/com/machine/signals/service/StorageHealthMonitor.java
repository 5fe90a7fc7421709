package com.machine.signals.service;

import com.machine.signals.config.SignalProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Liveness of the signal store: borrows one pooled connection, validates it and
 * hands it back. Never retries and never writes.
 */
@Component("signalStorageHealthIndicator")
public class StorageHealthMonitor implements HealthIndicator {

    private final DataSource dataSource;
    private final int validationTimeoutSeconds;

    public StorageHealthMonitor(DataSource dataSource, SignalProperties properties) {
        this.dataSource = dataSource;
        this.validationTimeoutSeconds = properties.getStorage().getValidationTimeoutSeconds();
    }

    @Override
    public Health health() {
        try (Connection connection = dataSource.getConnection()) {
            if (connection.isValid(validationTimeoutSeconds)) {
                return Health.up()
                        .withDetail("database", connection.getMetaData().getDatabaseProductName())
                        .build();
            }
            return Health.down()
                    .withDetail("error", "Connection validation failed")
                    .build();
        } catch (SQLException | RuntimeException e) {
            return Health.down(e).build();
        }
    }
}
