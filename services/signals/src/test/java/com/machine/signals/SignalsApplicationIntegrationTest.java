package com.machine.signals;

import com.machine.common.dto.SignalRecord;
import com.machine.common.model.SignalType;
import com.machine.signals.exception.BackpressureException;
import com.machine.signals.lifecycle.LifecycleState;
import com.machine.signals.lifecycle.ShutdownCoordinator;
import com.machine.signals.service.IngestionCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "spring.datasource.hikari.maximum-pool-size=2",
        "spring.datasource.hikari.connection-timeout=250"
})
@AutoConfigureMockMvc
class SignalsApplicationIntegrationTest {

    private static final Instant T0 = Instant.parse("2024-01-15T10:30:00Z");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private IngestionCoordinator ingestionCoordinator;

    @Autowired
    private ShutdownCoordinator shutdownCoordinator;

    @Autowired
    private DataSource dataSource;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void clearTable() {
        jdbcTemplate.update("DELETE FROM machine_signals");
    }

    @Test
    void contextStartsReady() {
        assertThat(shutdownCoordinator.getState()).isEqualTo(LifecycleState.READY);
    }

    @Test
    void submittedReadingsAreServedNewestFirst() throws Exception {
        long first = ingestionCoordinator.submit(SignalRecord.reading(SignalType.POWER, 42.5, T0.plusMillis(10)));
        long second = ingestionCoordinator.submit(SignalRecord.reading(SignalType.POWER, 43.1, T0.plusMillis(20)));
        assertThat(second).isGreaterThan(first);

        mockMvc.perform(get("/signals/power"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].value").value(43.1))
                .andExpect(jsonPath("$[0].signal_type").value("power"))
                .andExpect(jsonPath("$[0].timestamp").value("2024-01-15T10:30:00.020Z"))
                .andExpect(jsonPath("$[1].value").value(42.5));
    }

    @Test
    void onlyTheTenMostRecentAreServed() throws Exception {
        for (int i = 0; i < 12; i++) {
            ingestionCoordinator.submit(SignalRecord.reading(SignalType.STATE_CHANGE, i % 2, T0.plusSeconds(i)));
        }

        mockMvc.perform(get("/signals/state_change"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(10))
                .andExpect(jsonPath("$[0].timestamp").value("2024-01-15T10:30:11Z"))
                .andExpect(jsonPath("$[9].timestamp").value("2024-01-15T10:30:02Z"));
    }

    @Test
    void typeWithoutReadingsReturnsEmptyArray() throws Exception {
        ingestionCoordinator.submit(SignalRecord.reading(SignalType.POWER, 250.0, T0));

        mockMvc.perform(get("/signals/error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void unknownTypeIsRejected() throws Exception {
        mockMvc.perform(get("/signals/temperature"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void exhaustedPoolDropsWritesWithBackpressure() throws Exception {
        try (Connection a = dataSource.getConnection(); Connection b = dataSource.getConnection()) {
            assertThat(shutdownCoordinator.activeConnections()).isEqualTo(2);

            assertThatThrownBy(() -> ingestionCoordinator.submit(SignalRecord.reading(SignalType.POWER, 300.0, T0)))
                    .isInstanceOf(BackpressureException.class);
        }

        assertThat(shutdownCoordinator.activeConnections()).isZero();
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM machine_signals", Integer.class)).isZero();

        ingestionCoordinator.submit(SignalRecord.reading(SignalType.POWER, 300.0, T0));
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM machine_signals", Integer.class)).isEqualTo(1);
    }

    @Test
    void timestampColumnIsPlainTimestamp() {
        String dataType = jdbcTemplate.queryForObject(
                "SELECT DATA_TYPE FROM INFORMATION_SCHEMA.COLUMNS "
                        + "WHERE TABLE_SCHEMA = 'PUBLIC' AND TABLE_NAME = 'MACHINE_SIGNALS' AND COLUMN_NAME = 'TIMESTAMP'",
                String.class);

        assertThat(dataType).isEqualTo("TIMESTAMP");
    }

    @Test
    void timestampsAreStoredAsUtcWallTime() {
        ingestionCoordinator.submit(SignalRecord.reading(SignalType.ERROR, 17, T0));

        String stored = jdbcTemplate.queryForObject(
                "SELECT CAST(\"TIMESTAMP\" AS VARCHAR) FROM machine_signals", String.class);

        assertThat(stored).startsWith("2024-01-15 10:30:00");
    }

    @Test
    void healthReportsUp() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("Service is up and running"));

        assertThat(shutdownCoordinator.activeConnections()).isZero();
    }
}
