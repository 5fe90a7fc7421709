package com.machine.signals.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@ConfigurationProperties("machine")
@Data
@Validated
public class SignalProperties {

    @Valid
    @NotNull
    private Storage storage = new Storage();

    @Valid
    @NotNull
    private Generator generator = new Generator();

    @Valid
    @NotNull
    private Ingestion ingestion = new Ingestion();

    @Valid
    @NotNull
    private Shutdown shutdown = new Shutdown();

    @Data
    public static class Storage {
        /**
         * Table holding the signal rows. Mapped onto the entity at bootstrap.
         */
        @NotBlank
        private String tableName = "machine_signals";

        /**
         * Seconds allowed for the health check's connection validation round-trip.
         */
        @Min(1)
        private int validationTimeoutSeconds = 2;
    }

    @Data
    public static class Generator {
        /**
         * Disable to run the read API without producing readings.
         */
        private boolean enabled = true;

        @Valid
        @NotNull
        private Stream stateChange = new Stream(Duration.ofSeconds(1), Duration.ofSeconds(5), 0, 1);

        @Valid
        @NotNull
        private Stream error = new Stream(Duration.ofSeconds(10), Duration.ofSeconds(30), 1, 100);

        @Valid
        @NotNull
        private Stream power = new Stream(Duration.ofMillis(10), Duration.ofMillis(10), 100.0, 500.0);
    }

    /**
     * Timing and value range of one generated stream. Equal delays mean a fixed rate.
     */
    @Data
    public static class Stream {
        @NotNull
        private Duration minDelay;

        @NotNull
        private Duration maxDelay;

        private double minValue;

        private double maxValue;

        public Stream() {
        }

        public Stream(Duration minDelay, Duration maxDelay, double minValue, double maxValue) {
            this.minDelay = minDelay;
            this.maxDelay = maxDelay;
            this.minValue = minValue;
            this.maxValue = maxValue;
        }
    }

    @Data
    public static class Ingestion {
        /**
         * Total insert attempts per reading, the first one included.
         */
        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration minBackoff = Duration.ofMillis(50);

        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(1);
    }

    @Data
    public static class Shutdown {
        /**
         * How long in-flight ticks and requests may run after a termination signal.
         */
        @NotNull
        private Duration gracePeriod = Duration.ofSeconds(10);
    }
}
