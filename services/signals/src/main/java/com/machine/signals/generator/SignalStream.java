package com.machine.signals.generator;

import com.machine.common.dto.SignalRecord;
import com.machine.common.model.SignalType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * One simulated telemetry stream: its type, when it ticks and what it reads.
 *
 * Not thread-safe. The scheduler runs at most one tick of a stream at a time,
 * which also keeps timestamps non-decreasing per signal type.
 */
public class SignalStream {

    private final SignalType signalType;
    private final TickPolicy tickPolicy;
    private final ValueModel valueModel;
    private final RandomGenerator random;
    private final Clock clock;

    private Instant lastTimestamp = Instant.MIN;

    public SignalStream(SignalType signalType, TickPolicy tickPolicy, ValueModel valueModel,
                        RandomGenerator random, Clock clock) {
        this.signalType = Objects.requireNonNull(signalType, "signalType is required");
        this.tickPolicy = Objects.requireNonNull(tickPolicy, "tickPolicy is required");
        this.valueModel = Objects.requireNonNull(valueModel, "valueModel is required");
        this.random = Objects.requireNonNull(random, "random is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public SignalType signalType() {
        return signalType;
    }

    public Duration nextDelay() {
        return tickPolicy.nextDelay();
    }

    /**
     * Reads the simulated sensor, stamped with the current time. A clock that
     * steps backwards repeats the previous timestamp instead.
     */
    public SignalRecord nextReading() {
        Instant now = clock.instant();
        if (now.isBefore(lastTimestamp)) {
            now = lastTimestamp;
        }
        lastTimestamp = now;
        return SignalRecord.reading(signalType, valueModel.next(random), now);
    }
}
