package com.machine.signals.generator;

import java.time.Duration;
import java.util.random.RandomGenerator;

/**
 * Decides how long a stream waits before its next tick.
 */
@FunctionalInterface
public interface TickPolicy {

    Duration nextDelay();

    static TickPolicy fixed(Duration delay) {
        requirePositive(delay);
        return () -> delay;
    }

    /**
     * Delays drawn uniformly from {@code [min, max)}.
     */
    static TickPolicy uniform(Duration min, Duration max, RandomGenerator random) {
        requirePositive(min);
        if (max.compareTo(min) <= 0) {
            throw new IllegalArgumentException("max delay " + max + " must exceed min delay " + min);
        }
        long minNanos = min.toNanos();
        long maxNanos = max.toNanos();
        return () -> Duration.ofNanos(random.nextLong(minNanos, maxNanos));
    }

    /**
     * Fixed when both bounds are equal, uniform otherwise.
     */
    static TickPolicy between(Duration min, Duration max, RandomGenerator random) {
        return min.equals(max) ? fixed(min) : uniform(min, max, random);
    }

    private static void requirePositive(Duration delay) {
        if (delay == null || delay.isNegative() || delay.isZero()) {
            throw new IllegalArgumentException("Tick delay must be positive: " + delay);
        }
    }
}
