package com.machine.signals.generator;

import java.util.random.RandomGenerator;

/**
 * Produces the numeric payload of one simulated reading.
 */
public sealed interface ValueModel permits ValueModel.BinaryState, ValueModel.ErrorCode, ValueModel.PowerDraw {

    double next(RandomGenerator random);

    /**
     * Machine on/off state, resampled as 0 or 1 on every tick.
     */
    record BinaryState() implements ValueModel {
        @Override
        public double next(RandomGenerator random) {
            return random.nextInt(2);
        }
    }

    /**
     * Error event carrying an integer code in {@code [minCode, maxCode]}.
     */
    record ErrorCode(int minCode, int maxCode) implements ValueModel {
        public ErrorCode {
            if (maxCode < minCode) {
                throw new IllegalArgumentException("maxCode " + maxCode + " is below minCode " + minCode);
            }
        }

        @Override
        public double next(RandomGenerator random) {
            return random.nextInt(minCode, maxCode + 1);
        }
    }

    /**
     * Power draw in watts, uniform in {@code [minWatts, maxWatts)}.
     */
    record PowerDraw(double minWatts, double maxWatts) implements ValueModel {
        public PowerDraw {
            if (!(maxWatts > minWatts)) {
                throw new IllegalArgumentException("maxWatts " + maxWatts + " must exceed minWatts " + minWatts);
            }
        }

        @Override
        public double next(RandomGenerator random) {
            return random.nextDouble(minWatts, maxWatts);
        }
    }
}
