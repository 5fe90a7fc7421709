package com.machine.signals.config;

import com.machine.common.model.SignalType;
import com.machine.signals.generator.GeneratorScheduler;
import com.machine.signals.generator.SignalStream;
import com.machine.signals.generator.TickPolicy;
import com.machine.signals.generator.ValueModel;
import com.machine.signals.service.IngestionCoordinator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

/**
 * Wires the three simulated streams. The shutdown coordinator starts them once
 * storage is reachable.
 */
@Configuration
public class GeneratorConfig {

    @Bean
    public GeneratorScheduler generatorScheduler(SignalProperties properties,
                                                 IngestionCoordinator ingestionCoordinator,
                                                 Clock clock) {
        SignalProperties.Generator generator = properties.getGenerator();

        SignalProperties.Stream error = generator.getError();
        SignalProperties.Stream power = generator.getPower();

        List<SignalStream> streams = List.of(
                stream(SignalType.STATE_CHANGE, generator.getStateChange(), new ValueModel.BinaryState(), clock),
                stream(SignalType.ERROR, error,
                        new ValueModel.ErrorCode((int) error.getMinValue(), (int) error.getMaxValue()), clock),
                stream(SignalType.POWER, power,
                        new ValueModel.PowerDraw(power.getMinValue(), power.getMaxValue()), clock)
        );

        return new GeneratorScheduler(streams, ingestionCoordinator);
    }

    private static SignalStream stream(SignalType type, SignalProperties.Stream settings,
                                       ValueModel valueModel, Clock clock) {
        RandomGenerator random = new SplittableRandom();
        TickPolicy tickPolicy = TickPolicy.between(settings.getMinDelay(), settings.getMaxDelay(), random);
        return new SignalStream(type, tickPolicy, valueModel, random, clock);
    }
}
