package com.machine.signals;

import com.machine.signals.lifecycle.ShutdownCoordinator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Machine Signals Service
 *
 * Simulates one machine emitting state-change, error and power readings,
 * persists them to a relational table and serves the most recent readings
 * per signal type over HTTP.
 */
@SpringBootApplication
public class SignalsApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(SignalsApplication.class);
        // The shutdown coordinator decides the exit code once the drain is over.
        application.setRegisterShutdownHook(false);
        ConfigurableApplicationContext context = application.run(args);

        ShutdownCoordinator coordinator = context.getBean(ShutdownCoordinator.class);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            context.close();
            Runtime.getRuntime().halt(coordinator.exitCode());
        }, "shutdown-coordinator"));
    }
}
