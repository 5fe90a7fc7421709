package com.machine.signals.config;

import org.hibernate.boot.model.naming.PhysicalNamingStrategy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(SignalProperties.class)
public class StorageConfig {

    @Bean
    public PhysicalNamingStrategy signalTableNamingStrategy(SignalProperties properties) {
        return new SignalTableNamingStrategy(properties.getStorage().getTableName());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
