package org.jstats.confidence_engine.core.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@Configuration
@EnableRetry
@EnableScheduling
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfig {

    // Every timestamp the learners write goes through this clock
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
