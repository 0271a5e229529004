package com.reelpipe.orchestrator.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

    // All lease and timestamp arithmetic reads this clock; tests swap in a movable one.
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
