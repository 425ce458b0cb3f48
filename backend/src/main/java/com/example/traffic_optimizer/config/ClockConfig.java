package com.example.traffic_optimizer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ClockConfig {

    @Bean
    public Clock regionClock(TrafficEngineProperties properties) {
        return Clock.system(ZoneId.of(properties.getZoneId()));
    }
}
