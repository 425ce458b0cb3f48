package com.example.traffic_optimizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class TrafficOptimizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrafficOptimizerApplication.class, args);
    }
}
