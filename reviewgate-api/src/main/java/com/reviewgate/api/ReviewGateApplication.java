package com.reviewgate.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Main application entry point for the review gate.
 * The data source is built by {@link com.reviewgate.api.config.EngineConfiguration}
 * only when the JDBC state store is selected.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class ReviewGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReviewGateApplication.class, args);
    }
}
