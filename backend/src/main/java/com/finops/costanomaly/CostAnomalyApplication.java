package com.finops.costanomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.cache.annotation.EnableCaching;

/**
 * Cloud Cost Anomaly Detection Engine
 *
 * Builds statistical baselines from historical cost series, flags unusual spending,
 * attributes it to services and resources, and synthesizes alerts.
 * Billing clients, persistence and alert delivery live outside this application
 * and call {@link com.finops.costanomaly.detection.AnomalyDetectionEngine} as a library.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableCaching
public class CostAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(CostAnomalyApplication.class, args);
    }
}
