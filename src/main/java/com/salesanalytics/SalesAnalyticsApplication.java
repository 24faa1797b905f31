package com.salesanalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Sales Metrics Engine
 *
 * Cleans raw sales transactions and derives business metrics from them:
 * - Monthly and yearly growth trends
 * - Price elasticity per product
 * - Product performance ranking and market share
 *
 * Architecture:
 * - REST API taking CSV uploads
 * - Pure in-memory engine, one instance per analysis run
 * - Redis caching of analysis results
 * - Background jobs for large uploads
 */
@SpringBootApplication
@EnableScheduling
public class SalesAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(SalesAnalyticsApplication.class, args);
    }
}
