package com.salesanalytics.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(SalesAnalyticsProperties.class)
public class SalesAnalyticsConfig {

    public SalesAnalyticsConfig(SalesAnalyticsProperties properties) {
        log.info("Sales analysis configured: columns={}, dateFormats={}, defaultTopN={}",
                properties.toColumnMapping(), properties.getDateFormats(), properties.getDefaultTopN());
    }
}
