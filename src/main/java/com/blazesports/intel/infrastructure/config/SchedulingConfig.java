package com.blazesports.intel.infrastructure.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
@EnableConfigurationProperties(WarmingProperties.class)
@ConditionalOnProperty(prefix = "blaze.warming", name = "enabled", havingValue = "true")
public class SchedulingConfig {
}
