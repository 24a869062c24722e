package com.teamflow.core.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the background passes (stall scan, rebalance, tracker poll) when teammate mode is enabled.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "teamflow", name = "enabled", havingValue = "true")
public class SchedulingConfig {
}
