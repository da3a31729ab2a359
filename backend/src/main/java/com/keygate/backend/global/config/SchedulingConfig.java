package com.keygate.backend.global.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Background jobs can be switched off with {@code keygate.scheduling.enabled=false}, which the tests do.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "keygate.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
