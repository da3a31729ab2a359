package com.keygate.backend.global.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or the token lifetimes are unusable.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String TOKEN_TTL = "keygate.auth.token-ttl";
    static final String REFRESH_TOKEN_TTL = "keygate.auth.refresh-token-ttl";
    static final String REQUEST_TIMEOUT = "keygate.transport.request-timeout";

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Configuration validated");
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        String datasourceUrl = environment.getProperty("spring.datasource.url");
        if (datasourceUrl == null || datasourceUrl.isBlank()) {
            problems.add("spring.datasource.url is required");
        }

        Optional<Duration> tokenTtl = positiveDuration(TOKEN_TTL, "PT1H", problems);
        Optional<Duration> refreshTokenTtl = positiveDuration(REFRESH_TOKEN_TTL, "PT24H", problems);
        positiveDuration(REQUEST_TIMEOUT, "PT10S", problems);

        if (tokenTtl.isPresent() && refreshTokenTtl.isPresent()
                && refreshTokenTtl.get().compareTo(tokenTtl.get()) < 0) {
            problems.add(REFRESH_TOKEN_TTL + " must not be shorter than " + TOKEN_TTL);
        }
        return problems;
    }

    private Optional<Duration> positiveDuration(String key, String defaultValue, List<String> problems) {
        String raw = environment.getProperty(key, defaultValue).trim();
        try {
            Duration value = Duration.parse(raw);
            if (value.isZero() || value.isNegative()) {
                problems.add(key + " must be positive");
                return Optional.empty();
            }
            return Optional.of(value);
        } catch (DateTimeParseException ex) {
            problems.add(key + " must be an ISO-8601 duration such as PT1H");
            return Optional.empty();
        }
    }
}
