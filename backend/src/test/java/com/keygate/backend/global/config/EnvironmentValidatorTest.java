package com.keygate.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    @Test
    @DisplayName("defaults with a datasource pass")
    void defaultsPass() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost/keygate");

        assertThat(new EnvironmentValidator(environment).validate()).isEmpty();
    }

    @Test
    @DisplayName("missing datasource and unusable lifetimes are all reported")
    void problemsReported() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("keygate.auth.token-ttl", "PT0S")
                .withProperty("keygate.auth.refresh-token-ttl", "one day")
                .withProperty("keygate.transport.request-timeout", "-PT1S");

        assertThat(new EnvironmentValidator(environment).validate())
                .hasSize(4)
                .anyMatch(problem -> problem.startsWith("spring.datasource.url"))
                .anyMatch(problem -> problem.startsWith("keygate.auth.token-ttl"))
                .anyMatch(problem -> problem.startsWith("keygate.auth.refresh-token-ttl"))
                .anyMatch(problem -> problem.startsWith("keygate.transport.request-timeout"));
    }

    @Test
    @DisplayName("a refresh lifetime shorter than the access lifetime fails startup")
    void refreshShorterThanAccess() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost/keygate")
                .withProperty("keygate.auth.token-ttl", "PT2H")
                .withProperty("keygate.auth.refresh-token-ttl", "PT1H");

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("must not be shorter");
    }
}
