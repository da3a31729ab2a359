package com.keygate.backend.global.common.logging;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LogMaskingTest {

    @Test
    @DisplayName("emails keep their first character and domain")
    void maskEmail() {
        assertThat(LogMasking.maskEmail("alice@example.com")).isEqualTo("a***@example.com");
        assertThat(LogMasking.maskEmail(" a@x.com ")).isEqualTo("a***@x.com");
    }

    @Test
    @DisplayName("malformed or missing emails are masked entirely")
    void maskMalformed() {
        assertThat(LogMasking.maskEmail(null)).isEqualTo("***");
        assertThat(LogMasking.maskEmail("  ")).isEqualTo("***");
        assertThat(LogMasking.maskEmail("nodomain")).isEqualTo("n***");
        assertThat(LogMasking.maskEmail("@example.com")).isEqualTo("@***");
    }
}
