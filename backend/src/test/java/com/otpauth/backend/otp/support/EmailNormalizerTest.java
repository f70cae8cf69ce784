package com.otpauth.backend.otp.support;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import com.otpauth.backend.global.ApiException;
import com.otpauth.backend.global.ErrorCode;

class EmailNormalizerTest {

    @Test
    @DisplayName("공백 제거 + 소문자")
    void trims_and_lowercases() {
        assertThat(EmailNormalizer.normalize("  Alice@Example.COM ")).isEqualTo("alice@example.com");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "alice", "alice@", "@example.com", "a b@example.com", "a@@example.com", "alice@localhost"})
    @DisplayName("형식이 아니면 INVALID_EMAIL")
    void rejects_malformed(String raw) {
        assertThatThrownBy(() -> EmailNormalizer.normalize(raw))
                .isInstanceOf(ApiException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_EMAIL);
    }

    @Test
    @DisplayName("255자 초과 → INVALID_EMAIL")
    void rejects_too_long() {
        String raw = "a".repeat(250) + "@example.com";

        assertThatThrownBy(() -> EmailNormalizer.normalize(raw))
                .isInstanceOf(ApiException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_EMAIL);
    }

    @Test
    @DisplayName("canonical은 형식 검사 없이 null 안전")
    void canonical_is_lenient() {
        assertThat(EmailNormalizer.canonical(null)).isNull();
        assertThat(EmailNormalizer.canonical(" X ")).isEqualTo("x");
    }
}
