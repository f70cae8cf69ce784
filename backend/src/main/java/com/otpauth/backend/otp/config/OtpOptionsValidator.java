package com.otpauth.backend.otp.config;

import com.otpauth.backend.otp.OtpAuthAdapter;

/**
 * 어댑터 설정 검증 (부수효과 없음)
 * - 첫 번째로 틀린 필드 하나를 OtpConfigurationException(field)로 보고한다.
 */
public final class OtpOptionsValidator {

    private OtpOptionsValidator() {}

    public static void validate(OtpAdapterOptions adapterOptions, OtpAuthAdapter expectedModule) {
        if (adapterOptions == null || adapterOptions.options() == null) {
            throw new OtpConfigurationException("options", "Options object is required");
        }

        OtpOptions options = adapterOptions.options();

        if (options.otpValidityInMs() == null || options.otpValidityInMs() <= 0) {
            throw new OtpConfigurationException("otpValidityInMs", "Invalid or missing otpValidityInMs");
        }

        if (options.maxAttempts() == null || options.maxAttempts() <= 0) {
            throw new OtpConfigurationException("maxAttempts", "Invalid or missing maxAttempts");
        }

        if (options.sendEmail() == null) {
            throw new OtpConfigurationException("sendEmail", "Invalid or missing sendEmail function");
        }

        if (options.conflictRetries() < 1) {
            throw new OtpConfigurationException("conflictRetries", "conflictRetries must be at least 1");
        }

        if (expectedModule == null || adapterOptions.module() != expectedModule) {
            throw new OtpConfigurationException("module", "Module must be the configured OtpAuthAdapter instance");
        }
    }
}
