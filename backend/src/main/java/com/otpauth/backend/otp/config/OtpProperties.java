package com.otpauth.backend.otp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * OTP 정책 설정 (application.yml 의 app.otp.*)
 *
 * - validityMs, maxAttempts는 여기서 제약을 걸지 않는다.
 *   누락/범위 오류는 OtpOptionsValidator가 "어떤 필드가 틀렸는지"와 함께 보고한다.
 * - masterKey가 비어 있으면 관리자 우회 경로 자체가 꺼진다.
 */
@Validated
@ConfigurationProperties(prefix = "app.otp")
public record OtpProperties(
        Long validityMs,
        Integer maxAttempts,
        @DefaultValue("5") @Min(1) int conflictRetries,
        String masterKey,
        @DefaultValue @Valid Schema schema,
        @DefaultValue @Valid Mail mail
) {

    public boolean masterKeyConfigured() {
        return masterKey != null && !masterKey.isBlank();
    }

    /**
     * - autoCreate: 부팅 중 어댑터 생성 시 ensureSchema() 실행 여부
     */
    public record Schema(
            @DefaultValue("true") boolean autoCreate
    ) {}

    /**
     * - sender: smtp(JavaMailSender) | log(개발용, 코드를 로그로만 남김)
     */
    public record Mail(
            @DefaultValue("smtp") @NotBlank String sender,
            @DefaultValue("no-reply@localhost") @NotBlank String from,
            @DefaultValue("Your verification code") @NotBlank String subject
    ) {}
}
