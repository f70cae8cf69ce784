package com.otpauth.backend.otp.config;

import com.otpauth.backend.otp.mail.OtpMailSender;

/**
 * 서비스가 생성 시점에 잡아두는 불변 정책 묶음
 * - otpValidityInMs: 발급 시점부터 만료까지(ms)
 * - maxAttempts: 이 횟수만큼 틀리면 OTP 폐기
 * - sendEmail: (email, code) -> 비동기 발송 결과
 * - conflictRetries: 동시 수정 충돌 시 다시 읽고 재시도하는 최대 횟수
 *
 * 값 검증은 OtpOptionsValidator 담당. 여기서는 null도 그대로 받는다. (누락을 보고하기 위해)
 */
public record OtpOptions(
        Long otpValidityInMs,
        Integer maxAttempts,
        OtpMailSender sendEmail,
        int conflictRetries
) {

    public static final int DEFAULT_CONFLICT_RETRIES = 5;

    public static OtpOptions of(Long otpValidityInMs, Integer maxAttempts, OtpMailSender sendEmail) {
        return new OtpOptions(otpValidityInMs, maxAttempts, sendEmail, DEFAULT_CONFLICT_RETRIES);
    }
}
