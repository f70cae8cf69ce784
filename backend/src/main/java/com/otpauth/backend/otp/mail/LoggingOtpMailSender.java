package com.otpauth.backend.otp.mail;

import java.util.concurrent.CompletableFuture;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * 개발/테스트용 발송기. 실제로 보내지 않고 로그만 남긴다. (app.otp.mail.sender=log)
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.otp.mail", name = "sender", havingValue = "log")
public class LoggingOtpMailSender implements OtpMailSender {

    @Override
    public CompletableFuture<Void> sendOtp(String email, String code) {
        log.info("Send OTP email={} code={}", email, code);
        return CompletableFuture.completedFuture(null);
    }
}
