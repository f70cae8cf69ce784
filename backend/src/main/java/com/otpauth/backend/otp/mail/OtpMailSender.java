package com.otpauth.backend.otp.mail;

import java.util.concurrent.CompletableFuture;

/**
 * OTP 메일 발송 포트
 * - 발송 결과는 비동기로 돌려준다. 실패는 예외로 완료된 future로 전달해야 한다.
 */
public interface OtpMailSender {

    CompletableFuture<Void> sendOtp(String email, String code);
}
