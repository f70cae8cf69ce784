package com.otpauth.backend.otp.link;

/** 호스트가 반영해야 할 OTP 연결 식별자 변경 */
public record LinkedIdentityChangedEvent(String userId, String linkedOtpEmail) {}
