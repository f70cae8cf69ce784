package com.otpauth.backend.otp.link;

/**
 * 호스트가 사용자 저장 직후 발행하는 이벤트
 * - linkedOtpEmail: 사용자 authData에 연결된 OTP 식별자(이메일). 연결이 없으면 null
 */
public record UserSavedEvent(String userId, String primaryEmail, String linkedOtpEmail) {}
