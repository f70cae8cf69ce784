package com.otpauth.backend.otp;

/** verify 입력: 이메일 + 사용자가 제출한 코드 */
public record OtpAuthData(String email, String otp) {}
