package com.otpauth.backend.otp.service;

import java.security.SecureRandom;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class OtpCodeGenerator {

    private static final int MIN = 100_000;
    private static final int RANGE = 900_000;

    private final SecureRandom secureRandom;

    // 6자리 숫자 (100000~999999 균등분포, 앞자리 0 없음)
    public String generate6Digits() {
        int n = secureRandom.nextInt(RANGE) + MIN;
        return Integer.toString(n);
    }
}
