package com.otpauth.backend.otp.support;

import java.util.Locale;
import java.util.regex.Pattern;

import com.otpauth.backend.global.ApiException;
import com.otpauth.backend.global.ErrorCode;

/**
 * 이메일 정규화: 앞뒤 공백 제거 + 소문자
 * - 발급과 검증이 같은 키로 레코드를 찾게 하려면 양쪽이 반드시 같은 규칙을 거쳐야 한다.
 */
public final class EmailNormalizer {

    private static final Pattern SHAPE = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private EmailNormalizer() {}

    public static String canonical(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    public static String normalize(String rawEmail) {
        String email = canonical(rawEmail);
        if (email == null || email.length() > 255 || !SHAPE.matcher(email).matches()) {
            throw new ApiException(ErrorCode.INVALID_EMAIL);
        }
        return email;
    }
}
