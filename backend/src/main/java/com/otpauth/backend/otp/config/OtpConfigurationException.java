package com.otpauth.backend.otp.config;

import lombok.Getter;

/**
 * 부팅 시점 설정 오류
 * - 요청 단위 인증 실패(ApiException)와 다르다. HTTP 응답으로 매핑하지 않고 기동 자체를 멈춘다.
 */
@Getter
public class OtpConfigurationException extends IllegalStateException {

    private final String field;

    public OtpConfigurationException(String field, String message) {
        super(message);
        this.field = field;
    }
}
