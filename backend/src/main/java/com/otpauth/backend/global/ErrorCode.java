package com.otpauth.backend.global;

import org.springframework.http.HttpStatus;

/**
 * 중앙화된 에러 코드
 * - name()이 그대로 응답의 code 값이 된다. (클라이언트는 message가 아니라 code로 분기)
 */
public enum ErrorCode {

    // 공통
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, "Request validation failed"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"),

    // 보안
    AUTH_REQUIRED(HttpStatus.UNAUTHORIZED, "Authentication required"),
    MASTER_KEY_INVALID(HttpStatus.UNAUTHORIZED, "Invalid master key"),

    // OTP
    INVALID_EMAIL(HttpStatus.BAD_REQUEST, "Invalid email address"),
    OTP_NOT_FOUND(HttpStatus.BAD_REQUEST, "OTP not found"),
    OTP_EXPIRED(HttpStatus.UNAUTHORIZED, "OTP expired"),
    OTP_INVALID(HttpStatus.BAD_REQUEST, "Invalid OTP"),
    OTP_ATTEMPTS_EXHAUSTED(HttpStatus.TOO_MANY_REQUESTS, "Max attempts reached. OTP invalidated."),
    OTP_CONFLICT(HttpStatus.CONFLICT, "OTP is being modified concurrently, try again"),
    OTP_DELIVERY_FAILED(HttpStatus.BAD_GATEWAY, "Failed to deliver OTP email");

    private final HttpStatus status;
    private final String defaultMessage;

    ErrorCode(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
