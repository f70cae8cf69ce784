package com.otpauth.backend.global;

import org.springframework.http.HttpStatus;

import lombok.Getter;

/**
 * 서비스/어댑터가 호출자에게 돌려주는 실패
 * - ErrorCode 하나로 HTTP 상태 + 에러 코드 + 기본 메시지가 결정된다.
 * - 재시도/부가 정보가 필요하면 retryAfterSeconds, details를 함께 싣는다.
 * - GlobalExceptionHandler가 이 예외 하나로 공통 처리
 */
@Getter
public class ApiException extends RuntimeException {

    private final ErrorCode errorCode;
    private final HttpStatus status;
    private final String code;
    private final Integer retryAfterSeconds;
    private final Object details;

    public ApiException(ErrorCode errorCode) {
        this(errorCode, errorCode.defaultMessage(), null, null, null);
    }

    public ApiException(ErrorCode errorCode, Object details) {
        this(errorCode, errorCode.defaultMessage(), null, details, null);
    }

    public ApiException(ErrorCode errorCode, Integer retryAfterSeconds, Object details) {
        this(errorCode, errorCode.defaultMessage(), retryAfterSeconds, details, null);
    }

    // 외부 I/O(메일 발송 등) 실패를 감쌀 때: 원인 예외를 잃지 않도록 cause 보존
    public ApiException(ErrorCode errorCode, Throwable cause) {
        this(errorCode, errorCode.defaultMessage(), null, null, cause);
    }

    public ApiException(ErrorCode errorCode, String messageOverride, Integer retryAfterSeconds,
                        Object details, Throwable cause) {
        super(messageOverride, cause);
        this.errorCode = errorCode;
        this.status = errorCode.status();
        this.code = errorCode.name();
        this.retryAfterSeconds = retryAfterSeconds;
        this.details = details;
    }
}
