package com.otpauth.backend.global;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.INTERNAL_SERVER_ERROR;

import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;

/**
 * 전역 예외 처리기
 * - ApiException은 들고 있는 ErrorCode 그대로 응답
 * - 요청 검증 실패는 상세를 숨기고 VALIDATION_ERROR 하나로 단순화 (상세는 로그에만)
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiError> handle(ApiException e) {
        if (e.getStatus().is5xxServerError()) {
            log.error("OTP request failed: code={}", e.getCode(), e);
        }
        return ResponseEntity
                .status(e.getStatus())
                .body(ApiError.from(e));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handle(MethodArgumentNotValidException e) {
        e.getBindingResult().getFieldErrors()
                .forEach(fe -> log.warn("Validation error: field={}, message={}",
                        fe.getField(),
                        fe.getDefaultMessage()));

        return ResponseEntity
                .status(BAD_REQUEST)
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handle(ConstraintViolationException e) {
        return ResponseEntity
                .status(BAD_REQUEST)
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR));
    }

    // 깨진 JSON 바디
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handle(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity
                .status(BAD_REQUEST)
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handle(Exception e) {
        log.error("Unhandled exception", e);
        return ResponseEntity
                .status(INTERNAL_SERVER_ERROR)
                .body(ApiError.of(ErrorCode.INTERNAL_ERROR));
    }
}
