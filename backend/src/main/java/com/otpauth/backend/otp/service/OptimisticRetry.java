package com.otpauth.backend.otp.service;

import java.util.function.Supplier;

import org.springframework.dao.ConcurrencyFailureException;

import com.otpauth.backend.global.ApiException;
import com.otpauth.backend.global.ErrorCode;

import lombok.extern.slf4j.Slf4j;

/**
 * 읽기 -> 판단 -> 조건부 쓰기 한 사이클을 충돌 시 처음부터 다시 실행한다.
 * - action 안에서 던진 ApiException(인증 실패 종류)은 재시도하지 않고 그대로 올라간다.
 * - 예산을 다 쓰면 OTP_CONFLICT.
 */
@Slf4j
final class OptimisticRetry {

    private final int maxAttempts;

    OptimisticRetry(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    <T> T execute(String operation, String email, Supplier<T> action) {
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (ConcurrencyFailureException e) {
                if (attempt >= maxAttempts) {
                    log.warn("OTP {} gave up after {} conflicting writes. email={}", operation, attempt, email);
                    throw new ApiException(ErrorCode.OTP_CONFLICT, 1, null);
                }
                log.debug("OTP {} conflict, re-reading (attempt {}/{}). email={}", operation, attempt, maxAttempts, email);
            }
        }
    }

    void run(String operation, String email, Runnable action) {
        execute(operation, email, () -> {
            action.run();
            return null;
        });
    }
}
