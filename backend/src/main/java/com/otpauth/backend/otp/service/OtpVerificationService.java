package com.otpauth.backend.otp.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.otpauth.backend.global.ApiException;
import com.otpauth.backend.global.ErrorCode;
import com.otpauth.backend.otp.config.OtpOptions;
import com.otpauth.backend.otp.domain.OtpRecord;
import com.otpauth.backend.otp.repo.OtpRecordStore;
import com.otpauth.backend.otp.support.EmailNormalizer;

import lombok.extern.slf4j.Slf4j;

/**
 * OTP 검증 + 1회 소비
 *
 * 상태: 조회 -> { NOT_FOUND, EXPIRED, INVALID, ATTEMPTS_EXHAUSTED, 성공 }
 * - INVALID만 레코드가 남는다. (attempts + 1 저장, 재시도 가능)
 * - 나머지 종료 상태에서는 레코드를 지운다. (NOT_FOUND는 지울 것이 없음)
 *
 * 동시성
 * - 모든 쓰기는 읽었을 때의 version 조건부. 중간에 다른 요청이 바꿨으면 처음(조회)부터 다시 한다.
 * - 같은 코드로 동시에 여러 번 검증해도 delete에 성공하는 요청은 하나뿐이고,
 *   나머지는 다시 읽었을 때 레코드가 없어서 OTP_NOT_FOUND가 된다.
 */
@Slf4j
@Service
public class OtpVerificationService {

    private final OtpRecordStore store;
    private final OtpOptions options;
    private final Clock clock;
    private final OptimisticRetry retry;

    public OtpVerificationService(OtpRecordStore store, OtpOptions options, Clock clock) {
        this.store = store;
        this.options = options;
        this.clock = clock;
        this.retry = new OptimisticRetry(options.conflictRetries());
    }

    public void verify(String rawEmail, String submittedCode) {
        String email = EmailNormalizer.normalize(rawEmail);
        retry.run("verify", email, () -> verifyOnce(email, submittedCode));
    }

    private void verifyOnce(String email, String submittedCode) {
        OtpRecord record = store.findLatestByEmail(email)
                .orElseThrow(() -> new ApiException(ErrorCode.OTP_NOT_FOUND));

        LocalDateTime now = LocalDateTime.now(clock);
        int maxAttempts = options.maxAttempts();

        if (record.isExpired(now)) {
            store.delete(record);
            log.warn("OTP expired, record removed. email={}", email);
            throw new ApiException(ErrorCode.OTP_EXPIRED);
        }

        // 정책 값이 줄어든 뒤 남아 있던 레코드
        if (record.isExhausted(maxAttempts)) {
            store.delete(record);
            throw new ApiException(ErrorCode.OTP_ATTEMPTS_EXHAUSTED);
        }

        if (!record.matches(submittedCode)) {
            int attempts = record.registerFailure(now);
            if (attempts >= maxAttempts) {
                store.delete(record);
                log.warn("OTP attempts exhausted, record removed. email={} attempts={}", email, attempts);
                throw new ApiException(ErrorCode.OTP_ATTEMPTS_EXHAUSTED);
            }
            store.update(record);
            throw new ApiException(ErrorCode.OTP_INVALID, Map.of("attemptsRemaining", maxAttempts - attempts));
        }

        // 일치: 재사용 불가하도록 즉시 삭제. 남아 있던 오래된 중복도 같이 정리
        store.delete(record);
        store.deleteOlderThan(record);
    }
}
