package com.otpauth.backend.otp.service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.springframework.stereotype.Service;

import com.otpauth.backend.global.ApiException;
import com.otpauth.backend.global.ErrorCode;
import com.otpauth.backend.otp.config.OtpOptions;
import com.otpauth.backend.otp.domain.OtpRecord;
import com.otpauth.backend.otp.repo.OtpRecordStore;
import com.otpauth.backend.otp.support.EmailNormalizer;

import lombok.extern.slf4j.Slf4j;

/**
 * OTP 발급(챌린지)
 *
 * 설계 포인트
 * - email 당 레코드 1개를 덮어쓴다(upsert). 새로 쌓지 않는다.
 * - 덮어쓸 때 attempts는 유지. 챌린지 재요청으로 시도 제한을 초기화할 수 없다.
 * - 저장이 끝난 뒤에 메일을 보낸다. 발송이 실패하면 저장된 코드는 그대로 두고 OTP_DELIVERY_FAILED를 올린다.
 *   (사용자는 챌린지를 다시 요청하면 된다)
 * - 같은 email로 동시에 챌린지가 들어오면 마지막 쓰기가 이긴다.
 *   둘 다 "없음"을 보고 레코드를 만들었으면, 뒤에 만든 쪽이 남고 먼저 만든 중복은 지운다.
 */
@Slf4j
@Service
public class OtpChallengeService {

    private final OtpRecordStore store;
    private final OtpCodeGenerator otpCodeGenerator;
    private final OtpOptions options;
    private final Clock clock;
    private final OptimisticRetry retry;

    public OtpChallengeService(OtpRecordStore store, OtpCodeGenerator otpCodeGenerator,
                               OtpOptions options, Clock clock) {
        this.store = store;
        this.otpCodeGenerator = otpCodeGenerator;
        this.options = options;
        this.clock = clock;
        this.retry = new OptimisticRetry(options.conflictRetries());
    }

    public ChallengeAck challenge(String rawEmail) {
        String email = EmailNormalizer.normalize(rawEmail);
        String code = otpCodeGenerator.generate6Digits();

        OtpRecord kept = retry.execute("challenge", email, () -> upsert(email, code));
        int removed = store.deleteOlderThan(kept);
        if (removed > 0) {
            log.info("Removed {} stale OTP duplicate(s). email={}", removed, email);
        }
        log.info("OTP issued. email={}", email);

        deliver(email, code);
        return ChallengeAck.accepted();
    }

    private OtpRecord upsert(String email, String code) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime expiresAt = now.plus(Duration.ofMillis(options.otpValidityInMs()));

        OtpRecord existing = store.findLatestByEmail(email).orElse(null);
        if (existing == null) {
            return store.create(OtpRecord.create(email, code, expiresAt, now));
        }

        existing.reissue(code, expiresAt, now);
        store.update(existing);
        return existing;
    }

    private void deliver(String email, String code) {
        CompletableFuture<Void> delivery;
        try {
            delivery = options.sendEmail().sendOtp(email, code);
        } catch (RuntimeException e) {
            throw deliveryFailed(email, e);
        }
        if (delivery == null) {
            throw deliveryFailed(email, new IllegalStateException("OtpMailSender returned no result"));
        }

        try {
            delivery.join();
        } catch (CompletionException e) {
            throw deliveryFailed(email, e.getCause() != null ? e.getCause() : e);
        } catch (CancellationException e) {
            throw deliveryFailed(email, e);
        }
    }

    // 스택트레이스는 GlobalExceptionHandler가 5xx로 한 번만 남긴다
    private static ApiException deliveryFailed(String email, Throwable cause) {
        log.warn("OTP mail delivery failed. email={}", email);
        return new ApiException(ErrorCode.OTP_DELIVERY_FAILED, cause);
    }
}
