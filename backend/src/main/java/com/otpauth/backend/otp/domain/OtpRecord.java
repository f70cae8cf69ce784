package com.otpauth.backend.otp.domain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

/**
 * 이메일에 묶인 OTP 한 건
 *
 * - email은 저장소 차원에서 유니크가 아니다. 중복이 생겨도 조회는 항상 "가장 최근(createdAt)" 한 건만 본다.
 * - attempts는 증가만 한다. 0으로 돌아가는 건 레코드가 삭제된 뒤 새로 만들어질 때뿐이다.
 * - version은 조건부 쓰기(낙관적 락)의 기준 값. 저장소가 쓰기마다 1씩 올린다.
 */
@Entity
@Table(name = "otp", indexes = @Index(name = "idx_otp_email", columnList = "email"))
public class OtpRecord {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String email;

    @Column(name = "otp", nullable = false, length = 16)
    private String code;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(nullable = false)
    private int attempts;

    @Version
    @Column(nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    protected OtpRecord() {}

    public static OtpRecord create(String email, String code, LocalDateTime expiresAt, LocalDateTime now) {
        OtpRecord r = new OtpRecord();
        r.email = email;
        r.code = code;
        r.expiresAt = expiresAt;
        r.attempts = 0;
        r.createdAt = now;
        r.updatedAt = now;
        return r;
    }

    /**
     * JPA 밖의 저장소(예: 인메모리)가 보관 중인 값으로 레코드를 다시 만든다.
     */
    public static OtpRecord restore(Long id, String email, String code, LocalDateTime expiresAt,
                                    int attempts, long version, LocalDateTime createdAt, LocalDateTime updatedAt) {
        OtpRecord r = new OtpRecord();
        r.id = id;
        r.email = email;
        r.code = code;
        r.expiresAt = expiresAt;
        r.attempts = attempts;
        r.version = version;
        r.createdAt = createdAt;
        r.updatedAt = updatedAt;
        return r;
    }

    /**
     * 새 챌린지로 코드/만료만 덮어쓴다.
     * attempts는 유지: 챌린지를 다시 요청하는 것으로 시도 횟수를 초기화할 수 없게 한다.
     */
    public void reissue(String newCode, LocalDateTime newExpiresAt, LocalDateTime now) {
        this.code = newCode;
        this.expiresAt = newExpiresAt;
        this.updatedAt = now;
    }

    /** 불일치 1회 기록 후 증가된 시도 횟수 반환 */
    public int registerFailure(LocalDateTime now) {
        this.attempts += 1;
        this.updatedAt = now;
        return this.attempts;
    }

    public boolean isExpired(LocalDateTime now) {
        return now.isAfter(expiresAt);
    }

    public boolean isExhausted(int maxAttempts) {
        return attempts >= maxAttempts;
    }

    // 상수 시간 비교 (응답 시간으로 자릿수를 추측하지 못하게)
    public boolean matches(String submittedCode) {
        if (submittedCode == null) {
            return false;
        }
        return MessageDigest.isEqual(
                code.getBytes(StandardCharsets.UTF_8),
                submittedCode.getBytes(StandardCharsets.UTF_8));
    }

    // getters
    public Long getId() { return id; }
    public String getEmail() { return email; }
    public String getCode() { return code; }
    public LocalDateTime getExpiresAt() { return expiresAt; }
    public int getAttempts() { return attempts; }
    public long getVersion() { return version; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }
}
