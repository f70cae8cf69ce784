package com.otpauth.backend.otp.repo;

import java.util.Optional;

import com.otpauth.backend.otp.domain.OtpRecord;

/**
 * OTP 레코드 저장소
 *
 * 구현체가 보장해야 하는 것은 "레코드 한 건 단위의 원자성"뿐이다.
 * update/delete는 읽었을 때의 version이 그대로일 때만 반영되고,
 * 그 사이 다른 쓰기가 있었거나 레코드가 사라졌으면 OptimisticLockingFailureException을 던진다.
 */
public interface OtpRecordStore {

    /** email의 가장 최근(createdAt, id 내림차순) 레코드 */
    Optional<OtpRecord> findLatestByEmail(String email);

    OtpRecord create(OtpRecord record);

    void update(OtpRecord record);

    void delete(OtpRecord record);

    /**
     * 같은 email에서 kept보다 오래된(createdAt, id 순) 레코드를 조건 없이 지운다.
     * 동시 첫 챌린지로 생긴 중복 정리용. 지운 건수 반환
     */
    int deleteOlderThan(OtpRecord kept);

    long countByEmail(String email);
}
