package com.otpauth.backend.otp.repo;

import java.util.Optional;

import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.otpauth.backend.otp.domain.OtpRecord;

import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;

/**
 * Spring Data JPA 기반 OtpRecordStore
 * - 메서드 하나 = 트랜잭션 하나. 여러 단계를 하나의 트랜잭션으로 묶지 않는다.
 * - 경합 감지는 version 조건이 걸린 JPQL update/delete의 영향 행 수로 한다.
 * - 돌려주는 엔티티는 detach 상태. 호출자가 값을 바꿔도 dirty checking으로 몰래 저장되지 않는다.
 */
@Component
@RequiredArgsConstructor
public class JpaOtpRecordStore implements OtpRecordStore {

    private final OtpRecordRepository repository;
    private final EntityManager entityManager;

    @Override
    @Transactional(readOnly = true)
    public Optional<OtpRecord> findLatestByEmail(String email) {
        return repository.findFirstByEmailOrderByCreatedAtDescIdDesc(email)
                .map(this::detached);
    }

    @Override
    @Transactional
    public OtpRecord create(OtpRecord record) {
        return detached(repository.saveAndFlush(record));
    }

    @Override
    @Transactional
    public void update(OtpRecord record) {
        int updated = repository.updateIfVersionMatches(
                record.getId(),
                record.getVersion(),
                record.getCode(),
                record.getExpiresAt(),
                record.getAttempts(),
                record.getUpdatedAt());
        if (updated == 0) {
            throw conflict(record);
        }
    }

    @Override
    @Transactional
    public void delete(OtpRecord record) {
        int deleted = repository.deleteIfVersionMatches(record.getId(), record.getVersion());
        if (deleted == 0) {
            throw conflict(record);
        }
    }

    @Override
    @Transactional
    public int deleteOlderThan(OtpRecord kept) {
        return repository.deleteOlderThan(kept.getEmail(), kept.getCreatedAt(), kept.getId());
    }

    @Override
    @Transactional(readOnly = true)
    public long countByEmail(String email) {
        return repository.countByEmail(email);
    }

    private OtpRecord detached(OtpRecord record) {
        entityManager.detach(record);
        return record;
    }

    private static OptimisticLockingFailureException conflict(OtpRecord record) {
        return new OptimisticLockingFailureException(
                "OTP record " + record.getId() + " changed since version " + record.getVersion());
    }
}
