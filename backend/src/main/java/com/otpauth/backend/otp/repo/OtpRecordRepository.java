package com.otpauth.backend.otp.repo;

import java.time.LocalDateTime;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.otpauth.backend.otp.domain.OtpRecord;

@Repository
public interface OtpRecordRepository extends JpaRepository<OtpRecord, Long> {

    Optional<OtpRecord> findFirstByEmailOrderByCreatedAtDescIdDesc(String email);

    long countByEmail(String email);

    // 조건부 갱신: 반환값 0 = 읽은 뒤 누군가 먼저 바꿨거나 지웠다
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update OtpRecord o
               set o.code = :code,
                   o.expiresAt = :expiresAt,
                   o.attempts = :attempts,
                   o.updatedAt = :updatedAt,
                   o.version = o.version + 1
             where o.id = :id
               and o.version = :version
            """)
    int updateIfVersionMatches(@Param("id") Long id,
                               @Param("version") long version,
                               @Param("code") String code,
                               @Param("expiresAt") LocalDateTime expiresAt,
                               @Param("attempts") int attempts,
                               @Param("updatedAt") LocalDateTime updatedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from OtpRecord o where o.id = :id and o.version = :version")
    int deleteIfVersionMatches(@Param("id") Long id, @Param("version") long version);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            delete from OtpRecord o
             where o.email = :email
               and (o.createdAt < :createdAt
                    or (o.createdAt = :createdAt and o.id < :id))
            """)
    int deleteOlderThan(@Param("email") String email,
                        @Param("createdAt") LocalDateTime createdAt,
                        @Param("id") Long id);
}
