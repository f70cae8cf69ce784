package com.otpauth.backend.otp.repo;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import com.otpauth.backend.otp.config.OtpConfigurationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * otp 테이블 준비
 *
 * - 테이블이 없을 때만 만든다. 이미 있으면 컬럼/인덱스를 절대 건드리지 않는다.
 * - 생성 도중 실패해도 그 시점에 테이블이 존재하고 모양이 맞으면(다른 인스턴스가 먼저 만든 경우 등) 로그만 남기고 넘어간다.
 * - 이미 있는 테이블에 필요한 컬럼이 빠져 있으면 OtpConfigurationException(schema)로 부팅 실패.
 * - 외부 API로 노출되는 엔드포인트가 없는 서버 내부 전용 테이블이다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OtpSchemaManager {

    public static final String TABLE_NAME = "otp";

    private static final String CREATE_TABLE = """
            CREATE TABLE otp (
                id          BIGINT       NOT NULL AUTO_INCREMENT,
                email       VARCHAR(255) NOT NULL,
                otp         VARCHAR(16)  NOT NULL,
                expires_at  TIMESTAMP(3) NOT NULL,
                attempts    INT          NOT NULL DEFAULT 0,
                version     BIGINT       NOT NULL DEFAULT 0,
                created_at  TIMESTAMP(3) NOT NULL,
                updated_at  TIMESTAMP(3) NOT NULL,
                PRIMARY KEY (id)
            )
            """;

    private static final String CREATE_EMAIL_INDEX = "CREATE INDEX idx_otp_email ON otp (email)";

    // 엔티티가 매핑하는 컬럼. 하나라도 없으면 challenge/verify가 전부 실패한다.
    static final List<String> REQUIRED_COLUMNS = List.of(
            "id", "email", "otp", "expires_at", "attempts", "version", "created_at", "updated_at");

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        if (tableExists()) {
            requireExpectedShape();
            log.info("OTP table already exists, schema left untouched");
            return;
        }

        log.info("Creating OTP table ...");
        try {
            jdbcTemplate.execute(CREATE_TABLE);
            jdbcTemplate.execute(CREATE_EMAIL_INDEX);
            log.info("OTP table setup complete");
        } catch (DataAccessException e) {
            if (!tableExists()) {
                throw e;
            }
            requireExpectedShape();
            log.warn("OTP table setup reported an error but the table exists, continuing: {}", e.getMessage());
        }
    }

    public boolean tableExists() {
        return findTableName() != null;
    }

    /**
     * 기존 테이블은 고치지 않는다. 모양이 다르면 부팅을 멈춘다.
     */
    private void requireExpectedShape() {
        Set<String> columns = existingColumns();
        List<String> missing = REQUIRED_COLUMNS.stream()
                .filter(c -> !columns.contains(c))
                .toList();
        if (!missing.isEmpty()) {
            throw new OtpConfigurationException("schema",
                    "Existing table '" + TABLE_NAME + "' is missing columns " + missing);
        }
    }

    private String findTableName() {
        return jdbcTemplate.execute((ConnectionCallback<String>) con -> {
            DatabaseMetaData meta = con.getMetaData();
            // 식별자 대소문자 처리 방식이 DB마다 달라서 둘 다 본다
            for (String candidate : List.of(TABLE_NAME, TABLE_NAME.toUpperCase(Locale.ROOT))) {
                try (ResultSet rs = meta.getTables(con.getCatalog(), null, candidate, new String[] {"TABLE"})) {
                    if (rs.next()) {
                        return rs.getString("TABLE_NAME");
                    }
                }
            }
            return null;
        });
    }

    private Set<String> existingColumns() {
        String tableName = findTableName();
        Set<String> columns = new HashSet<>();
        if (tableName == null) {
            return columns;
        }
        jdbcTemplate.execute((ConnectionCallback<Void>) con -> {
            try (ResultSet rs = con.getMetaData().getColumns(con.getCatalog(), null, tableName, null)) {
                while (rs.next()) {
                    columns.add(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
                }
            }
            return null;
        });
        return columns;
    }
}
