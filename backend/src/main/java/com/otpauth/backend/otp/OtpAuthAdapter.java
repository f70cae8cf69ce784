package com.otpauth.backend.otp;

import com.otpauth.backend.otp.config.OtpAdapterOptions;
import com.otpauth.backend.otp.config.OtpOptionsValidator;
import com.otpauth.backend.otp.repo.OtpSchemaManager;
import com.otpauth.backend.otp.service.ChallengeAck;
import com.otpauth.backend.otp.service.OtpChallengeService;
import com.otpauth.backend.otp.service.OtpVerificationService;

import lombok.extern.slf4j.Slf4j;

/**
 * 호스트 인증 시스템이 호출하는 OTP 인증 모듈의 진입점
 *
 *  - challenge(data)               : OTP 발급 + 메일 발송
 *  - verify(authData, context)     : 검증 + 1회 소비 (실패 시 ApiException)
 *  - validateOptions(options)      : 부팅 시 설정 검증 (실패 시 OtpConfigurationException)
 *  - ensureSchema()                : otp 테이블이 없을 때만 생성
 *
 * 상태를 갖지 않는다. 모든 상태는 OtpRecordStore에 있다.
 */
@Slf4j
public class OtpAuthAdapter {

    private final OtpChallengeService challengeService;
    private final OtpVerificationService verificationService;
    private final OtpSchemaManager schemaManager;

    public OtpAuthAdapter(OtpChallengeService challengeService,
                          OtpVerificationService verificationService,
                          OtpSchemaManager schemaManager) {
        this.challengeService = challengeService;
        this.verificationService = verificationService;
        this.schemaManager = schemaManager;
    }

    public ChallengeAck challenge(ChallengeData challengeData) {
        return challengeService.challenge(challengeData.email());
    }

    public void verify(OtpAuthData authData, OtpAuthContext context) {
        // 관리자 컨텍스트(계정 연결 등): 검증 자체를 건너뛴다. 저장소도 건드리지 않는다.
        if (context != null && context.privileged()) {
            log.info("OTP verification bypassed for trusted caller. email={}", authData.email());
            return;
        }
        verificationService.verify(authData.email(), authData.otp());
    }

    public void validateOptions(OtpAdapterOptions adapterOptions) {
        OtpOptionsValidator.validate(adapterOptions, this);
    }

    public void ensureSchema() {
        schemaManager.ensureSchema();
    }
}
