package com.otpauth.backend.otp.config;

import java.security.SecureRandom;
import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.otpauth.backend.otp.OtpAuthAdapter;
import com.otpauth.backend.otp.mail.OtpMailSender;
import com.otpauth.backend.otp.repo.OtpSchemaManager;
import com.otpauth.backend.otp.service.OtpChallengeService;
import com.otpauth.backend.otp.service.OtpVerificationService;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
@EnableConfigurationProperties(OtpProperties.class)
public class OtpModuleConfig {

    // 만료 시각은 UTC 기준 LocalDateTime으로 저장
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SecureRandom secureRandom() {
        // getInstanceStrong()는 환경에 따라 블로킹될 수 있어서 new SecureRandom()을 쓴다
        return new SecureRandom();
    }

    @Bean
    public OtpOptions otpOptions(OtpProperties props, OtpMailSender otpMailSender) {
        return new OtpOptions(props.validityMs(), props.maxAttempts(), otpMailSender, props.conflictRetries());
    }

    /**
     * 어댑터 생성 = 설정 검증 + 스키마 준비까지 끝난 상태
     * - 여기서 실패하면 컨텍스트가 뜨지 않으므로 challenge/verify가 잘못된 설정으로 실행될 일이 없다.
     */
    @Bean
    public OtpAuthAdapter otpAuthAdapter(OtpChallengeService challengeService,
                                         OtpVerificationService verificationService,
                                         OtpSchemaManager schemaManager,
                                         OtpOptions otpOptions,
                                         OtpProperties props) {
        OtpAuthAdapter adapter = new OtpAuthAdapter(challengeService, verificationService, schemaManager);
        adapter.validateOptions(new OtpAdapterOptions(otpOptions, adapter));

        if (props.schema().autoCreate()) {
            adapter.ensureSchema();
        } else {
            log.info("OTP schema auto-create disabled, expecting table '{}' to exist", OtpSchemaManager.TABLE_NAME);
        }

        if (!props.masterKeyConfigured()) {
            log.info("No master key configured, privileged OTP bypass is unavailable");
        }
        return adapter;
    }
}
