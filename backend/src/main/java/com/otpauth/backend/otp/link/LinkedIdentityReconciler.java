package com.otpauth.backend.otp.link;

import java.util.Optional;

import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.otpauth.backend.otp.support.EmailNormalizer;

import lombok.extern.slf4j.Slf4j;

/**
 * 사용자 기본 이메일이 바뀌었는데 OTP 연결 식별자는 옛 값인 경우를 맞춰준다.
 *
 * - reconcile()은 순수 함수. 저장은 호스트가 LinkedIdentityChangedEvent를 받아서 한다.
 * - 연결된 OTP 식별자가 없으면 할 일이 없다.
 */
@Slf4j
@Component
public class LinkedIdentityReconciler {

    public Optional<String> reconcile(String currentIdentity, String primaryEmail) {
        String primary = EmailNormalizer.canonical(primaryEmail);
        if (currentIdentity == null || primary == null || primary.isEmpty()) {
            return Optional.empty();
        }
        if (primary.equals(EmailNormalizer.canonical(currentIdentity))) {
            return Optional.empty();
        }
        return Optional.of(primary);
    }

    // 반환값이 null이 아니면 Spring이 LinkedIdentityChangedEvent로 다시 발행한다
    @EventListener
    public LinkedIdentityChangedEvent on(UserSavedEvent event) {
        return reconcile(event.linkedOtpEmail(), event.primaryEmail())
                .map(email -> {
                    log.info("Linked OTP identity out of sync, updating. userId={}", event.userId());
                    return new LinkedIdentityChangedEvent(event.userId(), email);
                })
                .orElse(null);
    }
}
