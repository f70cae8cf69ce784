package com.otpauth.backend.otp.mail;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import com.otpauth.backend.otp.config.OtpProperties;

/**
 * JavaMailSender 기반 OTP 메일 발송
 *
 * - 비즈니스 서비스가 아닌 "외부 I/O 어댑터". 메일 발송이라는 기술적 관심사만 담당
 * - SMTP 호출은 전용 스레드 풀(otp-mail-*)에서 실행되고, 결과는 CompletableFuture로 돌려준다.
 * - 풀은 이 빈이 직접 만들고 닫는다. Executor 빈으로 등록하면 Boot 기본 applicationTaskExecutor가 빠진다.
 */
@Component
@ConditionalOnProperty(prefix = "app.otp.mail", name = "sender", havingValue = "smtp", matchIfMissing = true)
public class SmtpOtpMailSender implements OtpMailSender, DisposableBean {

    static final String THREAD_PREFIX = "otp-mail-";

    private final JavaMailSender mailSender;
    private final OtpProperties props;
    private final Executor executor;
    private final ThreadPoolTaskExecutor ownedPool;

    @Autowired
    public SmtpOtpMailSender(JavaMailSender mailSender, OtpProperties props) {
        this(mailSender, props, newMailPool());
    }

    // 테스트용: 호출 스레드에서 바로 실행하는 Executor 등을 넣는다
    SmtpOtpMailSender(JavaMailSender mailSender, OtpProperties props, Executor executor) {
        this.mailSender = mailSender;
        this.props = props;
        this.executor = executor;
        this.ownedPool = executor instanceof ThreadPoolTaskExecutor ? (ThreadPoolTaskExecutor) executor : null;
    }

    private static ThreadPoolTaskExecutor newMailPool() {
        ThreadPoolTaskExecutor pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(2);
        pool.setMaxPoolSize(8);
        pool.setQueueCapacity(200);
        pool.setThreadNamePrefix(THREAD_PREFIX);
        pool.initialize();
        return pool;
    }

    @Override
    public CompletableFuture<Void> sendOtp(String email, String code) {
        SimpleMailMessage msg = buildMessage(email, code);
        return CompletableFuture.runAsync(() -> mailSender.send(msg), executor);
    }

    SimpleMailMessage buildMessage(String email, String code) {
        long minutes = Math.max(1, Duration.ofMillis(props.validityMs()).toMinutes());

        SimpleMailMessage msg = new SimpleMailMessage();
        msg.setFrom(props.mail().from());
        msg.setTo(email);
        msg.setSubject(props.mail().subject());
        msg.setText("Your verification code: " + code + "\n\nIt expires in " + minutes + " minute(s).");
        return msg;
    }

    @Override
    public void destroy() {
        if (ownedPool != null) {
            ownedPool.shutdown();
        }
    }
}
