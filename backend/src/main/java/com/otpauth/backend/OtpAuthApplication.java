package com.otpauth.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

/*
MailHog: http://localhost:8025/

# OTP 요청 200 {"ok":true}
curl -i -X POST "http://localhost:8080/auth/otp/challenge" \
  -H "Content-Type: application/json" \
  -d '{"email":"a@b.com"}'

# OTP 검증 204
curl -i -X POST "http://localhost:8080/auth/otp/verify" \
  -H "Content-Type: application/json" \
  -d '{"email":"a@b.com","otp":"482913"}'

# 관리자(master key) 검증 우회 204
curl -i -X POST "http://localhost:8080/auth/otp/verify" \
  -H "Content-Type: application/json" \
  -H "X-Master-Key: $APP_OTP_MASTER_KEY" \
  -d '{"email":"a@b.com","otp":"000000"}'

[DB 확인]
mysql -e "select * from otp;"
*/

/**
 * 설정 로딩 흐름: 환경변수 -> application.yml(${ENV:default}) -> @ConfigurationProperties(OtpProperties)
 *
 * - OTP 정책 값(validity-ms, max-attempts)은 OtpModuleConfig가 어댑터를 만들 때 OtpOptionsValidator로 검사한다.
 *   잘못된 값이면 웹 서버가 요청을 받기 전에 부팅 실패로 끝난다. (Fail-fast)
 * - otp 테이블은 같은 시점에 ensureSchema()로 준비된다. 타이머로 뒤늦게 만드는 방식은 쓰지 않는다.
 *
 * -> UserDetailsService 자동설정은 기본 인메모리 유저를 만들기 때문에 꺼둔다.
 */
@SpringBootApplication(exclude = {UserDetailsServiceAutoConfiguration.class})
public class OtpAuthApplication {
    public static void main(String[] args) {
        SpringApplication.run(OtpAuthApplication.class, args);
    }
}
