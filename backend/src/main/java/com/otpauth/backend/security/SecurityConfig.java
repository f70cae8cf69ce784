package com.otpauth.backend.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import com.otpauth.backend.otp.config.OtpProperties;

import lombok.RequiredArgsConstructor;

/**
 * Spring Security 설정
 *
 * - 세션/쿠키를 쓰지 않는 API 서버: CSRF, httpBasic, formLogin 비활성화 + STATELESS
 * - 공개 경로는 OTP challenge/verify 두 개뿐. 그 외는 전부 거부.
 *   (otp 테이블을 직접 다루는 엔드포인트는 존재하지 않는다)
 */
@Configuration
@RequiredArgsConstructor
public class SecurityConfig {

    private final SecurityErrorWriter errorWriter;
    private final OtpProperties otpProperties;

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        return http
                .csrf(csrf -> csrf.disable())
                .httpBasic(b -> b.disable())
                .formLogin(f -> f.disable())
                .logout(l -> l.disable())
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))

                .exceptionHandling(eh -> eh
                        .authenticationEntryPoint(new RestAuthEntryPoint(errorWriter))
                )

                // master key 필터: UsernamePasswordAuthenticationFilter 전에 실행
                .addFilterBefore(
                        new MasterKeyAuthenticationFilter(otpProperties.masterKey(), errorWriter),
                        UsernamePasswordAuthenticationFilter.class
                )

                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/error").permitAll()
                        .requestMatchers(HttpMethod.POST, "/auth/otp/challenge", "/auth/otp/verify").permitAll()
                        .anyRequest().denyAll()
                )
                .build();
    }
}
