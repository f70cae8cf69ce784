package com.otpauth.backend.security;

/**
 * master key로 인증된 호출자 (관리자/서버 간 호출)
 * MasterKeyAuthenticationFilter가 검증 성공 시 이 principal을 SecurityContext에 올린다.
 */
public record MasterPrincipal(String name) {

    public static final String ROLE = "ROLE_MASTER";
}
