package com.otpauth.backend.security;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import com.otpauth.backend.global.ErrorCode;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * X-Master-Key 헤더로 관리자 호출을 인증하는 필터
 *
 * - 헤더가 없으면 아무것도 하지 않는다. (일반 클라이언트 요청)
 * - 헤더가 있고 서버 설정 app.otp.master-key와 일치하면 MasterPrincipal(ROLE_MASTER)을 SecurityContext에 넣는다.
 * - 헤더가 있는데 틀렸거나 서버에 master key가 설정되지 않았으면 여기서 401 MASTER_KEY_INVALID로 끝낸다.
 *   (틀린 키를 "일반 요청"으로 흘려보내지 않는다)
 */
public class MasterKeyAuthenticationFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Master-Key";

    private final byte[] masterKey;
    private final SecurityErrorWriter errorWriter;

    public MasterKeyAuthenticationFilter(String masterKey, SecurityErrorWriter errorWriter) {
        this.masterKey = (masterKey == null || masterKey.isBlank())
                ? null
                : masterKey.getBytes(StandardCharsets.UTF_8);
        this.errorWriter = errorWriter;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String presented = request.getHeader(HEADER);
        if (presented == null) {
            filterChain.doFilter(request, response);
            return;
        }

        if (!matches(presented)) {
            SecurityContextHolder.clearContext();
            errorWriter.write(response, ErrorCode.MASTER_KEY_INVALID);
            return;
        }

        var authentication = new UsernamePasswordAuthenticationToken(
                new MasterPrincipal("master"),
                null,
                List.of(new SimpleGrantedAuthority(MasterPrincipal.ROLE))
        );
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        filterChain.doFilter(request, response);
    }

    // 상수 시간 비교
    private boolean matches(String presented) {
        if (masterKey == null) {
            return false;
        }
        return MessageDigest.isEqual(masterKey, presented.getBytes(StandardCharsets.UTF_8));
    }
}
