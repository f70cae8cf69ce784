package com.otpauth.backend.otp.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.mail.MailSendException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.otpauth.backend.global.ErrorCode;
import com.otpauth.backend.otp.mail.OtpMailSender;
import com.otpauth.backend.otp.service.OtpCodeGenerator;
import com.otpauth.backend.security.MasterKeyAuthenticationFilter;

@ActiveProfiles("test")            // application-test.yml (H2 + log sender + 테스트용 master key)
@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("[OTP] challenge/verify HTTP 흐름")
class OtpAuthFlowIntegrationTest {

    private static final String EMAIL = "user@example.com";
    private static final String FIXED_OTP = "482913";
    private static final String MASTER_KEY = "test-master-key-0123456789abcdef";

    // 코드는 고정, 메일은 호출 여부만 본다
    @MockitoBean OtpCodeGenerator otpCodeGenerator;
    @MockitoBean OtpMailSender otpMailSender;

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper om;
    @Autowired JdbcTemplate jdbc;

    @BeforeEach
    void setUp() {
        jdbc.update("DELETE FROM otp");
        when(otpCodeGenerator.generate6Digits()).thenReturn(FIXED_OTP);
        when(otpMailSender.sendOtp(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
    }

    private ResultActions challenge(String email) throws Exception {
        return mvc.perform(post("/auth/otp/challenge")
                .contentType(MediaType.APPLICATION_JSON)
                .content(om.writeValueAsString(Map.of("email", email))));
    }

    private ResultActions verifyOtp(String email, String otp) throws Exception {
        return mvc.perform(post("/auth/otp/verify")
                .contentType(MediaType.APPLICATION_JSON)
                .content(om.writeValueAsString(Map.of("email", email, "otp", otp))));
    }

    private static void expectError(ResultActions actions, ErrorCode code) throws Exception {
        actions.andExpect(status().is(code.status().value()))
                .andExpect(jsonPath("$.code").value(code.name()));
    }

    private int otpRows() {
        Integer n = jdbc.queryForObject("SELECT COUNT(*) FROM otp", Integer.class);
        return n == null ? 0 : n;
    }

    @Nested
    @DisplayName("Challenge")
    class Challenge {

        @Test
        @DisplayName("200 {ok:true}, 코드는 응답에 없고 메일로만 나간다")
        void issues_and_sends() throws Exception {
            challenge(EMAIL)
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.ok").value(true))
                    .andExpect(jsonPath("$.otp").doesNotExist());

            verify(otpMailSender).sendOtp(EMAIL, FIXED_OTP);
            assertThat(otpRows()).isEqualTo(1);
        }

        @Test
        @DisplayName("두 번 요청해도 레코드는 1개")
        void reissue_keeps_single_row() throws Exception {
            challenge(EMAIL).andExpect(status().isOk());
            challenge(EMAIL).andExpect(status().isOk());

            assertThat(otpRows()).isEqualTo(1);
        }

        @Test
        @DisplayName("이메일 형식 오류 → 400 VALIDATION_ERROR")
        void rejects_bad_body() throws Exception {
            expectError(challenge("not-an-email"), ErrorCode.VALIDATION_ERROR);
            verify(otpMailSender, never()).sendOtp(anyString(), anyString());
        }

        @Test
        @DisplayName("메일 발송 실패 → 502 OTP_DELIVERY_FAILED, 원인 스택트레이스는 한 번만 로그")
        @ExtendWith(OutputCaptureExtension.class)
        void delivery_failure(CapturedOutput output) throws Exception {
            when(otpMailSender.sendOtp(anyString(), anyString()))
                    .thenReturn(CompletableFuture.failedFuture(new MailSendException("smtp down")));

            expectError(challenge(EMAIL), ErrorCode.OTP_DELIVERY_FAILED);

            assertThat(StringUtils.countOccurrencesOf(output.getAll(), "MailSendException: smtp down")).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Verify")
    class Verify {

        @Test
        @DisplayName("틀림 → 400 OTP_INVALID(남은 횟수), 맞음 → 204, 재사용 → 400 OTP_NOT_FOUND")
        void wrong_then_right_then_reuse() throws Exception {
            challenge(EMAIL).andExpect(status().isOk());

            expectError(verifyOtp(EMAIL, "111111"), ErrorCode.OTP_INVALID);
            verifyOtp(EMAIL, "111111").andExpect(jsonPath("$.details.attemptsRemaining").value(1));

            verifyOtp(EMAIL, FIXED_OTP).andExpect(status().isNoContent());
            assertThat(otpRows()).isZero();

            expectError(verifyOtp(EMAIL, FIXED_OTP), ErrorCode.OTP_NOT_FOUND);
        }

        @Test
        @DisplayName("세 번 틀리면 429 OTP_ATTEMPTS_EXHAUSTED, 레코드 삭제")
        void exhausts() throws Exception {
            challenge(EMAIL).andExpect(status().isOk());

            expectError(verifyOtp(EMAIL, "111111"), ErrorCode.OTP_INVALID);
            expectError(verifyOtp(EMAIL, "111111"), ErrorCode.OTP_INVALID);
            expectError(verifyOtp(EMAIL, "111111"), ErrorCode.OTP_ATTEMPTS_EXHAUSTED);

            assertThat(otpRows()).isZero();
        }

        @Test
        @DisplayName("발급 이력 없음 → 400 OTP_NOT_FOUND")
        void not_found() throws Exception {
            expectError(verifyOtp(EMAIL, FIXED_OTP), ErrorCode.OTP_NOT_FOUND);
        }

        @Test
        @DisplayName("otp가 6자리 숫자가 아니면 400 VALIDATION_ERROR, 시도 횟수는 그대로")
        void rejects_malformed_code() throws Exception {
            challenge(EMAIL).andExpect(status().isOk());

            expectError(verifyOtp(EMAIL, "12ab"), ErrorCode.VALIDATION_ERROR);

            Integer attempts = jdbc.queryForObject("SELECT attempts FROM otp WHERE email = ?", Integer.class, EMAIL);
            assertThat(attempts).isZero();
        }
    }

    @Nested
    @DisplayName("Master key")
    class MasterKey {

        @Test
        @DisplayName("올바른 X-Master-Key → 코드 검증 없이 204, 저장소 변화 없음")
        void bypasses_verification() throws Exception {
            challenge(EMAIL).andExpect(status().isOk());

            mvc.perform(post("/auth/otp/verify")
                            .header(MasterKeyAuthenticationFilter.HEADER, MASTER_KEY)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(om.writeValueAsString(Map.of("email", EMAIL, "otp", "000000"))))
                    .andExpect(status().isNoContent());

            assertThat(otpRows()).isEqualTo(1);
        }

        @Test
        @DisplayName("틀린 X-Master-Key → 401 MASTER_KEY_INVALID")
        void wrong_key() throws Exception {
            expectError(mvc.perform(post("/auth/otp/verify")
                            .header(MasterKeyAuthenticationFilter.HEADER, "nope")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(om.writeValueAsString(Map.of("email", EMAIL, "otp", "000000")))),
                    ErrorCode.MASTER_KEY_INVALID);
        }

        @Test
        @DisplayName("바디에 신뢰 플래그를 넣어도 무시된다")
        void body_flag_is_ignored() throws Exception {
            expectError(mvc.perform(post("/auth/otp/verify")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"email\":\"" + EMAIL + "\",\"otp\":\"000000\",\"isMaster\":true}")),
                    ErrorCode.OTP_NOT_FOUND);
        }
    }

    @Test
    @DisplayName("OTP 엔드포인트 외에는 열려 있지 않다 → 401 AUTH_REQUIRED")
    void other_paths_are_closed() throws Exception {
        expectError(mvc.perform(get("/otp")), ErrorCode.AUTH_REQUIRED);
    }
}
