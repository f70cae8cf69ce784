package com.otpauth.backend.otp.web;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.otpauth.backend.otp.ChallengeData;
import com.otpauth.backend.otp.OtpAuthAdapter;
import com.otpauth.backend.otp.OtpAuthContext;
import com.otpauth.backend.otp.OtpAuthData;
import com.otpauth.backend.otp.service.ChallengeAck;
import com.otpauth.backend.otp.web.dto.OtpChallengeRequest;
import com.otpauth.backend.otp.web.dto.OtpVerifyRequest;
import com.otpauth.backend.security.MasterPrincipal;

import lombok.RequiredArgsConstructor;

@RestController
@Validated
@RequestMapping("/auth/otp")
@RequiredArgsConstructor
public class OtpAuthController {

    private final OtpAuthAdapter otpAuthAdapter;

    @PostMapping("/challenge")
    public ResponseEntity<ChallengeAck> challenge(@RequestBody @Validated OtpChallengeRequest req) {
        return ResponseEntity.ok(otpAuthAdapter.challenge(new ChallengeData(req.email())));
    }

    /**
     * 신뢰 여부는 바디가 아니라 SecurityContext의 principal로만 판단한다.
     * (익명 요청이면 principal 타입이 달라서 null이 들어온다)
     */
    @PostMapping("/verify")
    public ResponseEntity<Void> verify(@RequestBody @Validated OtpVerifyRequest req,
                                       @AuthenticationPrincipal MasterPrincipal master) {
        OtpAuthContext context = master != null ? OtpAuthContext.trusted() : OtpAuthContext.client();
        otpAuthAdapter.verify(new OtpAuthData(req.email(), req.otp()), context);
        return ResponseEntity.noContent().build();
    }
}
