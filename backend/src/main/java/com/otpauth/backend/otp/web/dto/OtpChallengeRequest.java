package com.otpauth.backend.otp.web.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record OtpChallengeRequest(
        @NotBlank
        @Email
        String email
) {}
