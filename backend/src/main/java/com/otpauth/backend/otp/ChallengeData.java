package com.otpauth.backend.otp;

public record ChallengeData(String email) {}
