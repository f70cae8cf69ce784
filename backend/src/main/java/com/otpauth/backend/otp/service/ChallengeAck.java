package com.otpauth.backend.otp.service;

/**
 * 챌린지 접수 응답. 코드는 절대 담지 않는다. (메일로만 나간다)
 */
public record ChallengeAck(boolean ok) {

    private static final ChallengeAck OK = new ChallengeAck(true);

    public static ChallengeAck accepted() {
        return OK;
    }
}
