package com.otpauth.backend.otp;

/**
 * 검증 요청의 신뢰 수준
 *
 * - privileged는 클라이언트가 보낸 값에서 절대 만들지 않는다.
 *   HTTP 경로에서는 MasterKeyAuthenticationFilter가 인증한 MasterPrincipal이 있을 때만 trusted()가 된다.
 */
public final class OtpAuthContext {

    private static final OtpAuthContext CLIENT = new OtpAuthContext(false);
    private static final OtpAuthContext TRUSTED = new OtpAuthContext(true);

    private final boolean privileged;

    private OtpAuthContext(boolean privileged) {
        this.privileged = privileged;
    }

    public static OtpAuthContext client() {
        return CLIENT;
    }

    public static OtpAuthContext trusted() {
        return TRUSTED;
    }

    public boolean privileged() {
        return privileged;
    }

    @Override
    public String toString() {
        return privileged ? "OtpAuthContext[trusted]" : "OtpAuthContext[client]";
    }
}
