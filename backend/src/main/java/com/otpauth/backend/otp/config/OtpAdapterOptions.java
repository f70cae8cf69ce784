package com.otpauth.backend.otp.config;

import com.otpauth.backend.otp.OtpAuthAdapter;

/**
 * 호스트가 어댑터를 등록할 때 넘기는 설정 묶음
 * - module은 실제로 생성된 어댑터 인스턴스여야 한다. (다른 인스턴스를 엮는 설정 실수 방지)
 */
public record OtpAdapterOptions(OtpOptions options, OtpAuthAdapter module) {}
