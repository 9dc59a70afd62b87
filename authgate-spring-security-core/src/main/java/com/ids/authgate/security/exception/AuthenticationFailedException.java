package com.ids.authgate.security.exception;

/**
 * 요청 경계에서 인증 실패를 보고할 때 사용하는 예외입니다.
 * 세부 원인(사용자 없음, 비밀번호 불일치, 토큰 오류)은 cause로만 전달되고 응답에는 드러나지 않습니다.
 */
public class AuthenticationFailedException extends AuthGateSecurityException {

    public AuthenticationFailedException() {
        super(ErrorCode.AUTHENTICATION_FAILED);
    }

    public AuthenticationFailedException(String message) {
        super(ErrorCode.AUTHENTICATION_FAILED, message);
    }

    public AuthenticationFailedException(String message, Throwable cause) {
        super(ErrorCode.AUTHENTICATION_FAILED, message, cause);
    }
}
