package com.ids.authgate.security.exception;

/**
 * 서명 불일치, 형식 오류, 만료, 지문(fingerprint) 불일치 등으로 토큰을 신뢰할 수 없을 때 발생하는 예외입니다.
 */
public class InvalidTokenException extends AuthGateSecurityException {

    public InvalidTokenException() {
        super(ErrorCode.INVALID_TOKEN);
    }

    public InvalidTokenException(String message) {
        super(ErrorCode.INVALID_TOKEN, message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(ErrorCode.INVALID_TOKEN, message, cause);
    }
}
