package com.ids.authgate.security.exception;

public class AuthorizationFailedException extends AuthGateSecurityException {

    public AuthorizationFailedException() {
        super(ErrorCode.ACCESS_DENIED);
    }

    public AuthorizationFailedException(String message) {
        super(ErrorCode.ACCESS_DENIED, message);
    }

    public AuthorizationFailedException(String message, Throwable cause) {
        super(ErrorCode.ACCESS_DENIED, message, cause);
    }
}
