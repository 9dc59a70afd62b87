package com.ids.authgate.security.exception;

public class InvalidCredentialException extends AuthGateSecurityException {

    public InvalidCredentialException() {
        super(ErrorCode.INVALID_CREDENTIAL);
    }

    public InvalidCredentialException(String message) {
        super(ErrorCode.INVALID_CREDENTIAL, message);
    }

    public InvalidCredentialException(String message, Throwable cause) {
        super(ErrorCode.INVALID_CREDENTIAL, message, cause);
    }
}
