package com.ids.authgate.security.exception;

public class RoleNotFoundException extends AuthGateSecurityException {

    public RoleNotFoundException() {
        super(ErrorCode.ROLE_NOT_FOUND);
    }

    public RoleNotFoundException(String message) {
        super(ErrorCode.ROLE_NOT_FOUND, message);
    }

    public RoleNotFoundException(String message, Throwable cause) {
        super(ErrorCode.ROLE_NOT_FOUND, message, cause);
    }
}
