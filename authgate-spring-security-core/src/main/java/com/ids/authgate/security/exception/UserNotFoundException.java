package com.ids.authgate.security.exception;

/**
 * 조회 조건에 해당하는 사용자가 저장소에 없을 때 발생하는 예외입니다.
 * 역할 변경, 활성화/비활성화 같은 관리 작업에서는 호출자에게 그대로 전파됩니다.
 */
public class UserNotFoundException extends AuthGateSecurityException {

    public UserNotFoundException() {
        super(ErrorCode.USER_NOT_FOUND);
    }

    public UserNotFoundException(String message) {
        super(ErrorCode.USER_NOT_FOUND, message);
    }

    public UserNotFoundException(String message, Throwable cause) {
        super(ErrorCode.USER_NOT_FOUND, message, cause);
    }
}
