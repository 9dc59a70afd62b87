package com.ids.authgate.security.exception;

import java.util.List;

/**
 * 입력값 검증 규칙 중 하나 이상이 실패했을 때 발생하는 예외입니다.
 */
public class ValidationFailedException extends AuthGateSecurityException {

    private final List<String> errors;

    public ValidationFailedException(List<String> errors) {
        super(ErrorCode.VALIDATION_FAILED, String.join(", ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
