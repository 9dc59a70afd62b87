package com.ids.authgate.security.exception;

public enum ErrorCode {

    // 400 Bad Request
    VALIDATION_FAILED("VALIDATION_FAILED", 400, "입력값 검증에 실패했습니다."),

    // 401 Unauthorized
    AUTHENTICATION_FAILED("AUTHENTICATION_FAILED", 401, "유효하지 않은 자격 증명 또는 토큰으로 인해 인증에 실패했습니다."),
    INVALID_CREDENTIAL("INVALID_CREDENTIAL", 401, "비밀번호가 일치하지 않습니다."),
    INVALID_TOKEN("INVALID_TOKEN", 401, "토큰이 유효하지 않거나 만료되었습니다."),

    // 403 Forbidden
    ACCESS_DENIED("ACCESS_DENIED", 403, "이 리소스에 접근할 권한이 없습니다."),

    // 404 Not Found
    USER_NOT_FOUND("USER_NOT_FOUND", 404, "사용자를 찾을 수 없습니다."),
    ROLE_NOT_FOUND("ROLE_NOT_FOUND", 404, "역할을 찾을 수 없습니다."),

    // 500 Internal Server Error
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", 500, "보안 설정 중 구성 오류가 발생했습니다.");

    private final String code;
    private final int httpStatus;
    private final String defaultMessage;

    ErrorCode(String code, int httpStatus, String defaultMessage) {
        this.code = code;
        this.httpStatus = httpStatus;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
