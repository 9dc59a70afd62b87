package com.ids.authgate.security.error;

/**
 * JSON 에러 응답 본문입니다.
 */
public record ErrorResponse(String code, String message) {
}
