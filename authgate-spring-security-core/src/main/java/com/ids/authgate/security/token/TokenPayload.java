package com.ids.authgate.security.token;

/**
 * 서명된 토큰에 담기는 {@code (subject, fingerprint)} 쌍입니다.
 *
 * @param subject     사용자 식별자
 * @param fingerprint 사용자 데이터 변경 감지용 지문
 */
public record TokenPayload(String subject, String fingerprint) {
}
