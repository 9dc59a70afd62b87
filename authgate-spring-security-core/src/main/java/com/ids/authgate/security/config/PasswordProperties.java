package com.ids.authgate.security.config;

import lombok.Getter;
import lombok.Setter;

/**
 * 비밀번호 해시 관련 설정입니다.
 * <p>
 * HMAC 사전 해시를 켜면 원문 비밀번호를 {@code HMAC(salt, password)}로 변환한 뒤 Base64로 인코딩하여
 * 적응형 해시(BCrypt)에 전달합니다. 이 경우 salt는 필수입니다.
 * </p>
 */
@Getter
@Setter
public class PasswordProperties {

    private String salt;

    private boolean hmacEnabled = false;

    /** javax.crypto Mac 알고리즘 이름 (HmacSHA256, HmacSHA512 등) */
    private String hmacAlgorithm = "HmacSHA256";
}
