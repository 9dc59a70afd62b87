package com.ids.authgate.security.config;

import lombok.Getter;
import lombok.Setter;

/**
 * 인증 토큰(API 접근용 bearer 토큰) 관련 설정입니다.
 */
@Getter
@Setter
public class TokenProperties {

    /** 토큰을 전달하는 요청 헤더 이름. 쿼리 파라미터보다 우선합니다. */
    private String headerName = "Authentication-Token";

    /** 토큰을 전달하는 쿼리 파라미터 이름 */
    private String queryParameter = "auth_token";

    /** 토큰 유효 기간. 설정하지 않으면 만료 없이 이메일 또는 비밀 키 변경 시에만 무효화됩니다. */
    private String within;
}
