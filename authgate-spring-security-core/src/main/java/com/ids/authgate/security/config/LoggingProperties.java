package com.ids.authgate.security.config;

import lombok.Getter;
import lombok.Setter;

/**
 * MDC 로깅 컨텍스트 관련 설정입니다. 모든 필드는 개별적으로 활성화/비활성화가 가능합니다.
 */
@Getter
@Setter
public class LoggingProperties {

    /** 요청 추적 ID 포함 여부 (기본값: true) */
    private boolean includeTraceId = true;

    /** HTTP 메서드 포함 여부 (기본값: true) */
    private boolean includeHttpMethod = true;

    /** 요청 URI 포함 여부 (기본값: true) */
    private boolean includeRequestUri = true;

    /** 쿼리 스트링 포함 여부 (기본값: false). 토큰이 쿼리로 전달될 수 있으므로 기본으로 끕니다. */
    private boolean includeQueryString = false;

    /** 클라이언트 IP 포함 여부 (기본값: true) */
    private boolean includeClientIp = true;

    /** 사용자 ID 포함 여부 (기본값: true) */
    private boolean includeUserId = true;

    /** 사용자명(이메일) 포함 여부 (기본값: true) */
    private boolean includeUsername = true;
}
