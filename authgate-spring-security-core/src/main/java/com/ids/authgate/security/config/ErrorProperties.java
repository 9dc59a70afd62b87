package com.ids.authgate.security.config;

import lombok.Getter;
import lombok.Setter;

/**
 * AuthGate Security 에러 처리 관련 설정을 담는 Properties 클래스입니다.
 * <p>
 * application.yaml:
 * <pre>
 * authgate:
 *   security:
 *     error:
 *       redirect-enabled: true  # true면 리다이렉트 (풀스택), false면 JSON 응답 (API)
 *       ajax-returns-json: true  # AJAX 요청은 리다이렉트 대신 JSON 응답
 *       authentication-failed-redirect-url: /login
 *       session-expired-redirect-url: /login?expired=true
 * </pre>
 * </p>
 */
@Getter
@Setter
public class ErrorProperties {

    /**
     * 에러 발생 시 리다이렉트 활성화 여부
     * true: 리다이렉트 (풀스택 모드)
     * false: JSON 응답 (API 모드) - 기본값
     */
    private boolean redirectEnabled = false;

    /**
     * AJAX 요청 시 JSON 응답 반환 여부
     */
    private boolean ajaxReturnsJson = false;

    /**
     * 인증 실패 시 리다이렉트할 URL (redirectEnabled가 true일 때 사용)
     */
    private String authenticationFailedRedirectUrl = "/login";

    /**
     * 세션 만료 시 리다이렉트할 URL. 설정하지 않으면 authenticationFailedRedirectUrl 사용
     */
    private String sessionExpiredRedirectUrl;

    public String getEffectiveSessionExpiredRedirectUrl() {
        return sessionExpiredRedirectUrl != null ? sessionExpiredRedirectUrl : authenticationFailedRedirectUrl;
    }
}
