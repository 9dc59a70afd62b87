package com.ids.authgate.security.exception;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ids.authgate.security.config.AuthGateSecurityConstants;
import com.ids.authgate.security.config.ErrorProperties;
import com.ids.authgate.security.util.SecurityHandlerUtil;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;

/**
 * 인증(Authentication) 과정에서 실패하는 경우 호출되는 핸들러 AuthGateSecurityException 예외를 캐치하여 ErrorCode에 맞는 HTTP 응답을 생성
 * <p>
 * 리다이렉트 모드에서는 원래 요청 경로를 {@code next} 파라미터로 붙여 로그인 후 돌아올 수 있게 합니다.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class AuthGateAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;
    private final ErrorProperties errorProperties;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
        throws IOException, ServletException {
        // AuthGateSecurityException이 원인인 경우, 해당 예외에서 errorCode를 추출
        if (authException.getCause() instanceof AuthGateSecurityException cause) {
            log.debug("AuthGateAuthenticationEntryPoint: 인증 실패 - AuthGateSecurityException 발생 = {}, {}",
                cause.getErrorCode(), cause.getMessage());
        }

        // 페이지 이동 모드: true 시 브라우저 주소창을 실패 URL로 리다이렉트 (HTML 렌더링 환경)
        if (errorProperties.isRedirectEnabled()) {
            // AJAX 요청이고 ajaxReturnsJson이 true면 JSON 응답
            if (errorProperties.isAjaxReturnsJson() && SecurityHandlerUtil.isAjaxRequest(request)) {
                log.debug("AuthGateAuthenticationEntryPoint: AJAX 요청 - JSON 응답 반환");
                SecurityHandlerUtil.sendJsonResponse(response, objectMapper, ErrorCode.AUTHENTICATION_FAILED);
                return;
            }

            String redirectUrl = determineRedirectUrl(request);
            log.debug("AuthGateAuthenticationEntryPoint: 인증 실패 - 리다이렉트 URL: {}", redirectUrl);
            response.sendRedirect(redirectUrl);
            return;
        }

        // API 모드: 기본 401 JSON 응답
        SecurityHandlerUtil.sendJsonResponse(response, objectMapper, ErrorCode.AUTHENTICATION_FAILED);
    }

    /**
     * 세션 만료 여부에 따라 리다이렉트 URL을 결정합니다.
     */
    private String determineRedirectUrl(HttpServletRequest request) {
        if (isSessionExpired(request)) {
            log.debug("AuthGateAuthenticationEntryPoint: 세션 만료 감지");
            return errorProperties.getEffectiveSessionExpiredRedirectUrl();
        }
        return UriComponentsBuilder.fromUriString(errorProperties.getAuthenticationFailedRedirectUrl())
            .queryParam(AuthGateSecurityConstants.NEXT_PARAMETER, originalPath(request))
            .encode()
            .build()
            .toUriString();
    }

    private String originalPath(HttpServletRequest request) {
        String query = request.getQueryString();
        return query == null ? request.getRequestURI() : request.getRequestURI() + "?" + query;
    }

    /**
     * 세션이 만료되었는지 확인합니다.
     * 요청에 세션 ID가 있지만 유효하지 않은 경우 세션이 만료된 것으로 판단합니다.
     */
    private boolean isSessionExpired(HttpServletRequest request) {
        String requestedSessionId = request.getRequestedSessionId();
        if (requestedSessionId != null) {
            HttpSession session = request.getSession(false);
            return session == null || !request.isRequestedSessionIdValid();
        }
        return false;
    }
}
