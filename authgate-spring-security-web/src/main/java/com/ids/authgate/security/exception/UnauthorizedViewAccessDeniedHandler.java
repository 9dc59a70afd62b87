package com.ids.authgate.security.exception;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ids.authgate.security.config.AuthGateSecurityProperties;
import com.ids.authgate.security.config.ErrorProperties;
import com.ids.authgate.security.util.FlashMessageUtil;
import com.ids.authgate.security.util.SecurityHandlerUtil;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.util.StringUtils;

import java.io.IOException;

/**
 * 인가(Authorization) 과정에서 실패하는 경우 호출되는 핸들러
 * <p>
 * 역할 정책을 만족하지 못한 요청은 플래시 메시지(활성화된 경우)와 함께
 * unauthorized-view, 같은 호스트의 Referer, "/" 순으로 리다이렉트합니다.
 * AJAX 요청이고 ajax-returns-json이 켜져 있으면 403 JSON으로 응답합니다.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class UnauthorizedViewAccessDeniedHandler implements AccessDeniedHandler {

    private static final String ROOT_PATH = "/";
    private static final String FLASH_CATEGORY = "error";

    private final ObjectMapper objectMapper;
    private final AuthGateSecurityProperties securityProperties;

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException accessDeniedException) throws IOException, ServletException {
        if (accessDeniedException.getCause() instanceof AuthGateSecurityException cause) {
            log.debug("UnauthorizedViewAccessDeniedHandler: 인가 실패 - AuthGateSecurityException 발생 = {}, {}",
                cause.getErrorCode(), cause.getMessage());
        }

        ErrorProperties errorProperties = securityProperties.getError();
        if (errorProperties.isAjaxReturnsJson() && SecurityHandlerUtil.isAjaxRequest(request)) {
            log.debug("UnauthorizedViewAccessDeniedHandler: AJAX 요청 - JSON 응답 반환");
            SecurityHandlerUtil.sendJsonResponse(response, objectMapper, ErrorCode.ACCESS_DENIED);
            return;
        }

        String redirectUrl = determineRedirectUrl(request);
        if (securityProperties.isFlashMessages()) {
            FlashMessageUtil.flash(request, response, redirectUrl, securityProperties.getUnauthorizedMessage(), FLASH_CATEGORY);
        }
        log.debug("UnauthorizedViewAccessDeniedHandler: 인가 실패 - 리다이렉트 URL: {}", redirectUrl);
        response.sendRedirect(redirectUrl);
    }

    private String determineRedirectUrl(HttpServletRequest request) {
        if (StringUtils.hasText(securityProperties.getUnauthorizedView())) {
            return securityProperties.getUnauthorizedView();
        }
        return SecurityHandlerUtil.getSameOriginReferer(request).orElse(ROOT_PATH);
    }
}
