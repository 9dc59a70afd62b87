package com.ids.authgate.security.session;

import com.ids.authgate.security.config.AuthGateSecurityConstants;
import com.ids.authgate.security.model.UserAccount;
import com.ids.authgate.security.util.CookieUtil;
import com.ids.authgate.security.util.SecurityHandlerUtil;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link HttpSession}과 remember-me 쿠키로 구현한 {@link SessionContext}입니다.
 * <p>
 * 세션에는 사용자 ID와 인증 방식만 저장합니다. 요청마다 사용자를 다시 조회하므로
 * SecurityContext 자체는 세션에 저장하지 않습니다.
 * </p>
 */
@Slf4j
public class HttpSessionContext implements SessionContext {

    private final HttpServletRequest request;
    private final HttpServletResponse response;
    private final String rememberCookieName;
    private final int rememberMaxAge;

    public HttpSessionContext(HttpServletRequest request, HttpServletResponse response,
                              String rememberCookieName, int rememberMaxAge) {
        this.request = request;
        this.response = response;
        this.rememberCookieName = rememberCookieName;
        this.rememberMaxAge = rememberMaxAge;
    }

    /**
     * 요청의 세션에 바인딩된 사용자 ID를 조회합니다. 세션을 새로 만들지 않습니다.
     */
    public static Optional<String> getBoundUserId(HttpServletRequest request) {
        HttpSession session = request.getSession(false);
        if (session == null) {
            return Optional.empty();
        }
        return Optional.ofNullable((String) session.getAttribute(AuthGateSecurityConstants.IDENTITY_NAME_ATTR));
    }

    @Override
    public boolean bind(UserAccount user, boolean remember) {
        if (!user.isActive()) {
            log.debug("[SessionManager] 비활성 사용자는 세션에 바인딩할 수 없습니다: {}", user.getId());
            return false;
        }

        // 세션 고정 공격 방지
        if (request.getSession(false) != null) {
            request.changeSessionId();
        }
        HttpSession session = request.getSession(true);
        session.setAttribute(AuthGateSecurityConstants.IDENTITY_NAME_ATTR, user.getId());
        session.setAttribute(AuthGateSecurityConstants.IDENTITY_AUTH_TYPE_ATTR, remember ? "remember" : "session");
        log.debug("[SessionManager] 세션에 사용자 바인딩 완료: {}", user.getId());
        return true;
    }

    @Override
    public void remember(String rememberToken) {
        CookieUtil.addCookie(response, rememberCookieName, rememberToken, rememberMaxAge);
        log.debug("[SessionManager] remember-me 쿠키 발급 완료.");
    }

    @Override
    public void clearIdentity() {
        HttpSession session = request.getSession(false);
        if (session == null) {
            return;
        }
        session.removeAttribute(AuthGateSecurityConstants.IDENTITY_NAME_ATTR);
        session.removeAttribute(AuthGateSecurityConstants.IDENTITY_AUTH_TYPE_ATTR);
    }

    @Override
    public void unbind() {
        HttpSession session = request.getSession(false);
        if (session != null) {
            try {
                session.invalidate();
                log.debug("[SessionManager] 세션 무효화 완료.");
            } catch (IllegalStateException e) {
                log.debug("[SessionManager] 세션이 이미 무효화되었습니다.");
            }
        }
        CookieUtil.deleteCookie(response, rememberCookieName);
    }

    @Override
    public String remoteAddress() {
        return SecurityHandlerUtil.getClientIp(request);
    }
}
