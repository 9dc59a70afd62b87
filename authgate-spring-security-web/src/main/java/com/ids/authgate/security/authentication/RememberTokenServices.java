package com.ids.authgate.security.authentication;

import com.ids.authgate.security.session.HttpSessionContextFactory;
import com.ids.authgate.security.util.CookieUtil;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.RememberMeAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.authentication.RememberMeServices;

/**
 * remember-me 쿠키의 서명된 토큰으로 세션 없는 요청을 인증하는 {@link RememberMeServices} 구현체입니다.
 * <p>
 * 토큰이 유효하면 사용자를 세션에 다시 바인딩하여 다음 요청부터는 세션으로 인증되게 합니다.
 * 비밀번호가 바뀌었거나 서명이 맞지 않는 토큰은 쿠키를 삭제합니다. 토큰 발급은
 * {@link LoginSuccessHandler}가 세션 로그인 과정에서 수행하므로 {@link #loginSuccess}는 아무 일도 하지 않습니다.
 * </p>
 */
@Slf4j
public class RememberTokenServices implements RememberMeServices {

    private final AuthenticationEngine authenticationEngine;
    private final HttpSessionContextFactory sessionContextFactory;
    private final String key;

    public RememberTokenServices(AuthenticationEngine authenticationEngine,
                                 HttpSessionContextFactory sessionContextFactory,
                                 String key) {
        this.authenticationEngine = authenticationEngine;
        this.sessionContextFactory = sessionContextFactory;
        this.key = key;
    }

    @Override
    public Authentication autoLogin(HttpServletRequest request, HttpServletResponse response) {
        Optional<String> token = CookieUtil.getCookieValue(request, sessionContextFactory.getRememberCookieName());
        if (token.isEmpty() || token.get().isBlank()) {
            return null;
        }

        AuthenticationResult result = authenticationEngine.authenticateRememberToken(token.get());
        if (!result.authenticated()) {
            log.debug("[RememberMe] remember-me 토큰이 유효하지 않아 쿠키를 삭제합니다.");
            CookieUtil.deleteCookie(response, sessionContextFactory.getRememberCookieName());
            return null;
        }

        sessionContextFactory.create(request, response).bind(result.user(), true);
        log.debug("[RememberMe] remember-me 토큰으로 사용자 '{}' 복원 완료.", result.principal().getId());
        return new RememberMeAuthenticationToken(key, result.principal(), result.principal().getAuthorities());
    }

    @Override
    public void loginFail(HttpServletRequest request, HttpServletResponse response) {
        CookieUtil.deleteCookie(response, sessionContextFactory.getRememberCookieName());
    }

    @Override
    public void loginSuccess(HttpServletRequest request, HttpServletResponse response, Authentication successfulAuthentication) {
        // LoginSuccessHandler에서 발급
    }

    public String getKey() {
        return key;
    }
}
