package com.ids.authgate.security.authentication;

import com.ids.authgate.security.session.HttpSessionContextFactory;
import com.ids.authgate.security.session.LoginSessionManager;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.authentication.logout.LogoutHandler;

/**
 * 로그아웃 시 세션의 인증 표식을 제거하고, 세션을 무효화하고, remember-me 쿠키를 삭제하는 핸들러입니다.
 */
@Slf4j
@RequiredArgsConstructor
public class SessionLogoutHandler implements LogoutHandler {

    private final LoginSessionManager sessionManager;
    private final HttpSessionContextFactory sessionContextFactory;

    @Override
    public void logout(HttpServletRequest request, HttpServletResponse response, Authentication authentication) {
        log.debug("[LogoutHandler] 로그아웃 처리를 시작합니다.");
        sessionManager.logout(sessionContextFactory.create(request, response));
        log.debug("[LogoutHandler] 로그아웃 처리 완료.");
    }
}
