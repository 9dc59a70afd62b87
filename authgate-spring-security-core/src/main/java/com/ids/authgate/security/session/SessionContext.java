package com.ids.authgate.security.session;

import com.ids.authgate.security.model.UserAccount;

/**
 * 로그인 세션을 보관하는 세션 계층의 추상화입니다.
 * Servlet 환경에서는 {@code HttpSession}과 remember-me 쿠키로 구현됩니다.
 */
public interface SessionContext {

    /**
     * 사용자를 세션에 바인딩합니다.
     *
     * @return 바인딩에 성공하면 true, 비활성 사용자 등으로 거부되면 false
     */
    boolean bind(UserAccount user, boolean remember);

    /**
     * remember-me 토큰을 클라이언트에 전달합니다.
     */
    void remember(String rememberToken);

    /**
     * 세션에 기록된 인증 표식(사용자 식별자, 인증 방식)을 제거합니다.
     */
    void clearIdentity();

    /**
     * 세션 바인딩을 해제합니다.
     */
    void unbind();

    /**
     * 요청한 클라이언트의 주소. 알 수 없으면 null.
     */
    String remoteAddress();
}
