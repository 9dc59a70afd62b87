package com.ids.authgate.security.authentication;

import com.ids.authgate.security.model.SecurityPrincipal;
import com.ids.authgate.security.model.UserAccount;

/**
 * 인증 시도의 결과입니다. 실패한 경우 주체는 익명이고 사용자는 null입니다.
 */
public record AuthenticationResult(boolean authenticated, SecurityPrincipal principal, UserAccount user) {

    private static final AuthenticationResult FAILURE =
        new AuthenticationResult(false, SecurityPrincipal.anonymous(), null);

    public static AuthenticationResult success(UserAccount user) {
        return new AuthenticationResult(true, SecurityPrincipal.of(user), user);
    }

    public static AuthenticationResult failure() {
        return FAILURE;
    }
}
