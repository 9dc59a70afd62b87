package com.ids.authgate.security.exception;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Basic 인증 실패 응답의 {@code WWW-Authenticate} realm을 요청별로 결정합니다.
 */
@FunctionalInterface
public interface RealmResolver {

    String resolve(HttpServletRequest request);

    static RealmResolver of(String realm) {
        return request -> realm;
    }
}
