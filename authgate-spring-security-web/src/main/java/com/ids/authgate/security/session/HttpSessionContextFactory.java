package com.ids.authgate.security.session;

import com.ids.authgate.security.util.CookieUtil;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.time.Duration;

/**
 * 요청/응답 쌍마다 {@link HttpSessionContext}를 생성합니다.
 */
public class HttpSessionContextFactory {

    private final String rememberCookieName;
    private final int rememberMaxAge;

    public HttpSessionContextFactory(String rememberCookieName, Duration rememberWithin) {
        this.rememberCookieName = rememberCookieName;
        this.rememberMaxAge = CookieUtil.toMaxAge(rememberWithin);
    }

    public HttpSessionContext create(HttpServletRequest request, HttpServletResponse response) {
        return new HttpSessionContext(request, response, rememberCookieName, rememberMaxAge);
    }

    public String getRememberCookieName() {
        return rememberCookieName;
    }
}
