package com.ids.authgate.security.util;

import com.ids.authgate.security.config.CookieProperties;
import com.ids.authgate.security.exception.ConfigurationException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

@Slf4j
@UtilityClass
public class CookieUtil {

    private static final String SAME_SITE_ATTRIBUTE = "SameSite";

    private static CookieProperties properties;

    /**
     * Cookie 설정을 담당하는 프로퍼티를 주입합니다.
     * AutoConfiguration에서 초기화 시 호출됩니다.
     *
     * @param props 쿠키 설정 프로퍼티
     */
    public static void setProperties(CookieProperties props) {
        CookieUtil.properties = props;
    }

    private static Cookie createCookie(String name, String value, int maxAge) {
        if (properties == null) {
            throw new ConfigurationException("CookieProperties가 초기화되지 않았습니다. AutoConfiguration 설정을 확인하세요.");
        }

        Cookie cookie = new Cookie(name, value);
        cookie.setHttpOnly(properties.isHttpOnly());
        cookie.setSecure(properties.isSecure());
        cookie.setPath(properties.getPath());
        cookie.setMaxAge(maxAge);

        if (StringUtils.hasText(properties.getDomain())) {
            cookie.setDomain(properties.getDomain());
        }
        if (StringUtils.hasText(properties.getSameSite())) {
            cookie.setAttribute(SAME_SITE_ATTRIBUTE, properties.getSameSite());
        }

        if (log.isTraceEnabled()) {
            log.trace("쿠키 생성: name={}, domain={}, path={}, maxAge={}, secure={}, httpOnly={}", name, cookie.getDomain(), cookie.getPath(), maxAge, cookie.getSecure(), cookie.isHttpOnly());
        }

        return cookie;
    }

    /**
     * 응답에 단일 쿠키를 추가합니다.
     *
     * @param response HttpServletResponse
     * @param name     쿠키 이름
     * @param value    쿠키 값
     * @param maxAge   쿠키 만료 시간(초)
     */
    public static void addCookie(HttpServletResponse response, String name, String value, int maxAge) {
        response.addCookie(createCookie(name, value, maxAge));
    }

    /**
     * 특정 이름의 쿠키를 삭제합니다.
     */
    public static void deleteCookie(HttpServletResponse response, String name) {
        log.debug("쿠키 삭제를 위해 만료시간을 0으로 설정하여 덮어씁니다: [{}]", name);
        addCookie(response, name, null, 0);
    }

    /**
     * 요청에서 특정 이름의 쿠키 값을 조회합니다.
     *
     * @return 쿠키 값 (Optional)
     */
    public static Optional<String> getCookieValue(HttpServletRequest request, String name) {
        if (request.getCookies() == null) {
            return Optional.empty();
        }
        return Arrays.stream(request.getCookies())
            .filter(cookie -> name.equals(cookie.getName()))
            .map(Cookie::getValue)
            .findFirst();
    }

    /**
     * 유효 기간을 쿠키 Max-Age(초)로 변환합니다. null이면 -1(세션 쿠키)을 반환합니다.
     */
    public static int toMaxAge(Duration within) {
        if (within == null) {
            return -1;
        }
        return (int) Math.min(within.getSeconds(), Integer.MAX_VALUE);
    }
}
