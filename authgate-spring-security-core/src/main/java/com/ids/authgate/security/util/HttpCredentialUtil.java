package com.ids.authgate.security.util;

import com.ids.authgate.security.authentication.BasicCredentials;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;
import lombok.experimental.UtilityClass;
import org.springframework.util.StringUtils;

/**
 * HTTP 인증 헤더 해석 유틸리티입니다.
 */
@UtilityClass
public class HttpCredentialUtil {

    public static final String BASIC_PREFIX = "Basic ";

    /**
     * {@code Basic base64(user:pass)} 헤더를 해석합니다. 형식이 맞지 않으면 빈 Optional을 반환합니다.
     */
    public static Optional<BasicCredentials> parseBasic(String authorizationHeader) {
        if (!StringUtils.hasText(authorizationHeader)
            || !authorizationHeader.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
            return Optional.empty();
        }

        String decoded;
        try {
            byte[] bytes = Base64.getDecoder().decode(authorizationHeader.substring(BASIC_PREFIX.length()).trim());
            decoded = new String(bytes, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }

        int delimiter = decoded.indexOf(':');
        if (delimiter < 0) {
            return Optional.empty();
        }
        return Optional.of(new BasicCredentials(decoded.substring(0, delimiter), decoded.substring(delimiter + 1)));
    }

    /**
     * 헤더 값이 있으면 헤더를, 없으면 쿼리 파라미터 값을 반환합니다.
     */
    public static Optional<String> resolveToken(String headerValue, String queryValue) {
        if (StringUtils.hasText(headerValue)) {
            return Optional.of(headerValue.trim());
        }
        if (StringUtils.hasText(queryValue)) {
            return Optional.of(queryValue.trim());
        }
        return Optional.empty();
    }
}
