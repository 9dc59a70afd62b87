package com.ids.authgate.security.exception;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ids.authgate.security.util.SecurityHandlerUtil;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

/**
 * HTTP Basic 인증 실패 시 401 응답과 함께 {@code WWW-Authenticate: Basic realm="..."} 헤더를 보냅니다.
 */
@Slf4j
@RequiredArgsConstructor
public class BasicAuthenticationChallengeEntryPoint implements AuthenticationEntryPoint {

    private final RealmResolver realmResolver;
    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
        throws IOException {
        String realm = realmResolver.resolve(request);
        log.debug("BasicAuthenticationChallengeEntryPoint: Basic 인증 요구 - realm: {}", realm);
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Basic realm=\"" + realm + "\"");
        SecurityHandlerUtil.sendJsonResponse(response, objectMapper, ErrorCode.AUTHENTICATION_FAILED);
    }
}
