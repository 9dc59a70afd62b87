package com.ids.authgate.security.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ids.authgate.security.authentication.AuthGateAuthentication;
import com.ids.authgate.security.authentication.AuthenticationEngine;
import com.ids.authgate.security.authentication.AuthenticationResult;
import com.ids.authgate.security.config.TokenProperties;
import com.ids.authgate.security.exception.ErrorCode;
import com.ids.authgate.security.util.HttpCredentialUtil;
import com.ids.authgate.security.util.SecurityHandlerUtil;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.util.matcher.RequestMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * 인증 토큰으로 보호되는 경로에서 헤더 또는 쿼리 파라미터의 토큰을 검증하는 필터입니다.
 * <p>
 * 헤더와 쿼리 파라미터가 모두 있으면 헤더가 우선합니다. 토큰 검증 중 어떤 오류가 나더라도
 * 인증 실패로 처리하며, 이 경우 401 JSON 응답을 보내고 체인을 중단합니다.
 * </p>
 */
@Slf4j
public class TokenAuthenticationFilter extends OncePerRequestFilter {

    private final AuthenticationEngine authenticationEngine;
    private final RequestMatcher requestMatcher;
    private final TokenProperties tokenProperties;
    private final ObjectMapper objectMapper;

    public TokenAuthenticationFilter(AuthenticationEngine authenticationEngine,
                                     RequestMatcher requestMatcher,
                                     TokenProperties tokenProperties,
                                     ObjectMapper objectMapper) {
        this.authenticationEngine = authenticationEngine;
        this.requestMatcher = requestMatcher;
        this.tokenProperties = tokenProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !requestMatcher.matches(request);
    }

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException
    {
        AuthenticationResult result = HttpCredentialUtil.resolveToken(
                request.getHeader(tokenProperties.getHeaderName()),
                request.getParameter(tokenProperties.getQueryParameter()))
            .map(authenticationEngine::authenticateToken)
            .orElseGet(AuthenticationResult::failure);

        if (!result.authenticated()) {
            SecurityContextHolder.clearContext();
            log.debug("[Filter] 토큰 인증 실패: {}", request.getRequestURI());
            SecurityHandlerUtil.sendJsonResponse(response, objectMapper, ErrorCode.AUTHENTICATION_FAILED);
            return;
        }

        SecurityContext securityContext = SecurityContextHolder.createEmptyContext();
        securityContext.setAuthentication(new AuthGateAuthentication(result.principal(), AuthGateAuthentication.TOKEN));
        SecurityContextHolder.setContext(securityContext);
        log.debug("[Filter] SecurityContext에 토큰 인증 사용자 '{}' 등록 완료.", result.principal().getId());

        filterChain.doFilter(request, response);
    }
}
