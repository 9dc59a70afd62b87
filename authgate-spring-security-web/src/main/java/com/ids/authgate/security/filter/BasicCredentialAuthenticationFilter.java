package com.ids.authgate.security.filter;

import com.ids.authgate.security.authentication.AuthGateAuthentication;
import com.ids.authgate.security.authentication.AuthenticationEngine;
import com.ids.authgate.security.authentication.AuthenticationResult;
import com.ids.authgate.security.exception.AuthenticationFailedException;
import com.ids.authgate.security.util.HttpCredentialUtil;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.InsufficientAuthenticationException;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.util.matcher.RequestMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * HTTP Basic 자격 증명으로 보호되는 경로에서 {@code Authorization} 헤더를 검증하는 필터입니다.
 * <p>
 * 인증에 실패하면 보호된 핸들러를 호출하지 않고 {@link AuthenticationEntryPoint}로
 * 401 + {@code WWW-Authenticate} 응답을 보냅니다.
 * </p>
 */
@Slf4j
public class BasicCredentialAuthenticationFilter extends OncePerRequestFilter {

    private final AuthenticationEngine authenticationEngine;
    private final RequestMatcher requestMatcher;
    private final AuthenticationEntryPoint challengeEntryPoint;

    public BasicCredentialAuthenticationFilter(AuthenticationEngine authenticationEngine,
                                               RequestMatcher requestMatcher,
                                               AuthenticationEntryPoint challengeEntryPoint) {
        this.authenticationEngine = authenticationEngine;
        this.requestMatcher = requestMatcher;
        this.challengeEntryPoint = challengeEntryPoint;
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
        AuthenticationResult result = HttpCredentialUtil.parseBasic(request.getHeader(HttpHeaders.AUTHORIZATION))
            .map(authenticationEngine::authenticateBasic)
            .orElseGet(AuthenticationResult::failure);

        if (!result.authenticated()) {
            SecurityContextHolder.clearContext();
            log.debug("[Filter] Basic 인증 실패: {}", request.getRequestURI());
            challengeEntryPoint.commence(request, response,
                new InsufficientAuthenticationException("Basic 인증 실패", new AuthenticationFailedException()));
            return;
        }

        SecurityContext securityContext = SecurityContextHolder.createEmptyContext();
        securityContext.setAuthentication(new AuthGateAuthentication(result.principal(), AuthGateAuthentication.BASIC));
        SecurityContextHolder.setContext(securityContext);
        log.debug("[Filter] SecurityContext에 Basic 인증 사용자 '{}' 등록 완료.", result.principal().getId());

        filterChain.doFilter(request, response);
    }
}
