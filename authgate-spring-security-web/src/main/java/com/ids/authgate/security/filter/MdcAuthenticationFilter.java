package com.ids.authgate.security.filter;

import com.ids.authgate.security.authentication.AuthGateAuthentication;
import com.ids.authgate.security.config.AuthGateSecurityProperties;
import com.ids.authgate.security.config.LoggingProperties;
import com.ids.authgate.security.logging.LoggingContextAccessor;
import com.ids.authgate.security.logging.LoggingContextKeys;
import com.ids.authgate.security.model.SecurityPrincipal;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.RememberMeAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * 인증 완료 후 사용자 정보를 MDC에 추가하는 필터.
 * <p>
 * SecurityFilterChain에서 인증 필터 이후에 위치해야 합니다.
 * <ul>
 *   <li>{@code userId}: 사용자 고유 ID</li>
 *   <li>{@code username}: 사용자 이메일</li>
 *   <li>{@code authType}: 인증 방식 (basic, token, session, form, remember)</li>
 * </ul>
 * <p>
 * MDC 정리는 {@link MdcRequestFilter}에서 담당합니다.
 *
 * @author LeeBongSeung
 * @see MdcRequestFilter
 */
public class MdcAuthenticationFilter extends OncePerRequestFilter {

    private static final String REMEMBER_AUTH_TYPE = "remember";

    private final LoggingContextAccessor contextAccessor;
    private final AuthGateSecurityProperties securityProperties;

    public MdcAuthenticationFilter(LoggingContextAccessor contextAccessor, AuthGateSecurityProperties securityProperties) {
        this.contextAccessor = contextAccessor;
        this.securityProperties = securityProperties;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        populateAuthenticationContext();
        chain.doFilter(request, response);
        // MDC clear는 MdcRequestFilter에서 담당
    }

    private void populateAuthenticationContext() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();

        if (auth == null || !auth.isAuthenticated()) {
            return;
        }

        if (auth instanceof AnonymousAuthenticationToken) {
            return;
        }

        LoggingProperties loggingProps = securityProperties.getLogging();

        if (auth.getPrincipal() instanceof SecurityPrincipal principal) {
            if (loggingProps.isIncludeUserId()) {
                contextAccessor.put(LoggingContextKeys.USER_ID, principal.getId());
            }
            if (loggingProps.isIncludeUsername()) {
                contextAccessor.put(LoggingContextKeys.USERNAME, principal.getUsername());
            }
        } else if (loggingProps.isIncludeUsername()) {
            // 알 수 없는 Principal 타입의 경우 이름만 저장
            contextAccessor.put(LoggingContextKeys.USERNAME, auth.getName());
        }

        if (auth instanceof AuthGateAuthentication authGateAuthentication) {
            contextAccessor.put(LoggingContextKeys.AUTH_TYPE, authGateAuthentication.getAuthType());
        } else if (auth instanceof RememberMeAuthenticationToken) {
            contextAccessor.put(LoggingContextKeys.AUTH_TYPE, REMEMBER_AUTH_TYPE);
        }
    }
}
