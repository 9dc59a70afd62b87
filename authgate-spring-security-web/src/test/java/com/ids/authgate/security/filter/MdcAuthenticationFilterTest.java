package com.ids.authgate.security.filter;

import com.ids.authgate.security.authentication.AuthGateAuthentication;
import com.ids.authgate.security.config.AuthGateSecurityProperties;
import com.ids.authgate.security.logging.LoggingContextAccessor;
import com.ids.authgate.security.logging.LoggingContextKeys;
import com.ids.authgate.security.model.SecurityPrincipal;
import jakarta.servlet.FilterChain;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.RememberMeAuthenticationToken;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Collections;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MdcAuthenticationFilterTest {

    @Mock
    private LoggingContextAccessor contextAccessor;

    @Mock
    private HttpServletRequest request;

    @Mock
    private HttpServletResponse response;

    @Mock
    private FilterChain filterChain;

    private AuthGateSecurityProperties securityProperties;
    private MdcAuthenticationFilter mdcAuthenticationFilter;

    @BeforeEach
    void setUp() {
        securityProperties = new AuthGateSecurityProperties();
        mdcAuthenticationFilter = new MdcAuthenticationFilter(contextAccessor, securityProperties);
        SecurityContextHolder.clearContext();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Nested
    class 정상_케이스 {

        @Test
        void SecurityPrincipal_로그인_시_사용자_정보가_MDC에_저장된다() throws Exception {
            // Given
            SecurityPrincipal principal = SecurityPrincipal.authenticated("user-123", "matt@lp.com", List.of("admin"));
            SecurityContextHolder.getContext().setAuthentication(new AuthGateAuthentication(principal, AuthGateAuthentication.TOKEN));

            // When
            mdcAuthenticationFilter.doFilter(request, response, filterChain);

            // Then
            verify(contextAccessor).put(LoggingContextKeys.USER_ID, "user-123");
            verify(contextAccessor).put(LoggingContextKeys.USERNAME, "matt@lp.com");
            verify(contextAccessor).put(LoggingContextKeys.AUTH_TYPE, "token");
            verify(filterChain).doFilter(request, response);
        }

        @Test
        void remember_me_인증은_authType을_remember로_기록한다() throws Exception {
            // Given
            SecurityPrincipal principal = SecurityPrincipal.authenticated("user-123", "matt@lp.com", List.of());
            SecurityContextHolder.getContext().setAuthentication(
                new RememberMeAuthenticationToken("key", principal, AuthorityUtils.NO_AUTHORITIES));

            // When
            mdcAuthenticationFilter.doFilter(request, response, filterChain);

            // Then
            verify(contextAccessor).put(LoggingContextKeys.USER_ID, "user-123");
            verify(contextAccessor).put(LoggingContextKeys.AUTH_TYPE, "remember");
        }

        @Test
        void 알_수_없는_Principal은_이름만_저장한다() throws Exception {
            // Given
            SecurityContextHolder.getContext().setAuthentication(
                UsernamePasswordAuthenticationToken.authenticated("plain-user", null, Collections.emptyList()));

            // When
            mdcAuthenticationFilter.doFilter(request, response, filterChain);

            // Then
            verify(contextAccessor).put(LoggingContextKeys.USERNAME, "plain-user");
            verify(contextAccessor, never()).put(eq(LoggingContextKeys.USER_ID), anyString());
        }
    }

    @Nested
    class 바운더리_케이스 {

        @Test
        void 인증_정보가_없으면_MDC에_저장하지_않는다() throws Exception {
            // When
            mdcAuthenticationFilter.doFilter(request, response, filterChain);

            // Then
            verifyNoInteractions(contextAccessor);
            verify(filterChain).doFilter(request, response);
        }

        @Test
        void 익명_사용자는_MDC에_저장하지_않는다() throws Exception {
            // Given
            SecurityContextHolder.getContext().setAuthentication(new AnonymousAuthenticationToken(
                "key", "anonymousUser", AuthorityUtils.createAuthorityList("ROLE_ANONYMOUS")));

            // When
            mdcAuthenticationFilter.doFilter(request, response, filterChain);

            // Then
            verifyNoInteractions(contextAccessor);
        }

        @Test
        void userId_설정이_비활성화되면_저장하지_않는다() throws Exception {
            // Given
            securityProperties.getLogging().setIncludeUserId(false);
            SecurityPrincipal principal = SecurityPrincipal.authenticated("user-123", "matt@lp.com", List.of());
            SecurityContextHolder.getContext().setAuthentication(new AuthGateAuthentication(principal, AuthGateAuthentication.SESSION));

            // When
            mdcAuthenticationFilter.doFilter(request, response, filterChain);

            // Then
            verify(contextAccessor, never()).put(eq(LoggingContextKeys.USER_ID), anyString());
            verify(contextAccessor).put(LoggingContextKeys.USERNAME, "matt@lp.com");
        }
    }
}
