package com.ids.authgate.security.filter;

import com.ids.authgate.security.config.AuthGateSecurityProperties;
import com.ids.authgate.security.config.LoggingProperties;
import com.ids.authgate.security.logging.LoggingContextAccessor;
import com.ids.authgate.security.logging.LoggingContextKeys;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.matches;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT) // 불필요한 Stubbing 예외 방지 (헤더 조회 등)
class MdcRequestFilterTest {

    @Mock
    private LoggingContextAccessor contextAccessor;

    @Mock
    private HttpServletRequest request;

    @Mock
    private HttpServletResponse response;

    @Mock
    private FilterChain filterChain;

    private LoggingProperties loggingProperties;
    private MdcRequestFilter mdcRequestFilter;

    @BeforeEach
    void setUp() {
        AuthGateSecurityProperties securityProperties = new AuthGateSecurityProperties();
        loggingProperties = securityProperties.getLogging();
        mdcRequestFilter = new MdcRequestFilter(contextAccessor, securityProperties);
        when(request.getMethod()).thenReturn("GET");
    }

    @Nested
    class 정상_케이스 {

        @Test
        void 기본_설정일_때_필수_메타데이터가_MDC에_저장된다() throws ServletException, IOException {
            // Given
            when(request.getRequestURI()).thenReturn("/api/test");
            when(request.getRemoteAddr()).thenReturn("127.0.0.1");

            // When
            mdcRequestFilter.doFilter(request, response, filterChain);

            // Then
            verify(contextAccessor).put(eq(LoggingContextKeys.TRACE_ID), anyString());
            verify(contextAccessor).put(LoggingContextKeys.HTTP_METHOD, "GET");
            verify(contextAccessor).put(LoggingContextKeys.REQUEST_URI, "/api/test");
            verify(contextAccessor).put(LoggingContextKeys.CLIENT_IP, "127.0.0.1");
            verify(filterChain).doFilter(request, response);
            verify(contextAccessor).clear();
        }

        @Test
        void 쿼리스트링은_기본적으로_저장하지_않는다() throws ServletException, IOException {
            // Given
            when(request.getQueryString()).thenReturn("auth_token=secret");

            // When
            mdcRequestFilter.doFilter(request, response, filterChain);

            // Then
            verify(contextAccessor, never()).put(eq(LoggingContextKeys.QUERY_STRING), anyString());
        }

        @Test
        void 쿼리스트링_로깅이_활성화된_경우_MDC에_저장된다() throws ServletException, IOException {
            // Given
            loggingProperties.setIncludeQueryString(true);
            when(request.getQueryString()).thenReturn("param=value");

            // When
            mdcRequestFilter.doFilter(request, response, filterChain);

            // Then
            verify(contextAccessor).put(LoggingContextKeys.QUERY_STRING, "param=value");
        }

        @Test
        void 쿼리스트링의_토큰_파라미터_값은_가려서_저장한다() throws ServletException, IOException {
            // Given
            loggingProperties.setIncludeQueryString(true);
            when(request.getQueryString()).thenReturn("page=2&auth_token=eyJhbGciOi.secret&sort=asc");

            // When
            mdcRequestFilter.doFilter(request, response, filterChain);

            // Then
            verify(contextAccessor).put(LoggingContextKeys.QUERY_STRING, "page=2&auth_token=****&sort=asc");
        }

        @Test
        void traceId를_X_Request_Id_응답_헤더로_돌려준다() throws ServletException, IOException {
            // Given
            when(request.getHeader("X-Request-Id")).thenReturn("req-42");

            // When
            mdcRequestFilter.doFilter(request, response, filterChain);

            // Then
            verify(response).setHeader("X-Request-Id", "req-42");
        }
    }

    @Nested
    class 바운더리_케이스 {

        @Test
        void 헤더에_X_Request_Id가_있으면_해당_값을_traceId로_사용한다() throws ServletException, IOException {
            // Given
            when(request.getHeader("X-Request-Id")).thenReturn("existing-trace-id");

            // When
            mdcRequestFilter.doFilter(request, response, filterChain);

            // Then
            verify(contextAccessor).put(LoggingContextKeys.TRACE_ID, "existing-trace-id");
        }

        @Test
        void 개행이_섞인_X_Request_Id는_버리고_새로_생성한다() throws ServletException, IOException {
            // Given
            when(request.getHeader("X-Request-Id")).thenReturn("abc\nINFO forged log line");

            // When
            mdcRequestFilter.doFilter(request, response, filterChain);

            // Then
            verify(contextAccessor, never()).put(LoggingContextKeys.TRACE_ID, "abc\nINFO forged log line");
            verify(contextAccessor).put(eq(LoggingContextKeys.TRACE_ID), matches("[0-9a-f-]{36}"));
        }

        @Test
        void X_Forwarded_For_헤더가_있으면_첫번째_IP를_사용한다() throws ServletException, IOException {
            // Given
            when(request.getHeader("X-Forwarded-For")).thenReturn("203.0.113.7, 10.0.0.1");
            when(request.getRemoteAddr()).thenReturn("10.0.0.1");

            // When
            mdcRequestFilter.doFilter(request, response, filterChain);

            // Then
            verify(contextAccessor).put(LoggingContextKeys.CLIENT_IP, "203.0.113.7");
        }

        @Test
        void 체인에서_예외가_발생해도_MDC를_정리한다() throws ServletException, IOException {
            // Given
            doThrow(new ServletException("boom")).when(filterChain).doFilter(request, response);

            // When & Then
            assertThatThrownBy(() -> mdcRequestFilter.doFilter(request, response, filterChain))
                .isInstanceOf(ServletException.class);
            verify(contextAccessor).clear();
        }
    }
}
