package com.ids.authgate.security.filter;

import com.ids.authgate.security.config.AuthGateSecurityProperties;
import com.ids.authgate.security.config.LoggingProperties;
import com.ids.authgate.security.logging.LoggingContextAccessor;
import com.ids.authgate.security.logging.LoggingContextKeys;
import com.ids.authgate.security.util.SecurityHandlerUtil;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Arrays;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 요청 메타데이터를 MDC에 기록하고 traceId를 응답 헤더로 돌려주는 필터.
 * <p>
 * SecurityFilterChain 최상단에 위치하므로 Basic/토큰 인증 실패로 끝난 요청도 같은 traceId로 추적됩니다.
 * <ul>
 *   <li>{@code traceId}: 형식이 올바른 X-Request-Id 헤더 값, 아니면 새 UUID. 응답의 X-Request-Id로도 내려갑니다.</li>
 *   <li>{@code httpMethod}, {@code requestUri}, {@code clientIp}</li>
 *   <li>{@code queryString}: 켠 경우에만 기록하며 토큰 쿼리 파라미터 값은 가립니다.</li>
 * </ul>
 *
 * @author LeeBongSeung
 * @see MdcAuthenticationFilter
 */
public class MdcRequestFilter extends OncePerRequestFilter {

    static final String X_REQUEST_ID_HEADER = "X-Request-Id";
    static final String MASK = "****";

    // 개행/공백 없는 64자 이하 식별자만 수용
    private static final Pattern ACCEPTED_REQUEST_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    private final LoggingContextAccessor contextAccessor;
    private final AuthGateSecurityProperties securityProperties;

    public MdcRequestFilter(LoggingContextAccessor contextAccessor, AuthGateSecurityProperties securityProperties) {
        this.contextAccessor = contextAccessor;
        this.securityProperties = securityProperties;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        try {
            LoggingProperties logging = securityProperties.getLogging();
            if (logging.isIncludeTraceId()) {
                String traceId = resolveTraceId(request);
                contextAccessor.put(LoggingContextKeys.TRACE_ID, traceId);
                response.setHeader(X_REQUEST_ID_HEADER, traceId);
            }
            recordRequest(request, logging);
            chain.doFilter(request, response);
        } finally {
            contextAccessor.clear();
        }
    }

    private String resolveTraceId(HttpServletRequest request) {
        String requested = request.getHeader(X_REQUEST_ID_HEADER);
        if (requested != null && ACCEPTED_REQUEST_ID.matcher(requested).matches()) {
            return requested;
        }
        return UUID.randomUUID().toString();
    }

    private void recordRequest(HttpServletRequest request, LoggingProperties logging) {
        if (logging.isIncludeHttpMethod()) {
            contextAccessor.put(LoggingContextKeys.HTTP_METHOD, request.getMethod());
        }
        if (logging.isIncludeRequestUri()) {
            contextAccessor.put(LoggingContextKeys.REQUEST_URI, request.getRequestURI());
        }
        if (logging.isIncludeClientIp()) {
            contextAccessor.put(LoggingContextKeys.CLIENT_IP, SecurityHandlerUtil.getClientIp(request));
        }
        if (logging.isIncludeQueryString() && request.getQueryString() != null) {
            contextAccessor.put(LoggingContextKeys.QUERY_STRING, maskTokenParameter(request.getQueryString()));
        }
    }

    /**
     * 인증 토큰 쿼리 파라미터({@code authgate.security.token.query-parameter})의 값을 가립니다.
     */
    private String maskTokenParameter(String queryString) {
        String tokenParameter = securityProperties.getToken().getQueryParameter();
        String prefix = tokenParameter + "=";
        return Arrays.stream(queryString.split("&"))
                .map(pair -> pair.startsWith(prefix) ? prefix + MASK : pair)
                .collect(Collectors.joining("&"));
    }
}
