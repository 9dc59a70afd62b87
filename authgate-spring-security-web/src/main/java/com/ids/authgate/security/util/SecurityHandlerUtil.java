package com.ids.authgate.security.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ids.authgate.security.error.ErrorResponse;
import com.ids.authgate.security.exception.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.util.Optional;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

public class SecurityHandlerUtil {

    private static final String XML_HTTP_REQUEST = "XMLHttpRequest";
    private static final String X_REQUESTED_WITH = "X-Requested-With";
    private static final String X_FORWARDED_FOR = "X-Forwarded-For";

    private SecurityHandlerUtil() {
        // Private constructor to prevent instantiation
    }

    /**
     * AJAX 요청인지 확인합니다.
     * X-Requested-With 헤더가 XMLHttpRequest이거나 Accept 헤더가 application/json인 경우 AJAX 요청으로 판단합니다.
     */
    public static boolean isAjaxRequest(HttpServletRequest request) {
        String xRequestedWith = request.getHeader(X_REQUESTED_WITH);
        String acceptHeader = request.getHeader(HttpHeaders.ACCEPT);

        return XML_HTTP_REQUEST.equals(xRequestedWith) ||
            (acceptHeader != null && acceptHeader.contains(MediaType.APPLICATION_JSON_VALUE));
    }

    /**
     * JSON 형식의 에러 응답을 전송합니다.
     */
    public static void sendJsonResponse(HttpServletResponse response, ObjectMapper objectMapper, ErrorCode errorCode) throws IOException {
        response.setStatus(errorCode.getHttpStatus());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        try (OutputStream os = response.getOutputStream()) {
            objectMapper.writeValue(os, new ErrorResponse(errorCode.getCode(), errorCode.getDefaultMessage()));
            os.flush();
        }
    }

    /**
     * 클라이언트 IP를 조회합니다. X-Forwarded-For의 첫 번째 IP가 있으면 우선합니다.
     */
    public static String getClientIp(HttpServletRequest request) {
        String xff = request.getHeader(X_FORWARDED_FOR);
        if (xff != null && !xff.isBlank()) {
            return xff.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    /**
     * 같은 호스트를 가리키는 Referer 헤더만 반환합니다.
     */
    public static Optional<String> getSameOriginReferer(HttpServletRequest request) {
        String referer = request.getHeader(HttpHeaders.REFERER);
        if (referer == null || referer.isBlank()) {
            return Optional.empty();
        }
        try {
            URI uri = URI.create(referer);
            if (uri.getHost() == null) {
                return referer.startsWith("/") && !referer.startsWith("//") ? Optional.of(referer) : Optional.empty();
            }
            return uri.getHost().equalsIgnoreCase(request.getServerName()) ? Optional.of(referer) : Optional.empty();
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
