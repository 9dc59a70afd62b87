package com.ids.authgate.security.util;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ids.authgate.security.error.ErrorResponse;
import com.ids.authgate.security.exception.ErrorCode;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class SecurityHandlerUtilTest {

    @Nested
    class AJAX_판별 {

        @Test
        void X_Requested_With_헤더가_있으면_AJAX_요청이다() {
            MockHttpServletRequest request = new MockHttpServletRequest();
            request.addHeader("X-Requested-With", "XMLHttpRequest");

            assertThat(SecurityHandlerUtil.isAjaxRequest(request)).isTrue();
        }

        @Test
        void Accept_헤더가_JSON이면_AJAX_요청이다() {
            MockHttpServletRequest request = new MockHttpServletRequest();
            request.addHeader("Accept", "application/json");

            assertThat(SecurityHandlerUtil.isAjaxRequest(request)).isTrue();
        }

        @Test
        void 일반_브라우저_요청은_AJAX_요청이_아니다() {
            MockHttpServletRequest request = new MockHttpServletRequest();
            request.addHeader("Accept", "text/html");

            assertThat(SecurityHandlerUtil.isAjaxRequest(request)).isFalse();
        }
    }

    @Nested
    class JSON_응답 {

        @Test
        void ErrorCode의_상태코드와_본문을_기록한다() throws Exception {
            // Given
            ObjectMapper objectMapper = new ObjectMapper();
            MockHttpServletResponse response = new MockHttpServletResponse();

            // When
            SecurityHandlerUtil.sendJsonResponse(response, objectMapper, ErrorCode.ACCESS_DENIED);

            // Then
            assertThat(response.getStatus()).isEqualTo(403);
            assertThat(response.getContentType()).isEqualTo(MediaType.APPLICATION_JSON_VALUE);
            ErrorResponse body = objectMapper.readValue(response.getContentAsByteArray(), ErrorResponse.class);
            assertThat(body.code()).isEqualTo("ACCESS_DENIED");
        }
    }

    @Nested
    class Referer_검사 {

        @Test
        void 같은_호스트의_Referer는_사용한다() {
            MockHttpServletRequest request = new MockHttpServletRequest();
            request.setServerName("app.example.com");
            request.addHeader("Referer", "https://app.example.com/posts");

            assertThat(SecurityHandlerUtil.getSameOriginReferer(request)).contains("https://app.example.com/posts");
        }

        @Test
        void 다른_호스트의_Referer는_무시한다() {
            MockHttpServletRequest request = new MockHttpServletRequest();
            request.setServerName("app.example.com");
            request.addHeader("Referer", "https://evil.example.org/phish");

            assertThat(SecurityHandlerUtil.getSameOriginReferer(request)).isEmpty();
        }

        @Test
        void 프로토콜_상대_경로는_무시한다() {
            MockHttpServletRequest request = new MockHttpServletRequest();
            request.addHeader("Referer", "//evil.example.org/phish");

            assertThat(SecurityHandlerUtil.getSameOriginReferer(request)).isEmpty();
        }
    }

    @Test
    void X_Forwarded_For의_첫번째_IP를_클라이언트_IP로_사용한다() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("10.0.0.1");
        request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");

        assertThat(SecurityHandlerUtil.getClientIp(request)).isEqualTo("203.0.113.7");
    }
}
