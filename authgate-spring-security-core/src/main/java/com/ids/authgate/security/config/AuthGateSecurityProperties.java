package com.ids.authgate.security.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

/**
 * AuthGate Security 관련 설정을 통합 관리하는 Root Properties 클래스입니다.
 * <p>
 * application.yaml 예시:
 * <pre>
 * authgate:
 *   security:
 *     secret-key: change-me
 *     trackable: true
 *     unauthorized-view: /error/403
 *     password:
 *       salt: pepper
 *       hmac-enabled: true
 *     token:
 *       header-name: Authentication-Token
 *       query-parameter: auth_token
 *     remember:
 *       within: 30 days
 *     http-auth:
 *       realm: Login Required
 *     authentication:
 *       http-auth-paths:
 *         - /api/basic/**
 *       token-auth-paths:
 *         - /api/**
 *     authorization:
 *       rules:
 *         - pattern: /admin/**
 *           required: [admin]
 * </pre>
 * </p>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "authgate.security")
public class AuthGateSecurityProperties {

    /**
     * 토큰 서명에 사용하는 서버 비밀 키. 변경하면 발급된 모든 토큰이 무효화됩니다.
     */
    private String secretKey;

    /**
     * 로그인 시각/IP 추적 및 로그인 횟수 집계 여부
     */
    private boolean trackable = false;

    /**
     * 플래시 메시지 사용 여부
     */
    private boolean flashMessages = true;

    /**
     * 로그인 성공 후 이동할 기본 경로
     */
    private String postLoginView = "/";

    /**
     * 로그아웃 후 이동할 경로
     */
    private String postLogoutView = "/";

    /**
     * 로그인 화면 경로
     */
    private String loginView = "/login";

    /**
     * 역할 정책 위반 시 이동할 경로. 설정하지 않으면 Referer, 그 다음 "/" 순으로 사용합니다.
     */
    private String unauthorizedView;

    /**
     * 역할 정책 위반 시 플래시로 전달할 메시지
     */
    private String unauthorizedMessage = "이 리소스를 볼 수 있는 권한이 없습니다.";

    /**
     * 비밀번호 재설정 토큰 유효 기간 ("&lt;amount&gt; &lt;unit&gt;")
     */
    private String resetPasswordWithin = "5 days";

    /**
     * 신규 사용자에게 자동으로 부여할 역할 이름 목록
     */
    private List<String> defaultRoles = new ArrayList<>();

    @NestedConfigurationProperty
    private PasswordProperties password = new PasswordProperties();

    @NestedConfigurationProperty
    private TokenProperties token = new TokenProperties();

    @NestedConfigurationProperty
    private RememberProperties remember = new RememberProperties();

    @NestedConfigurationProperty
    private HttpAuthProperties httpAuth = new HttpAuthProperties();

    /**
     * 인증(Authentication) 관련 설정
     */
    @NestedConfigurationProperty
    private AuthenticationProperties authentication = new AuthenticationProperties();

    /**
     * 인가(Authorization) 관련 설정
     */
    @NestedConfigurationProperty
    private AuthorizationProperties authorization = new AuthorizationProperties();

    @NestedConfigurationProperty
    private ErrorProperties error = new ErrorProperties();

    /**
     * 쿠키 관련 설정
     */
    @NestedConfigurationProperty
    private CookieProperties cookie = new CookieProperties();

    /**
     * 로깅 관련 설정
     */
    @NestedConfigurationProperty
    private LoggingProperties logging = new LoggingProperties();
}
