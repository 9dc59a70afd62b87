package com.ids.authgate.security.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ids.authgate.security.account.PasswordRecoveryService;
import com.ids.authgate.security.account.RegistrationService;
import com.ids.authgate.security.authentication.AuthenticationEngine;
import com.ids.authgate.security.authentication.CredentialAuthenticationProvider;
import com.ids.authgate.security.authentication.LoginSuccessHandler;
import com.ids.authgate.security.authentication.RememberTokenServices;
import com.ids.authgate.security.authentication.SessionLogoutHandler;
import com.ids.authgate.security.authorization.AuthorizationEngine;
import com.ids.authgate.security.crypto.CredentialCodec;
import com.ids.authgate.security.directory.InMemoryUserDirectory;
import com.ids.authgate.security.directory.UserDatastore;
import com.ids.authgate.security.directory.UserDirectory;
import com.ids.authgate.security.event.SecurityEventListener;
import com.ids.authgate.security.event.SecurityEventPublisher;
import com.ids.authgate.security.exception.AuthGateAuthenticationEntryPoint;
import com.ids.authgate.security.exception.BasicAuthenticationChallengeEntryPoint;
import com.ids.authgate.security.exception.ConfigurationException;
import com.ids.authgate.security.exception.RealmResolver;
import com.ids.authgate.security.exception.UnauthorizedViewAccessDeniedHandler;
import com.ids.authgate.security.logging.LoggingContextAccessor;
import com.ids.authgate.security.logging.WebMdcContextAccessor;
import com.ids.authgate.security.manager.RolePolicyAuthorizationManager;
import com.ids.authgate.security.session.HttpSessionContextFactory;
import com.ids.authgate.security.session.LoginSessionManager;
import com.ids.authgate.security.token.AuthenticationTokenCodec;
import com.ids.authgate.security.token.PasswordResetTokenCodec;
import com.ids.authgate.security.token.RememberTokenCodec;
import com.ids.authgate.security.token.SignedTokenSerializer;
import com.ids.authgate.security.util.CookieUtil;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.security.servlet.SecurityAutoConfiguration;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.authorization.AuthorizationManagers;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;
import org.springframework.security.web.util.matcher.AntPathRequestMatcher;
import org.springframework.util.StringUtils;

/**
 * AuthGate Spring Security의 Servlet 환경 자동 설정을 담당하는 진입점입니다.
 * 역할별로 분리된 내부 설정 클래스들을 Import 합니다.
 */
@AutoConfiguration(
    after = JacksonAutoConfiguration.class,
    before = {SecurityAutoConfiguration.class, UserDetailsServiceAutoConfiguration.class}
)
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@EnableConfigurationProperties(AuthGateSecurityProperties.class)
@Import({
    AuthGateServletAutoConfiguration.AuthGateInfrastructureConfiguration.class,
    AuthGateServletAutoConfiguration.AuthGateTokenConfiguration.class,
    AuthGateServletAutoConfiguration.AuthGateCoreConfiguration.class,
    AuthGateServletAutoConfiguration.AuthGateAuthenticationConfiguration.class,
    AuthGateServletAutoConfiguration.AuthGateWebSecurityConfiguration.class
})
@Slf4j
public class AuthGateServletAutoConfiguration {
    public AuthGateServletAutoConfiguration() {
        log.info("AuthGate Spring Security: Servlet 환경 자동 설정이 활성화되었습니다.");
    }

    @Configuration(proxyBeanMethods = false)
    @RequiredArgsConstructor
    static class CookieUtilInitializer {
        private final AuthGateSecurityProperties securityProperties;

        @PostConstruct
        public void init() {
            log.debug("CookieUtil에 CookieProperties를 주입합니다.");
            CookieUtil.setProperties(securityProperties.getCookie());
        }
    }

    /**
     * 기반 시설 (Infrastructure) 관련 Bean 설정
     */
    @Configuration(proxyBeanMethods = false)
    @Slf4j
    protected static class AuthGateInfrastructureConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public ObjectMapper authgateObjectMapper() {
            log.debug("지원 Bean을 등록합니다: [ObjectMapper]");
            return new ObjectMapper();
        }

        @Bean
        @ConditionalOnMissingBean
        public Clock authgateClock() {
            log.debug("지원 Bean을 등록합니다: [Clock]");
            return Clock.systemUTC();
        }

        @Bean
        @ConditionalOnMissingBean
        public PasswordEncoder authgatePasswordEncoder() {
            log.debug("지원 Bean을 등록합니다: [PasswordEncoder] (BCrypt)");
            return new BCryptPasswordEncoder();
        }

        @Bean
        @ConditionalOnMissingBean
        public CredentialCodec credentialCodec(PasswordEncoder passwordEncoder, AuthGateSecurityProperties securityProperties) {
            log.debug("지원 Bean을 등록합니다: [CredentialCodec]");
            return new CredentialCodec(passwordEncoder, securityProperties.getPassword());
        }

        @Bean
        @ConditionalOnMissingBean
        public LoggingContextAccessor loggingContextAccessor() {
            log.debug("지원 Bean을 등록합니다: [LoggingContextAccessor] (MDC)");
            return new WebMdcContextAccessor();
        }

        @Bean
        @ConditionalOnMissingBean
        public SecurityEventApplicationBridge securityEventApplicationBridge(ApplicationEventPublisher applicationEventPublisher) {
            log.debug("지원 Bean을 등록합니다: [SecurityEventApplicationBridge]");
            return new SecurityEventApplicationBridge(applicationEventPublisher);
        }

        @Bean
        @ConditionalOnMissingBean
        public SecurityEventPublisher securityEventPublisher(ObjectProvider<SecurityEventListener> listeners) {
            log.debug("지원 Bean을 등록합니다: [SecurityEventPublisher]");
            SecurityEventPublisher publisher = new SecurityEventPublisher();
            listeners.orderedStream().forEach(publisher::subscribe);
            return publisher;
        }
    }

    /**
     * 토큰 서명/검증 관련 Bean 설정. 토큰 종류마다 별도의 네임스페이스로 서명합니다.
     */
    @Configuration(proxyBeanMethods = false)
    @Slf4j
    protected static class AuthGateTokenConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public AuthenticationTokenCodec authenticationTokenCodec(AuthGateSecurityProperties securityProperties, Clock clock) {
            log.info("핵심 Bean을 등록합니다: [AuthenticationTokenCodec]");
            String within = securityProperties.getToken().getWithin();
            return new AuthenticationTokenCodec(
                new SignedTokenSerializer(securityProperties.getSecretKey(), AuthenticationTokenCodec.NAMESPACE, clock),
                StringUtils.hasText(within) ? ExpiryWindow.parse(within) : null
            );
        }

        @Bean
        @ConditionalOnMissingBean
        public RememberTokenCodec rememberTokenCodec(AuthGateSecurityProperties securityProperties, Clock clock) {
            log.info("핵심 Bean을 등록합니다: [RememberTokenCodec]");
            return new RememberTokenCodec(
                new SignedTokenSerializer(securityProperties.getSecretKey(), RememberTokenCodec.NAMESPACE, clock),
                securityProperties.getSecretKey(),
                ExpiryWindow.parse(securityProperties.getRemember().getWithin())
            );
        }

        @Bean
        @ConditionalOnMissingBean
        public PasswordResetTokenCodec passwordResetTokenCodec(AuthGateSecurityProperties securityProperties, Clock clock) {
            log.info("핵심 Bean을 등록합니다: [PasswordResetTokenCodec]");
            return new PasswordResetTokenCodec(
                new SignedTokenSerializer(securityProperties.getSecretKey(), PasswordResetTokenCodec.NAMESPACE, clock),
                ExpiryWindow.parse(securityProperties.getResetPasswordWithin())
            );
        }
    }

    /**
     * 사용자 저장소와 핵심 서비스 Bean 설정
     */
    @Configuration(proxyBeanMethods = false)
    @Slf4j
    protected static class AuthGateCoreConfiguration {

        /**
         * 애플리케이션이 자체 저장소(JPA 등)를 등록하지 않은 경우 사용하는 인-메모리 저장소.
         */
        @Bean
        @ConditionalOnMissingBean
        public UserDirectory userDirectory() {
            log.info("InMemoryUserDirectory 생성");
            return new InMemoryUserDirectory();
        }

        @Bean
        @ConditionalOnMissingBean
        public UserDatastore userDatastore(UserDirectory userDirectory, CredentialCodec credentialCodec,
                                           AuthGateSecurityProperties securityProperties) {
            log.debug("지원 Bean을 등록합니다: [UserDatastore]");
            return new UserDatastore(userDirectory, credentialCodec, securityProperties.getDefaultRoles());
        }

        @Bean
        @ConditionalOnMissingBean
        public AuthenticationEngine authenticationEngine(UserDirectory userDirectory,
                                                         CredentialCodec credentialCodec,
                                                         AuthenticationTokenCodec authenticationTokenCodec,
                                                         RememberTokenCodec rememberTokenCodec,
                                                         SecurityEventPublisher eventPublisher) {
            log.info("핵심 Bean을 등록합니다: [AuthenticationEngine]");
            return new AuthenticationEngine(userDirectory, credentialCodec, authenticationTokenCodec, rememberTokenCodec, eventPublisher);
        }

        @Bean
        @ConditionalOnMissingBean
        public AuthorizationEngine authorizationEngine() {
            log.info("핵심 Bean을 등록합니다: [AuthorizationEngine]");
            return new AuthorizationEngine();
        }

        @Bean
        @ConditionalOnMissingBean
        public LoginSessionManager loginSessionManager(UserDirectory userDirectory,
                                                       AuthenticationTokenCodec authenticationTokenCodec,
                                                       RememberTokenCodec rememberTokenCodec,
                                                       SecurityEventPublisher eventPublisher,
                                                       AuthGateSecurityProperties securityProperties,
                                                       Clock clock) {
            log.info("핵심 Bean을 등록합니다: [LoginSessionManager] (trackable={})", securityProperties.isTrackable());
            return new LoginSessionManager(userDirectory, authenticationTokenCodec, rememberTokenCodec,
                eventPublisher, securityProperties.isTrackable(), clock);
        }

        @Bean
        @ConditionalOnMissingBean
        public RegistrationService registrationService(UserDatastore userDatastore, SecurityEventPublisher eventPublisher,
                                                       Clock clock) {
            log.debug("지원 Bean을 등록합니다: [RegistrationService]");
            return new RegistrationService(userDatastore, eventPublisher, clock);
        }

        @Bean
        @ConditionalOnMissingBean
        public PasswordRecoveryService passwordRecoveryService(UserDirectory userDirectory,
                                                               CredentialCodec credentialCodec,
                                                               PasswordResetTokenCodec passwordResetTokenCodec,
                                                               RememberTokenCodec rememberTokenCodec,
                                                               SecurityEventPublisher eventPublisher) {
            log.debug("지원 Bean을 등록합니다: [PasswordRecoveryService]");
            return new PasswordRecoveryService(userDirectory, credentialCodec, passwordResetTokenCodec,
                rememberTokenCodec, eventPublisher);
        }
    }

    /**
     * 인증 처리 (Authentication) 관련 Bean 설정
     */
    @Configuration(proxyBeanMethods = false)
    @Slf4j
    protected static class AuthGateAuthenticationConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public HttpSessionContextFactory httpSessionContextFactory(AuthGateSecurityProperties securityProperties) {
            log.debug("지원 Bean을 등록합니다: [HttpSessionContextFactory]");
            RememberProperties remember = securityProperties.getRemember();
            return new HttpSessionContextFactory(remember.getCookieName(), ExpiryWindow.parse(remember.getWithin()));
        }

        @Bean
        @ConditionalOnMissingBean
        public CredentialAuthenticationProvider credentialAuthenticationProvider(AuthenticationEngine authenticationEngine) {
            log.info("핵심 Bean을 등록합니다: [CredentialAuthenticationProvider]");
            return new CredentialAuthenticationProvider(authenticationEngine);
        }

        @Bean
        @ConditionalOnMissingBean
        public LoginSuccessHandler loginSuccessHandler(UserDirectory userDirectory,
                                                       LoginSessionManager sessionManager,
                                                       HttpSessionContextFactory sessionContextFactory,
                                                       AuthGateSecurityProperties securityProperties) {
            log.debug("지원 Bean을 등록합니다: [LoginSuccessHandler]");
            return new LoginSuccessHandler(userDirectory, sessionManager, sessionContextFactory,
                securityProperties.getPostLoginView(), securityProperties.getLoginView() + "?error");
        }

        @Bean
        @ConditionalOnMissingBean
        public SessionLogoutHandler sessionLogoutHandler(LoginSessionManager sessionManager,
                                                         HttpSessionContextFactory sessionContextFactory) {
            log.debug("지원 Bean을 등록합니다: [SessionLogoutHandler]");
            return new SessionLogoutHandler(sessionManager, sessionContextFactory);
        }

        @Bean
        @ConditionalOnMissingBean
        public RememberTokenServices rememberTokenServices(AuthenticationEngine authenticationEngine,
                                                           HttpSessionContextFactory sessionContextFactory,
                                                           AuthGateSecurityProperties securityProperties) {
            log.debug("지원 Bean을 등록합니다: [RememberTokenServices]");
            return new RememberTokenServices(authenticationEngine, sessionContextFactory, securityProperties.getSecretKey());
        }
    }

    /**
     * 웹 보안 (Web Security) 관련 Bean 설정
     */
    @Configuration(proxyBeanMethods = false)
    @Slf4j
    protected static class AuthGateWebSecurityConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public AuthGateAuthenticationEntryPoint authGateAuthenticationEntryPoint(ObjectMapper objectMapper,
                                                                                 AuthGateSecurityProperties securityProperties) {
            log.debug("지원 Bean을 등록합니다: [AuthGateAuthenticationEntryPoint]");
            return new AuthGateAuthenticationEntryPoint(objectMapper, securityProperties.getError());
        }

        @Bean
        @ConditionalOnMissingBean
        public RealmResolver realmResolver(AuthGateSecurityProperties securityProperties) {
            log.debug("지원 Bean을 등록합니다: [RealmResolver]");
            return RealmResolver.of(securityProperties.getHttpAuth().getRealm());
        }

        @Bean
        @ConditionalOnMissingBean
        public BasicAuthenticationChallengeEntryPoint basicAuthenticationChallengeEntryPoint(RealmResolver realmResolver,
                                                                                             ObjectMapper objectMapper) {
            log.debug("지원 Bean을 등록합니다: [BasicAuthenticationChallengeEntryPoint]");
            return new BasicAuthenticationChallengeEntryPoint(realmResolver, objectMapper);
        }

        @Bean
        @ConditionalOnMissingBean
        public UnauthorizedViewAccessDeniedHandler unauthorizedViewAccessDeniedHandler(ObjectMapper objectMapper,
                                                                                       AuthGateSecurityProperties securityProperties) {
            log.debug("지원 Bean을 등록합니다: [UnauthorizedViewAccessDeniedHandler]");
            return new UnauthorizedViewAccessDeniedHandler(objectMapper, securityProperties);
        }

        @Bean
        @ConditionalOnMissingBean(SecurityFilterChain.class)
        public SecurityFilterChain authgateSecurityFilterChain(
            HttpSecurity http,
            AuthGateSecurityProperties securityProperties,
            AuthorizationEngine authorizationEngine
        ) throws Exception {
            log.info("핵심 Bean을 등록합니다: [SecurityFilterChain]");

            // 1. AuthGate 핵심 설정을 Configurer에서 적용
            // (인증 필터, 프로바이더, 로그인, 로그아웃, 세션, CSRF 등)
            http.with(AuthGateHttpConfigurer.authgate(), Customizer.withDefaults());

            // 2. 인가 설정 - 역할 정책, permitAllPaths, 나머지는 인증 필요
            http.authorizeHttpRequests(authorize -> {
                for (AuthorizationProperties.RoleRule rule : securityProperties.getAuthorization().getRules()) {
                    authorize.requestMatchers(AntPathRequestMatcher.antMatcher(rule.getPattern()))
                        .access(toAuthorizationManager(authorizationEngine, rule));
                    log.info("역할 정책 설정: {} required={} accepted={}", rule.getPattern(), rule.getRequired(), rule.getAccepted());
                }
                if (!securityProperties.getAuthentication().getPermitAllPaths().isEmpty()) {
                    authorize.requestMatchers(AuthGateHttpConfigurer.matcherOf(
                        securityProperties.getAuthentication().getPermitAllPaths())).permitAll();
                    log.info("인증 제외 경로 설정: {}", securityProperties.getAuthentication().getPermitAllPaths());
                }
                // 나머지 모든 요청은 인증 필요
                authorize.anyRequest().authenticated();
            });

            return http.build();
        }

        /**
         * 설정 파일의 역할 규칙을 인가 관리자로 변환합니다. required와 accepted가 모두 있으면 둘 다 만족해야 합니다.
         */
        static AuthorizationManager<RequestAuthorizationContext> toAuthorizationManager(
            AuthorizationEngine authorizationEngine, AuthorizationProperties.RoleRule rule) {
            if (!StringUtils.hasText(rule.getPattern())) {
                throw new ConfigurationException("역할 규칙의 pattern이 비어 있습니다.");
            }
            boolean hasRequired = !rule.getRequired().isEmpty();
            boolean hasAccepted = !rule.getAccepted().isEmpty();
            if (!hasRequired && !hasAccepted) {
                throw new ConfigurationException("역할 규칙에 required 또는 accepted 역할이 필요합니다: " + rule.getPattern());
            }

            RolePolicyAuthorizationManager required = hasRequired
                ? RolePolicyAuthorizationManager.rolesRequired(authorizationEngine, rule.getRequired().toArray(new String[0]))
                : null;
            RolePolicyAuthorizationManager accepted = hasAccepted
                ? RolePolicyAuthorizationManager.rolesAccepted(authorizationEngine, rule.getAccepted().toArray(new String[0]))
                : null;

            if (required != null && accepted != null) {
                return AuthorizationManagers.allOf(required, accepted);
            }
            return required != null ? required : accepted;
        }
    }
}
