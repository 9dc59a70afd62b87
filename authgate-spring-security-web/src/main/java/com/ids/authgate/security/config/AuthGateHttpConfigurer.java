package com.ids.authgate.security.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ids.authgate.security.authentication.AuthenticationEngine;
import com.ids.authgate.security.authentication.CredentialAuthenticationProvider;
import com.ids.authgate.security.authentication.LoginSuccessHandler;
import com.ids.authgate.security.authentication.RememberTokenServices;
import com.ids.authgate.security.authentication.SessionLogoutHandler;
import com.ids.authgate.security.directory.UserDirectory;
import com.ids.authgate.security.exception.AuthGateAuthenticationEntryPoint;
import com.ids.authgate.security.exception.BasicAuthenticationChallengeEntryPoint;
import com.ids.authgate.security.exception.UnauthorizedViewAccessDeniedHandler;
import com.ids.authgate.security.filter.BasicCredentialAuthenticationFilter;
import com.ids.authgate.security.filter.MdcAuthenticationFilter;
import com.ids.authgate.security.filter.MdcRequestFilter;
import com.ids.authgate.security.filter.SessionAuthenticationFilter;
import com.ids.authgate.security.filter.TokenAuthenticationFilter;
import com.ids.authgate.security.logging.LoggingContextAccessor;
import java.util.ArrayList;
import java.util.List;
import org.springframework.context.ApplicationContext;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.access.ExceptionTranslationFilter;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.context.NullSecurityContextRepository;
import org.springframework.security.web.context.SecurityContextHolderFilter;
import org.springframework.security.web.util.matcher.AntPathRequestMatcher;
import org.springframework.security.web.util.matcher.OrRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;

import static com.ids.authgate.security.config.AuthGateSecurityConstants.EMAIL_PARAMETER;
import static com.ids.authgate.security.config.AuthGateSecurityConstants.LOGOUT_URL;
import static com.ids.authgate.security.config.AuthGateSecurityConstants.PASSWORD_PARAMETER;

/**
 * AuthGate 인증에 필요한 모든 핵심 설정을 {@link HttpSecurity}에 등록하는
 * {@link AbstractHttpConfigurer} 구현체입니다.
 * <p>
 * 이 Configurer는 다음을 설정합니다:
 * <ul>
 *   <li>인증 필터 (Basic, 토큰, 세션)</li>
 *   <li>인증 프로바이더 (CredentialAuthenticationProvider)</li>
 *   <li>폼 로그인, remember-me</li>
 *   <li>로그아웃</li>
 *   <li>예외 핸들러</li>
 *   <li>MDC 로깅 필터</li>
 *   <li>CSRF (Basic/토큰 경로 면제)</li>
 * </ul>
 * </p>
 * <p>
 * 사용자가 커스텀 SecurityFilterChain을 정의할 때 한 줄로 핵심 기능을 적용할 수 있습니다:
 * <pre>
 * http.with(AuthGateHttpConfigurer.authgate(), Customizer.withDefaults());
 * </pre>
 * </p>
 * <p>
 * 인가 설정(authorizeHttpRequests)은 이 Configurer에서 처리하지 않습니다.
 * AutoConfiguration 또는 사용자 설정에서 직접 정의해야 합니다.
 * </p>
 */
public final class AuthGateHttpConfigurer extends AbstractHttpConfigurer<AuthGateHttpConfigurer, HttpSecurity> {

    private AuthGateHttpConfigurer() {
    }

    /**
     * Configurer 인스턴스를 생성하는 정적 팩토리 메서드입니다.
     */
    public static AuthGateHttpConfigurer authgate() {
        return new AuthGateHttpConfigurer();
    }

    @Override
    public void init(HttpSecurity http) throws Exception {
        ApplicationContext context = http.getSharedObject(ApplicationContext.class);

        // === Bean 조회 ===
        AuthGateSecurityProperties properties = context.getBean(AuthGateSecurityProperties.class);
        CredentialAuthenticationProvider provider = context.getBean(CredentialAuthenticationProvider.class);
        LoginSuccessHandler loginSuccessHandler = context.getBean(LoginSuccessHandler.class);
        SessionLogoutHandler logoutHandler = context.getBean(SessionLogoutHandler.class);
        RememberTokenServices rememberTokenServices = context.getBean(RememberTokenServices.class);
        AuthGateAuthenticationEntryPoint authenticationEntryPoint = context.getBean(AuthGateAuthenticationEntryPoint.class);
        UnauthorizedViewAccessDeniedHandler accessDeniedHandler = context.getBean(UnauthorizedViewAccessDeniedHandler.class);

        // === 1. Authentication Provider 등록 ===
        http.authenticationProvider(provider);

        // === 2. 세션 관리 ===
        // Spring Security가 세션을 생성하지 않음 (LoginSessionManager에서 관리)
        http.sessionManagement(session -> session
            .sessionCreationPolicy(SessionCreationPolicy.NEVER)
        );

        // SecurityContext를 세션에 저장하지 않음 - 매 요청마다 SessionAuthenticationFilter가 사용자를 다시 조회
        http.securityContext(securityContext -> securityContext
            .securityContextRepository(new NullSecurityContextRepository())
        );

        // === 3. 폼 로그인 ===
        http.formLogin(login -> login
            .loginPage(properties.getLoginView())
            .usernameParameter(EMAIL_PARAMETER)
            .passwordParameter(PASSWORD_PARAMETER)
            .successHandler(loginSuccessHandler)
            .failureUrl(properties.getLoginView() + "?error")
            .permitAll()
        );

        // === 4. remember-me ===
        http.rememberMe(rememberMe -> rememberMe
            .rememberMeServices(rememberTokenServices)
            .key(rememberTokenServices.getKey())
        );

        // === 5. 로그아웃 ===
        http.logout(logout -> logout
            .logoutUrl(LOGOUT_URL)
            .addLogoutHandler(logoutHandler)
            .logoutSuccessUrl(properties.getPostLogoutView())
        );

        // === 6. 예외 처리기 설정 ===
        http.exceptionHandling(customizer -> customizer
            .authenticationEntryPoint(authenticationEntryPoint)
            .accessDeniedHandler(accessDeniedHandler)
        );

        // === 7. CSRF 설정 ===
        // Basic/토큰 인증 경로는 브라우저 세션을 사용하지 않으므로 CSRF 면제
        List<String> statelessPaths = new ArrayList<>(properties.getAuthentication().getHttpAuthPaths());
        statelessPaths.addAll(properties.getAuthentication().getTokenAuthPaths());
        if (!statelessPaths.isEmpty()) {
            http.csrf(csrf -> csrf
                .ignoringRequestMatchers(matcherOf(statelessPaths))
            );
        }
    }

    @Override
    public void configure(HttpSecurity http) throws Exception {
        ApplicationContext context = http.getSharedObject(ApplicationContext.class);

        // === Bean 조회 ===
        AuthGateSecurityProperties properties = context.getBean(AuthGateSecurityProperties.class);
        ObjectMapper objectMapper = context.getBean(ObjectMapper.class);
        AuthenticationEngine authenticationEngine = context.getBean(AuthenticationEngine.class);
        UserDirectory userDirectory = context.getBean(UserDirectory.class);
        BasicAuthenticationChallengeEntryPoint challengeEntryPoint = context.getBean(BasicAuthenticationChallengeEntryPoint.class);
        LoggingContextAccessor contextAccessor = context.getBean(LoggingContextAccessor.class);
        AuthenticationProperties authenticationProperties = properties.getAuthentication();

        // === 8. MDC 요청 필터 (최상단) ===
        http.addFilterBefore(new MdcRequestFilter(contextAccessor, properties), SecurityContextHolderFilter.class);

        // === 9. 인증 필터 등록 ===
        if (!authenticationProperties.getHttpAuthPaths().isEmpty()) {
            http.addFilterBefore(new BasicCredentialAuthenticationFilter(
                authenticationEngine,
                matcherOf(authenticationProperties.getHttpAuthPaths()),
                challengeEntryPoint
            ), UsernamePasswordAuthenticationFilter.class);
        }
        if (!authenticationProperties.getTokenAuthPaths().isEmpty()) {
            http.addFilterBefore(new TokenAuthenticationFilter(
                authenticationEngine,
                matcherOf(authenticationProperties.getTokenAuthPaths()),
                properties.getToken(),
                objectMapper
            ), UsernamePasswordAuthenticationFilter.class);
        }
        http.addFilterBefore(new SessionAuthenticationFilter(userDirectory), UsernamePasswordAuthenticationFilter.class);

        // === 10. MDC 인증 필터 (인증 필터 이후) ===
        http.addFilterBefore(new MdcAuthenticationFilter(contextAccessor, properties), ExceptionTranslationFilter.class);
    }

    /**
     * Ant 패턴 목록을 하나의 RequestMatcher로 묶습니다.
     */
    public static RequestMatcher matcherOf(List<String> patterns) {
        List<RequestMatcher> matchers = patterns.stream()
            .map(pattern -> (RequestMatcher) AntPathRequestMatcher.antMatcher(pattern))
            .toList();
        return new OrRequestMatcher(matchers);
    }
}
