package com.ids.authgate.security.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ids.authgate.security.authentication.AuthenticationEngine;
import com.ids.authgate.security.authentication.CredentialAuthenticationProvider;
import com.ids.authgate.security.authorization.AuthorizationEngine;
import com.ids.authgate.security.directory.InMemoryUserDirectory;
import com.ids.authgate.security.directory.UserDirectory;
import com.ids.authgate.security.event.SecurityEvent;
import com.ids.authgate.security.event.SecurityEventPublisher;
import com.ids.authgate.security.exception.ConfigurationException;
import com.ids.authgate.security.manager.RolePolicyAuthorizationManager;
import com.ids.authgate.security.model.UserAccount;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.security.servlet.SecurityAutoConfiguration;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

/**
 * 자동 설정의 Bean 등록, 사용자 Bean 우선 적용, 설정 오류 감지를 검증합니다.
 */
class AuthGateServletAutoConfigurationTest {

    private final WebApplicationContextRunner contextRunner = new WebApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(
            JacksonAutoConfiguration.class,
            SecurityAutoConfiguration.class,
            AuthGateServletAutoConfiguration.class
        ))
        .withPropertyValues("authgate.security.secret-key=auto-config-secret");

    @Configuration(proxyBeanMethods = false)
    static class CustomDirectoryConfig {
        @Bean
        UserDirectory customUserDirectory() {
            return new InMemoryUserDirectory();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class EventCollectorConfig {
        @Bean
        EventCollector eventCollector() {
            return new EventCollector();
        }
    }

    static class EventCollector {
        private final List<SecurityEvent> events = new ArrayList<>();

        @EventListener
        public void on(SecurityEvent event) {
            events.add(event);
        }
    }

    @Nested
    @DisplayName("기본 Bean 등록")
    class 기본_Bean_등록 {

        @Test
        @DisplayName("secret-key가 있으면 핵심 Bean과 SecurityFilterChain이 등록되어야 한다")
        void registersCoreBeans() {
            contextRunner.run(context -> {
                assertThat(context).hasNotFailed();
                assertThat(context).hasSingleBean(AuthenticationEngine.class);
                assertThat(context).hasSingleBean(AuthorizationEngine.class);
                assertThat(context).hasSingleBean(CredentialAuthenticationProvider.class);
                assertThat(context).hasSingleBean(SecurityFilterChain.class);
                assertThat(context.getBean(UserDirectory.class)).isInstanceOf(InMemoryUserDirectory.class);
            });
        }

        @Test
        @DisplayName("사용자가 UserDirectory를 등록하면 기본 저장소는 등록되지 않아야 한다")
        void backsOffForCustomDirectory() {
            contextRunner
                .withUserConfiguration(CustomDirectoryConfig.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(UserDirectory.class);
                    assertThat(context).hasBean("customUserDirectory");
                    assertThat(context).doesNotHaveBean("userDirectory");
                });
        }

        @Test
        @DisplayName("secret-key가 없으면 컨텍스트 시작이 실패해야 한다")
        void failsWithoutSecretKey() {
            new WebApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                    JacksonAutoConfiguration.class,
                    SecurityAutoConfiguration.class,
                    AuthGateServletAutoConfiguration.class
                ))
                .run(context -> assertThat(context).hasFailed());
        }
    }

    @Nested
    @DisplayName("보안 이벤트 전달")
    class 보안_이벤트_전달 {

        @Test
        @DisplayName("발행된 보안 이벤트는 ApplicationEvent로 전달되어야 한다")
        void bridgesToApplicationEvents() {
            contextRunner
                .withUserConfiguration(EventCollectorConfig.class)
                .run(context -> {
                    // Given
                    SecurityEventPublisher publisher = context.getBean(SecurityEventPublisher.class);
                    UserAccount user = new UserAccount("1", "user@example.com", "hash");

                    // When
                    publisher.publish(new SecurityEvent.UserRegistered(user));

                    // Then
                    assertThat(context.getBean(EventCollector.class).events)
                        .singleElement()
                        .isInstanceOf(SecurityEvent.UserRegistered.class);
                });
        }
    }

    @Nested
    @DisplayName("역할 규칙 변환")
    class 역할_규칙_변환 {

        private final AuthorizationEngine engine = new AuthorizationEngine();

        private AuthorizationProperties.RoleRule rule(String pattern, List<String> required, List<String> accepted) {
            AuthorizationProperties.RoleRule rule = new AuthorizationProperties.RoleRule();
            rule.setPattern(pattern);
            rule.setRequired(new ArrayList<>(required));
            rule.setAccepted(new ArrayList<>(accepted));
            return rule;
        }

        @Test
        @DisplayName("required만 있으면 rolesRequired 정책으로 변환된다")
        void requiredOnly() {
            AuthorizationManager<RequestAuthorizationContext> manager =
                AuthGateServletAutoConfiguration.AuthGateWebSecurityConfiguration.toAuthorizationManager(
                    engine, rule("/admin/**", List.of("admin"), List.of()));

            assertThat(manager).isInstanceOf(RolePolicyAuthorizationManager.class);
            assertThat(((RolePolicyAuthorizationManager) manager).getPolicy().getRoles()).isEqualTo(Set.of("admin"));
        }

        @Test
        @DisplayName("역할이 하나도 없는 규칙은 ConfigurationException을 던진다")
        void emptyRuleFails() {
            assertThatThrownBy(() -> AuthGateServletAutoConfiguration.AuthGateWebSecurityConfiguration.toAuthorizationManager(
                engine, rule("/admin/**", List.of(), List.of())))
                .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("pattern이 비어 있으면 ConfigurationException을 던진다")
        void blankPatternFails() {
            assertThatThrownBy(() -> AuthGateServletAutoConfiguration.AuthGateWebSecurityConfiguration.toAuthorizationManager(
                engine, rule(" ", List.of("admin"), List.of())))
                .isInstanceOf(ConfigurationException.class);
        }
    }
}
