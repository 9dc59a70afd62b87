package com.ids.authgate.security.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ids.authgate.security.directory.InMemoryUserDirectory;
import com.ids.authgate.security.event.SecurityEvent;
import com.ids.authgate.security.event.SecurityEventListener;
import com.ids.authgate.security.event.SecurityEventPublisher;
import com.ids.authgate.security.model.UserAccount;
import com.ids.authgate.security.model.UserCriteria;
import com.ids.authgate.security.token.AuthenticationTokenCodec;
import com.ids.authgate.security.token.RememberTokenCodec;
import com.ids.authgate.security.token.SignedTokenSerializer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LoginSessionManagerTest {

    private static final String SECRET = "test-secret-key";
    private static final Instant FIRST_LOGIN = Instant.parse("2024-01-01T09:00:00Z");
    private static final Instant SECOND_LOGIN = Instant.parse("2024-01-02T09:00:00Z");

    @Mock
    private SessionContext context;

    @Mock
    private SecurityEventListener listener;

    private InMemoryUserDirectory directory;
    private AuthenticationTokenCodec authenticationTokenCodec;
    private RememberTokenCodec rememberTokenCodec;
    private SecurityEventPublisher publisher;

    private UserAccount user;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.systemUTC();
        directory = new InMemoryUserDirectory();
        authenticationTokenCodec = new AuthenticationTokenCodec(
            new SignedTokenSerializer(SECRET, AuthenticationTokenCodec.NAMESPACE, clock), null);
        rememberTokenCodec = new RememberTokenCodec(
            new SignedTokenSerializer(SECRET, RememberTokenCodec.NAMESPACE, clock), SECRET, Duration.ofDays(365));
        publisher = new SecurityEventPublisher();
        publisher.subscribe(listener);

        user = directory.persist(new UserAccount(null, "matt@lp.com", "$2a$04$hash"));
    }

    private LoginSessionManager manager(boolean trackable, Instant now) {
        return new LoginSessionManager(directory, authenticationTokenCodec, rememberTokenCodec, publisher,
            trackable, Clock.fixed(now, ZoneOffset.UTC));
    }

    @Nested
    class 로그인 {

        @Test
        void 세션_바인딩에_성공하면_토큰을_발급하고_저장한_뒤_이벤트를_발행한다() {
            // Given
            when(context.bind(user, false)).thenReturn(true);

            // When
            boolean result = manager(false, FIRST_LOGIN).login(user, false, context);

            // Then
            assertThat(result).isTrue();
            assertThat(user.getAuthenticationToken()).isNotNull();
            assertThat(user.getRememberToken()).isNull();
            verify(context, never()).remember(anyString());
            verify(listener).onEvent(new SecurityEvent.IdentityChanged(user.getId()));
        }

        @Test
        void 이미_인증_토큰이_있으면_다시_발급하지_않는다() {
            // Given
            user.setAuthenticationToken("existing-token");
            when(context.bind(user, false)).thenReturn(true);

            // When
            manager(false, FIRST_LOGIN).login(user, false, context);

            // Then
            assertThat(user.getAuthenticationToken()).isEqualTo("existing-token");
        }

        @Test
        void remember를_요청하면_remember_토큰을_저장하고_세션에_전달한다() {
            // Given
            when(context.bind(user, true)).thenReturn(true);

            // When
            manager(false, FIRST_LOGIN).login(user, true, context);

            // Then
            assertThat(user.getRememberToken()).isNotNull();
            verify(context).remember(user.getRememberToken());
        }

        @Test
        void 세션_바인딩이_거부되면_false를_반환하고_아무것도_저장하지_않는다() {
            // Given
            when(context.bind(any(), anyBoolean())).thenReturn(false);

            // When
            boolean result = manager(true, FIRST_LOGIN).login(user, true, context);

            // Then
            assertThat(result).isFalse();
            assertThat(user.getAuthenticationToken()).isNull();
            assertThat(user.getLoginCount()).isNull();
            verify(listener, never()).onEvent(any());
        }
    }

    @Nested
    class 로그인_추적 {

        @Test
        void 로그인_횟수는_null에서_1_그리고_2로_증가한다() {
            // Given
            when(context.bind(user, false)).thenReturn(true);
            LoginSessionManager manager = manager(true, FIRST_LOGIN);
            assertThat(user.getLoginCount()).isNull();

            // When & Then
            manager.login(user, false, context);
            assertThat(user.getLoginCount()).isEqualTo(1);

            manager.login(user, false, context);
            assertThat(user.getLoginCount()).isEqualTo(2);
        }

        @Test
        void 첫_로그인에서는_이전_로그인_시각과_IP가_현재값으로_채워진다() {
            // Given
            when(context.bind(user, false)).thenReturn(true);
            when(context.remoteAddress()).thenReturn("10.0.0.1");

            // When
            manager(true, FIRST_LOGIN).login(user, false, context);

            // Then
            assertThat(user.getLastLoginAt()).isEqualTo(FIRST_LOGIN);
            assertThat(user.getCurrentLoginAt()).isEqualTo(FIRST_LOGIN);
            assertThat(user.getLastLoginIp()).isEqualTo("10.0.0.1");
            assertThat(user.getCurrentLoginIp()).isEqualTo("10.0.0.1");
        }

        @Test
        void 두_번째_로그인에서는_직전_로그인_정보가_이전값으로_이동한다() {
            // Given
            when(context.bind(user, false)).thenReturn(true);
            when(context.remoteAddress()).thenReturn("10.0.0.1", "10.0.0.2");
            manager(true, FIRST_LOGIN).login(user, false, context);

            // When
            manager(true, SECOND_LOGIN).login(user, false, context);

            // Then
            assertThat(user.getLastLoginAt()).isEqualTo(FIRST_LOGIN);
            assertThat(user.getCurrentLoginAt()).isEqualTo(SECOND_LOGIN);
            assertThat(user.getLastLoginIp()).isEqualTo("10.0.0.1");
            assertThat(user.getCurrentLoginIp()).isEqualTo("10.0.0.2");
            assertThat(directory.findUser(UserCriteria.byId(user.getId())).getLoginCount()).isEqualTo(2);
        }

        @Test
        void 추적이_비활성화되면_로그인_정보를_바꾸지_않는다() {
            // Given
            when(context.bind(user, false)).thenReturn(true);

            // When
            manager(false, FIRST_LOGIN).login(user, false, context);

            // Then
            assertThat(user.getLoginCount()).isNull();
            assertThat(user.getCurrentLoginAt()).isNull();
        }
    }

    @Nested
    class 로그아웃 {

        @Test
        void 인증_표식을_지우고_이벤트를_발행한_뒤_세션을_해제한다() {
            // When
            manager(false, FIRST_LOGIN).logout(context);

            // Then
            InOrder order = inOrder(context, listener);
            order.verify(context).clearIdentity();
            order.verify(listener).onEvent(new SecurityEvent.IdentityCleared());
            order.verify(context).unbind();
        }

        @Test
        void 리스너나_세션_계층에서_오류가_나도_로그아웃은_실패하지_않는다() {
            // Given
            doThrow(new IllegalStateException("session invalidated")).when(context).clearIdentity();
            doThrow(new RuntimeException("listener failure")).when(listener).onEvent(any());

            // When & Then
            assertThatCode(() -> manager(false, FIRST_LOGIN).logout(context)).doesNotThrowAnyException();
            verify(context).unbind();
        }
    }
}
