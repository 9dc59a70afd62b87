package com.ids.authgate.security.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ids.authgate.security.exception.InvalidTokenException;
import com.ids.authgate.security.model.UserAccount;
import java.time.Clock;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class UserTokenCodecTest {

    private static final String SECRET = "test-secret-key";

    private AuthenticationTokenCodec authenticationTokenCodec;
    private RememberTokenCodec rememberTokenCodec;
    private PasswordResetTokenCodec resetTokenCodec;

    private UserAccount user;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.systemUTC();
        authenticationTokenCodec = new AuthenticationTokenCodec(
            new SignedTokenSerializer(SECRET, AuthenticationTokenCodec.NAMESPACE, clock), null);
        rememberTokenCodec = new RememberTokenCodec(
            new SignedTokenSerializer(SECRET, RememberTokenCodec.NAMESPACE, clock), SECRET, Duration.ofDays(365));
        resetTokenCodec = new PasswordResetTokenCodec(
            new SignedTokenSerializer(SECRET, PasswordResetTokenCodec.NAMESPACE, clock), Duration.ofDays(5));

        user = new UserAccount("user-1", "matt@lp.com", "$2a$04$stored-hash");
    }

    @Nested
    class 인증_토큰 {

        @Test
        void 발급한_토큰은_같은_사용자와_일치한다() {
            // Given
            String token = authenticationTokenCodec.issue(user);

            // When
            TokenPayload payload = authenticationTokenCodec.parse(token);

            // Then
            assertThat(payload.subject()).isEqualTo("user-1");
            assertThat(authenticationTokenCodec.matches(payload, user)).isTrue();
        }

        @Test
        void 이메일이_바뀌면_기존_토큰은_일치하지_않는다() {
            // Given
            TokenPayload payload = authenticationTokenCodec.parse(authenticationTokenCodec.issue(user));

            // When
            user.setEmail("changed@lp.com");

            // Then
            assertThat(authenticationTokenCodec.matches(payload, user)).isFalse();
        }

        @Test
        void 비밀번호가_바뀌어도_인증_토큰은_유효하다() {
            // Given
            TokenPayload payload = authenticationTokenCodec.parse(authenticationTokenCodec.issue(user));

            // When
            user.setPassword("$2a$04$another-hash");

            // Then
            assertThat(authenticationTokenCodec.matches(payload, user)).isTrue();
        }

        @Test
        void 다른_사용자의_레코드와는_일치하지_않는다() {
            // Given
            TokenPayload payload = authenticationTokenCodec.parse(authenticationTokenCodec.issue(user));
            UserAccount other = new UserAccount("user-2", "matt@lp.com", "hash");

            // When & Then
            assertThat(authenticationTokenCodec.matches(payload, other)).isFalse();
        }
    }

    @Nested
    class remember_토큰 {

        @Test
        void 비밀번호가_바뀌면_기존_remember_토큰은_일치하지_않는다() {
            // Given
            TokenPayload payload = rememberTokenCodec.parse(rememberTokenCodec.issue(user));
            assertThat(rememberTokenCodec.matches(payload, user)).isTrue();

            // When
            user.setPassword("$2a$04$another-hash");

            // Then
            assertThat(rememberTokenCodec.matches(payload, user)).isFalse();
        }

        @Test
        void 비밀번호가_없는_사용자에게는_발급할_수_없다() {
            // Given
            UserAccount noPassword = new UserAccount("user-3", "joe@lp.com", null);

            // When & Then
            assertThatThrownBy(() -> rememberTokenCodec.issue(noPassword))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void 인증_토큰은_remember_토큰으로_해석되지_않는다() {
            // Given
            String authToken = authenticationTokenCodec.issue(user);

            // When & Then
            assertThatThrownBy(() -> rememberTokenCodec.parse(authToken))
                .isInstanceOf(InvalidTokenException.class);
        }
    }

    @Nested
    class 재설정_토큰 {

        @Test
        void 비밀번호가_재설정되면_같은_토큰을_다시_쓸_수_없다() {
            // Given
            TokenPayload payload = resetTokenCodec.parse(resetTokenCodec.issue(user));
            assertThat(resetTokenCodec.matches(payload, user)).isTrue();

            // When
            user.setPassword("$2a$04$reset-hash");

            // Then
            assertThat(resetTokenCodec.matches(payload, user)).isFalse();
        }
    }
}
