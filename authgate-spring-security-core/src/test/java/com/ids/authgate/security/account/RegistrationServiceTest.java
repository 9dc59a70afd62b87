package com.ids.authgate.security.account;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.ids.authgate.security.config.PasswordProperties;
import com.ids.authgate.security.crypto.CredentialCodec;
import com.ids.authgate.security.directory.InMemoryUserDirectory;
import com.ids.authgate.security.directory.UserDatastore;
import com.ids.authgate.security.event.SecurityEvent;
import com.ids.authgate.security.event.SecurityEventListener;
import com.ids.authgate.security.event.SecurityEventPublisher;
import com.ids.authgate.security.exception.ValidationFailedException;
import com.ids.authgate.security.model.RoleRef;
import com.ids.authgate.security.model.UserAccount;
import com.ids.authgate.security.model.UserCriteria;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

@ExtendWith(MockitoExtension.class)
class RegistrationServiceTest {

    @Mock
    private SecurityEventListener listener;

    private static final Instant NOW = Instant.parse("2024-03-01T09:00:00Z");

    private UserDatastore datastore;
    private RegistrationService registrationService;

    @BeforeEach
    void setUp() {
        CredentialCodec credentialCodec = new CredentialCodec(new BCryptPasswordEncoder(4), new PasswordProperties());
        datastore = new UserDatastore(new InMemoryUserDirectory(), credentialCodec, List.of());
        datastore.createRole("author", null);

        SecurityEventPublisher publisher = new SecurityEventPublisher();
        publisher.subscribe(listener);
        registrationService = new RegistrationService(datastore, publisher, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    class 정상_케이스 {

        @Test
        void 사용자를_생성하고_등록_이벤트를_발행한다() {
            // When
            UserAccount user = registrationService.register("dave@lp.com", "password", RoleRef.of("author"));

            // Then
            assertThat(user.getId()).isNotNull();
            assertThat(user.hasRole("author")).isTrue();
            verify(listener).onEvent(new SecurityEvent.UserRegistered(user));
        }

        @Test
        void 가입_시각을_확인_시각으로_저장한다() {
            // When
            UserAccount user = registrationService.register("dave@lp.com", "password");

            // Then
            assertThat(user.getConfirmedAt()).isEqualTo(NOW);
            assertThat(datastore.getDirectory().findUser(UserCriteria.byId(user.getId())).getConfirmedAt()).isEqualTo(NOW);
        }
    }

    @Nested
    class 검증_실패 {

        @Test
        void 이미_가입된_이메일은_거부된다() {
            // Given
            registrationService.register("dave@lp.com", "password");

            // When & Then
            assertThatThrownBy(() -> registrationService.register("dave@lp.com", "password"))
                .isInstanceOfSatisfying(ValidationFailedException.class,
                    e -> assertThat(e.getErrors()).containsExactly("이미 사용 중인 이메일입니다."));
        }

        @Test
        void 필드별_오류를_모두_모아서_보고한다() {
            assertThatThrownBy(() -> registrationService.register("invalid", "", "other"))
                .isInstanceOfSatisfying(ValidationFailedException.class,
                    e -> assertThat(e.getErrors()).containsExactly(
                        "이메일 형식이 올바르지 않습니다.",
                        "비밀번호가 입력되지 않았습니다.",
                        "비밀번호가 일치하지 않습니다."));
            verify(listener, never()).onEvent(any());
        }
    }
}
