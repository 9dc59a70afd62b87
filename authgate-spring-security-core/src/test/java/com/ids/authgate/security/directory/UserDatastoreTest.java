package com.ids.authgate.security.directory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ids.authgate.security.config.PasswordProperties;
import com.ids.authgate.security.crypto.CredentialCodec;
import com.ids.authgate.security.exception.RoleNotFoundException;
import com.ids.authgate.security.exception.UserNotFoundException;
import com.ids.authgate.security.exception.ValidationFailedException;
import com.ids.authgate.security.model.Role;
import com.ids.authgate.security.model.RoleRef;
import com.ids.authgate.security.model.UserAccount;
import com.ids.authgate.security.model.UserCriteria;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

class UserDatastoreTest {

    private InMemoryUserDirectory directory;
    private CredentialCodec credentialCodec;
    private UserDatastore datastore;

    @BeforeEach
    void setUp() {
        directory = new InMemoryUserDirectory();
        credentialCodec = new CredentialCodec(new BCryptPasswordEncoder(4), new PasswordProperties());
        datastore = new UserDatastore(directory, credentialCodec, List.of());

        datastore.createRole("admin", "관리자");
        datastore.createRole("editor", null);
    }

    @Nested
    class 사용자_생성 {

        @Test
        void 비밀번호는_해시되어_저장되고_기본값은_활성_상태이다() {
            // When
            UserAccount user = datastore.createUser("matt@lp.com", "password", RoleRef.of("admin"));

            // Then
            assertThat(user.getId()).isNotNull();
            assertThat(user.isActive()).isTrue();
            assertThat(user.getPassword()).isNotEqualTo("password");
            assertThat(credentialCodec.verify("password", user.getPassword())).isTrue();
            assertThat(user.hasRole("admin")).isTrue();
            assertThat(directory.findUser(UserCriteria.byEmail("matt@lp.com")).getId()).isEqualTo(user.getId());
        }

        @Test
        void 설정된_기본_역할이_함께_부여된다() {
            // Given
            UserDatastore withDefaults = new UserDatastore(directory, credentialCodec, List.of("editor"));

            // When
            UserAccount user = withDefaults.createUser("joe@lp.com", "password", RoleRef.of("admin"));

            // Then
            assertThat(user.getRoles()).containsExactly(new Role("admin"), new Role("editor"));
        }

        @Test
        void 비활성_사용자로_생성할_수_있다() {
            UserAccount user = datastore.createUser("tiya@lp.com", "password", false);

            assertThat(user.isActive()).isFalse();
        }

        @Test
        void 이미_사용_중인_이메일이면_ValidationFailedException이_발생한다() {
            // Given
            UserAccount first = datastore.createUser("matt@lp.com", "password");

            // When & Then
            assertThatThrownBy(() -> datastore.createUser("matt@lp.com", "other-password"))
                .isInstanceOf(ValidationFailedException.class);
            assertThat(directory.findUser(UserCriteria.byEmail("matt@lp.com")).getId()).isEqualTo(first.getId());
        }

        @Test
        void 존재하지_않는_역할을_지정하면_RoleNotFoundException이_전파된다() {
            assertThatThrownBy(() -> datastore.createUser("jill@lp.com", "password", RoleRef.of("ghost")))
                .isInstanceOf(RoleNotFoundException.class);
        }
    }

    @Nested
    class 역할_변경 {

        @Test
        void 같은_역할을_두_번_부여해도_한_번만_보유한다() {
            // Given
            UserAccount user = datastore.createUser("matt@lp.com", "password");

            // When
            boolean first = datastore.addRoleToUser(user, RoleRef.of("admin"));
            boolean second = datastore.addRoleToUser(user, RoleRef.of(new Role("admin")));

            // Then
            assertThat(first).isTrue();
            assertThat(second).isFalse();
            assertThat(user.getRoles()).hasSize(1);
        }

        @Test
        void 보유하지_않은_역할의_제거는_아무_일도_하지_않는다() {
            // Given
            UserAccount user = datastore.createUser("matt@lp.com", "password", RoleRef.of("admin"));

            // When
            boolean removed = datastore.removeRoleFromUser(user, RoleRef.of("editor"));

            // Then
            assertThat(removed).isFalse();
            assertThat(user.getRoles()).containsExactly(new Role("admin"));
        }

        @Test
        void 이메일로_지정한_사용자의_역할을_제거한다() {
            // Given
            datastore.createUser("matt@lp.com", "password", RoleRef.of("admin"));

            // When
            boolean removed = datastore.removeRoleFromUser("matt@lp.com", RoleRef.of("admin"));

            // Then
            assertThat(removed).isTrue();
            assertThat(directory.findUser(UserCriteria.byEmail("matt@lp.com")).getRoles()).isEmpty();
        }

        @Test
        void 존재하지_않는_사용자는_UserNotFoundException이_전파된다() {
            assertThatThrownBy(() -> datastore.addRoleToUser("nobody@lp.com", RoleRef.of("admin")))
                .isInstanceOf(UserNotFoundException.class);
        }

        @Test
        void 존재하지_않는_역할은_RoleNotFoundException이_전파된다() {
            UserAccount user = datastore.createUser("matt@lp.com", "password");

            assertThatThrownBy(() -> datastore.addRoleToUser(user, RoleRef.of("ghost")))
                .isInstanceOf(RoleNotFoundException.class);
        }
    }

    @Nested
    class 활성화와_삭제 {

        @Test
        void 비활성화와_활성화는_상태가_바뀔_때만_true를_반환한다() {
            // Given
            UserAccount user = datastore.createUser("matt@lp.com", "password");

            // When & Then
            assertThat(datastore.deactivateUser(user)).isTrue();
            assertThat(datastore.deactivateUser(user)).isFalse();
            assertThat(user.isActive()).isFalse();
            assertThat(datastore.activateUser("matt@lp.com")).isTrue();
            assertThat(directory.findUser(UserCriteria.byId(user.getId())).isActive()).isTrue();
        }

        @Test
        void 삭제된_사용자는_조회되지_않는다() {
            // Given
            UserAccount user = datastore.createUser("matt@lp.com", "password");

            // When
            datastore.deleteUser(user);

            // Then
            assertThatThrownBy(() -> directory.findUser(UserCriteria.byId(user.getId())))
                .isInstanceOf(UserNotFoundException.class);
        }
    }
}
