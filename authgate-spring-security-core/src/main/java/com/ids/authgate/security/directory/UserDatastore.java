package com.ids.authgate.security.directory;

import com.ids.authgate.security.crypto.CredentialCodec;
import com.ids.authgate.security.exception.RoleNotFoundException;
import com.ids.authgate.security.exception.UserNotFoundException;
import com.ids.authgate.security.exception.ValidationFailedException;
import com.ids.authgate.security.model.Role;
import com.ids.authgate.security.model.RoleRef;
import com.ids.authgate.security.model.UserAccount;
import com.ids.authgate.security.model.UserCriteria;
import com.ids.authgate.security.validation.AccountValidators;
import com.ids.authgate.security.validation.ValidationRule;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link UserDirectory} 위에서 사용자/역할을 생성하고 변경하는 관리 기능을 제공합니다.
 * <p>
 * 역할 인자는 {@link RoleRef}로 받아 경계에서 한 번 {@link Role}로 해석합니다.
 * 존재하지 않는 사용자나 역할은 {@link UserNotFoundException}, {@link RoleNotFoundException}으로
 * 호출자에게 그대로 전파됩니다.
 * </p>
 */
@Slf4j
public class UserDatastore {

    private final UserDirectory directory;
    private final CredentialCodec credentialCodec;
    private final List<String> defaultRoles;

    public UserDatastore(UserDirectory directory, CredentialCodec credentialCodec, List<String> defaultRoles) {
        this.directory = directory;
        this.credentialCodec = credentialCodec;
        this.defaultRoles = defaultRoles != null ? List.copyOf(defaultRoles) : List.of();
    }

    public UserDirectory getDirectory() {
        return directory;
    }

    public Role createRole(String name, String description) {
        Role role = directory.persist(new Role(name, description));
        log.info("[UserDatastore] 역할 생성: {}", role.getName());
        return role;
    }

    public UserAccount createUser(String email, String password, RoleRef... roles) {
        return createUser(email, password, true, roles);
    }

    /**
     * 사용자를 생성합니다. 비밀번호는 해시되어 저장되고, 설정된 기본 역할이 함께 부여됩니다.
     *
     * @throws RoleNotFoundException 이름으로 지정한 역할이 없는 경우
     * @throws ValidationFailedException 같은 이메일의 사용자가 이미 있는 경우
     */
    public UserAccount createUser(String email, String password, boolean active, RoleRef... roles) {
        ValidationRule<String> uniqueEmail = AccountValidators.uniqueEmail(directory);
        if (!uniqueEmail.test(email)) {
            throw new ValidationFailedException(List.of(uniqueEmail.message()));
        }

        UserAccount user = new UserAccount();
        user.setEmail(email);
        user.setPassword(password != null ? credentialCodec.hash(password) : null);
        user.setActive(active);

        for (RoleRef roleRef : roles) {
            user.addRole(resolveRole(roleRef));
        }
        for (String defaultRole : defaultRoles) {
            user.addRole(directory.findRole(defaultRole));
        }

        UserAccount saved = directory.persist(user);
        log.info("[UserDatastore] 사용자 생성: id={}, roles={}", saved.getId(), saved.getRoles());
        return saved;
    }

    public void deleteUser(UserAccount user) {
        directory.delete(user);
        log.info("[UserDatastore] 사용자 삭제: {}", user.getId());
    }

    /**
     * @return 역할이 새로 부여되었으면 true, 이미 보유 중이면 false
     * @throws UserNotFoundException 해당 이메일의 사용자가 없는 경우
     */
    public boolean addRoleToUser(String email, RoleRef roleRef) {
        return addRoleToUser(directory.findUser(UserCriteria.byEmail(email)), roleRef);
    }

    public boolean addRoleToUser(UserAccount user, RoleRef roleRef) {
        Role role = resolveRole(roleRef);
        if (!user.addRole(role)) {
            return false;
        }
        directory.persist(user);
        log.debug("[UserDatastore] 역할 부여: user={}, role={}", user.getId(), role);
        return true;
    }

    /**
     * @return 역할이 제거되었으면 true, 보유하지 않은 역할이면 false
     * @throws UserNotFoundException 해당 이메일의 사용자가 없는 경우
     */
    public boolean removeRoleFromUser(String email, RoleRef roleRef) {
        return removeRoleFromUser(directory.findUser(UserCriteria.byEmail(email)), roleRef);
    }

    public boolean removeRoleFromUser(UserAccount user, RoleRef roleRef) {
        Role role = resolveRole(roleRef);
        if (!user.removeRole(role)) {
            return false;
        }
        directory.persist(user);
        log.debug("[UserDatastore] 역할 회수: user={}, role={}", user.getId(), role);
        return true;
    }

    /**
     * @return 상태가 바뀌었으면 true
     */
    public boolean activateUser(UserAccount user) {
        return changeActive(user, true);
    }

    /**
     * @return 상태가 바뀌었으면 true
     */
    public boolean deactivateUser(UserAccount user) {
        return changeActive(user, false);
    }

    public boolean activateUser(String email) {
        return activateUser(directory.findUser(UserCriteria.byEmail(email)));
    }

    public boolean deactivateUser(String email) {
        return deactivateUser(directory.findUser(UserCriteria.byEmail(email)));
    }

    /**
     * 역할 참조를 저장소의 역할로 해석합니다. 이름 참조는 저장소에서 조회하고, 인스턴스 참조는 그대로 사용합니다.
     *
     * @throws RoleNotFoundException 이름에 해당하는 역할이 없는 경우
     */
    public Role resolveRole(RoleRef roleRef) {
        if (roleRef instanceof RoleRef.Instance instance) {
            return instance.role();
        }
        return directory.findRole(roleRef.roleName());
    }

    private boolean changeActive(UserAccount user, boolean active) {
        if (user.isActive() == active) {
            return false;
        }
        user.setActive(active);
        directory.persist(user);
        log.info("[UserDatastore] 사용자 {}: {}", active ? "활성화" : "비활성화", user.getId());
        return true;
    }
}
