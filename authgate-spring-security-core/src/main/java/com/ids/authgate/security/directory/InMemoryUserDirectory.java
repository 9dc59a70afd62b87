package com.ids.authgate.security.directory;

import com.ids.authgate.security.exception.RoleNotFoundException;
import com.ids.authgate.security.exception.UserNotFoundException;
import com.ids.authgate.security.model.Role;
import com.ids.authgate.security.model.UserAccount;
import com.ids.authgate.security.model.UserCriteria;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * 메모리 기반 {@link UserDirectory} 구현체입니다. 테스트와 단일 인스턴스 환경을 위한 기본값입니다.
 * <p>
 * 조회와 저장 모두 사본을 주고받습니다. 조회한 레코드의 변경은 {@link #persist(UserAccount)} 전까지
 * 다른 요청에 보이지 않고, 동시 저장은 마지막 저장이 이깁니다.
 * </p>
 * <p>
 * 지원하는 조회 속성: {@code id}, {@code email}, {@code active}
 * </p>
 */
@Slf4j
public class InMemoryUserDirectory implements UserDirectory {

    private static final String ACTIVE = "active";

    private final Map<String, UserAccount> users = new ConcurrentHashMap<>();
    private final Map<String, Role> roles = new ConcurrentHashMap<>();

    @Override
    public UserAccount findUser(UserCriteria criteria) {
        return users.values().stream()
            .filter(user -> matches(user, criteria))
            .findFirst()
            .map(UserAccount::copy)
            .orElseThrow(() -> new UserNotFoundException("사용자를 찾을 수 없습니다: " + criteria));
    }

    @Override
    public Role findRole(String name) {
        Role role = name != null ? roles.get(name) : null;
        if (role == null) {
            throw new RoleNotFoundException("역할을 찾을 수 없습니다: " + name);
        }
        return role;
    }

    @Override
    public UserAccount persist(UserAccount user) {
        if (user.getId() == null) {
            user.setId(UUID.randomUUID().toString());
        }
        users.put(user.getId(), user.copy());
        log.trace("[UserDirectory] 사용자 저장: {}", user.getId());
        return user;
    }

    @Override
    public Role persist(Role role) {
        roles.put(role.getName(), role);
        return role;
    }

    @Override
    public void delete(UserAccount user) {
        if (user.getId() != null) {
            users.remove(user.getId());
        }
    }

    private boolean matches(UserAccount user, UserCriteria criteria) {
        for (Map.Entry<String, Object> entry : criteria.attributes().entrySet()) {
            Object actual = switch (entry.getKey()) {
                case UserCriteria.ID -> user.getId();
                case UserCriteria.EMAIL -> user.getEmail();
                case ACTIVE -> user.isActive();
                default -> throw new IllegalArgumentException("지원하지 않는 조회 속성입니다: " + entry.getKey());
            };
            if (!Objects.equals(actual, entry.getValue())) {
                return false;
            }
        }
        return true;
    }
}
