package com.ids.authgate.security.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * 저장소에서 조회한 사용자 레코드입니다.
 * <p>
 * 요청 처리 중 역할, 로그인 카운터, 타임스탬프 등의 가변 필드를 수정한 뒤
 * {@code UserDirectory#persist}로 저장합니다. 비밀번호 해시와 토큰 값은 toString에 포함되지 않습니다.
 * </p>
 */
@Getter
@Setter
@ToString
public class UserAccount implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;
    private String email;

    @ToString.Exclude
    private String password;

    private boolean active = true;

    private final Set<Role> roles = new LinkedHashSet<>();

    @ToString.Exclude
    private String authenticationToken;

    @ToString.Exclude
    private String rememberToken;

    private Instant lastLoginAt;
    private Instant currentLoginAt;
    private String lastLoginIp;
    private String currentLoginIp;

    /** 로그인 횟수. 한 번도 로그인하지 않은 사용자는 null일 수 있습니다. */
    private Integer loginCount;

    /** 가입 확인 시각. 확인 절차를 거치지 않은 계정은 null입니다. */
    private Instant confirmedAt;

    public UserAccount() {
    }

    public UserAccount(String id, String email, String password) {
        this.id = id;
        this.email = email;
        this.password = password;
    }

    /**
     * 역할 집합까지 새로 만든 사본을 반환합니다. 저장소는 이 사본을 주고받아 요청마다 독립된 레코드를 다룹니다.
     */
    public UserAccount copy() {
        UserAccount copy = new UserAccount(id, email, password);
        copy.active = active;
        copy.roles.addAll(roles);
        copy.authenticationToken = authenticationToken;
        copy.rememberToken = rememberToken;
        copy.lastLoginAt = lastLoginAt;
        copy.currentLoginAt = currentLoginAt;
        copy.lastLoginIp = lastLoginIp;
        copy.currentLoginIp = currentLoginIp;
        copy.loginCount = loginCount;
        copy.confirmedAt = confirmedAt;
        return copy;
    }

    public Set<Role> getRoles() {
        return Collections.unmodifiableSet(roles);
    }

    /**
     * 역할을 추가합니다. 이미 가진 역할이면 아무 변화가 없습니다.
     *
     * @return 실제로 추가된 경우 true
     */
    public boolean addRole(Role role) {
        return roles.add(role);
    }

    /**
     * 역할을 제거합니다. 가지고 있지 않은 역할이면 아무 변화가 없습니다.
     *
     * @return 실제로 제거된 경우 true
     */
    public boolean removeRole(Role role) {
        return roles.remove(role);
    }

    public boolean hasRole(String roleName) {
        return roleName != null && roles.stream().anyMatch(role -> role.getName().equals(roleName));
    }

    public boolean hasRole(RoleRef roleRef) {
        return roleRef != null && hasRole(roleRef.roleName());
    }
}
