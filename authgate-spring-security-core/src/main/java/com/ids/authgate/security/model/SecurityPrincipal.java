package com.ids.authgate.security.model;

import java.io.Serializable;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;
import org.springframework.security.core.AuthenticatedPrincipal;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

/**
 * 한 요청 동안 유지되는 인증 주체의 불변 스냅샷입니다.
 * <p>
 * 익명 주체는 역할이 비어 있고 {@link #isAuthenticated()}가 false이므로,
 * 역할이 없는 인증 사용자와 구분됩니다.
 * </p>
 */
@Getter
public final class SecurityPrincipal implements AuthenticatedPrincipal, Serializable {

    private static final long serialVersionUID = 1L;

    /** Spring Security 역할 접두사 */
    public static final String ROLE_PREFIX = "ROLE_";

    private static final SecurityPrincipal ANONYMOUS = new SecurityPrincipal(null, null, Collections.emptySet(), false);

    private final String id;
    private final String username;
    private final Set<String> roles;
    private final boolean authenticated;

    private SecurityPrincipal(String id, String username, Set<String> roles, boolean authenticated) {
        this.id = id;
        this.username = username;
        this.roles = Collections.unmodifiableSet(new LinkedHashSet<>(roles));
        this.authenticated = authenticated;
    }

    public static SecurityPrincipal anonymous() {
        return ANONYMOUS;
    }

    public static SecurityPrincipal authenticated(String id, String username, Collection<String> roles) {
        if (id == null) {
            throw new IllegalArgumentException("인증된 주체의 id는 null일 수 없습니다.");
        }
        return new SecurityPrincipal(id, username, new LinkedHashSet<>(roles), true);
    }

    /**
     * 사용자 레코드의 현재 역할로 인증된 주체를 생성합니다.
     */
    public static SecurityPrincipal of(UserAccount user) {
        Set<String> roleNames = user.getRoles().stream()
            .map(Role::getName)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        return authenticated(user.getId(), user.getEmail(), roleNames);
    }

    public boolean hasRole(String roleName) {
        return roleName != null && roles.contains(roleName);
    }

    public boolean hasRole(RoleRef roleRef) {
        return roleRef != null && hasRole(roleRef.roleName());
    }

    public boolean isAnonymous() {
        return !authenticated;
    }

    /**
     * 역할을 {@code ROLE_} 접두사가 붙은 권한 목록으로 변환합니다.
     */
    public Collection<GrantedAuthority> getAuthorities() {
        return roles.stream()
            .map(role -> (GrantedAuthority) new SimpleGrantedAuthority(ROLE_PREFIX + role))
            .toList();
    }

    @Override
    public String getName() {
        return id;
    }

    @Override
    public String toString() {
        return authenticated ? "SecurityPrincipal[" + id + ", roles=" + roles + "]" : "SecurityPrincipal[anonymous]";
    }
}
