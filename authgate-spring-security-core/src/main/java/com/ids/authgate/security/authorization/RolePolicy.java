package com.ids.authgate.security.authorization;

import com.ids.authgate.security.exception.ConfigurationException;
import com.ids.authgate.security.model.RoleRef;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 경로에 선언되는 역할 정책입니다.
 * <ul>
 *   <li>{@link Mode#REQUIRED}: 나열된 역할을 모두 보유해야 합니다.</li>
 *   <li>{@link Mode#ACCEPTED}: 나열된 역할 중 하나 이상을 보유해야 합니다.</li>
 * </ul>
 * 역할 목록이 비어 있는 정책은 의미가 모호하므로 생성 시점에 거부합니다.
 */
public final class RolePolicy {

    public enum Mode {
        REQUIRED,
        ACCEPTED
    }

    private final Mode mode;
    private final Set<String> roles;

    private RolePolicy(Mode mode, Collection<String> roles) {
        if (roles == null || roles.isEmpty()) {
            throw new ConfigurationException("역할 정책에는 하나 이상의 역할이 필요합니다: " + mode);
        }
        this.mode = mode;
        this.roles = Collections.unmodifiableSet(new LinkedHashSet<>(roles));
    }

    public static RolePolicy rolesRequired(String... roles) {
        return of(Mode.REQUIRED, Arrays.asList(roles));
    }

    public static RolePolicy rolesAccepted(String... roles) {
        return of(Mode.ACCEPTED, Arrays.asList(roles));
    }

    public static RolePolicy rolesRequired(RoleRef... roles) {
        return of(Mode.REQUIRED, Arrays.stream(roles).map(RoleRef::roleName).toList());
    }

    public static RolePolicy rolesAccepted(RoleRef... roles) {
        return of(Mode.ACCEPTED, Arrays.stream(roles).map(RoleRef::roleName).toList());
    }

    public static RolePolicy of(Mode mode, Collection<String> roles) {
        return new RolePolicy(mode, roles);
    }

    public Mode getMode() {
        return mode;
    }

    public Set<String> getRoles() {
        return roles;
    }

    @Override
    public String toString() {
        return mode + roles.toString();
    }
}
