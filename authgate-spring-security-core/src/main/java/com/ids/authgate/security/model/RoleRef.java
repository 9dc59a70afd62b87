package com.ids.authgate.security.model;

/**
 * 역할을 이름 문자열 또는 {@link Role} 인스턴스로 가리키는 참조입니다.
 * <p>
 * 공개 API 경계에서 한 번 {@link #roleName()}으로 정규화된 뒤 저장소의 {@link Role}로 해석됩니다.
 * </p>
 */
public sealed interface RoleRef permits RoleRef.Name, RoleRef.Instance {

    /**
     * 참조하는 역할의 이름
     */
    String roleName();

    static RoleRef of(String name) {
        return new Name(name);
    }

    static RoleRef of(Role role) {
        return new Instance(role);
    }

    record Name(String value) implements RoleRef {

        public Name {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("역할 이름은 비어 있을 수 없습니다.");
            }
        }

        @Override
        public String roleName() {
            return value;
        }
    }

    record Instance(Role role) implements RoleRef {

        public Instance {
            if (role == null) {
                throw new IllegalArgumentException("역할 인스턴스는 null일 수 없습니다.");
            }
        }

        @Override
        public String roleName() {
            return role.getName();
        }
    }
}
