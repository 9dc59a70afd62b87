package com.ids.authgate.security.model;

import java.io.Serializable;
import java.util.Objects;
import lombok.Getter;
import lombok.Setter;

/**
 * 사용자에게 부여되는 이름 기반 권한 태그입니다.
 * <p>
 * 동등성은 이름으로만 판단합니다. 이름이 같으면 설명(description) 등 다른 속성이 달라도
 * 같은 역할로 취급되어 집합 연산에서 서로 대체 가능합니다.
 * </p>
 */
@Getter
public class Role implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;

    @Setter
    private String description;

    public Role(String name) {
        this(name, null);
    }

    public Role(String name, String description) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("역할 이름은 비어 있을 수 없습니다.");
        }
        this.name = name;
        this.description = description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Role other)) {
            return false;
        }
        return name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
