package com.ids.authgate.security.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 사용자 조회 조건입니다. 속성 이름과 기대값의 쌍으로 구성되며 모든 조건이 일치해야 합니다.
 */
public record UserCriteria(Map<String, Object> attributes) {

    public static final String ID = "id";
    public static final String EMAIL = "email";

    public UserCriteria {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static UserCriteria byId(String id) {
        return of(ID, id);
    }

    public static UserCriteria byEmail(String email) {
        return of(EMAIL, email);
    }

    public static UserCriteria of(String attribute, Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(attribute, value);
        return new UserCriteria(map);
    }

    public UserCriteria and(String attribute, Object value) {
        Map<String, Object> map = new LinkedHashMap<>(attributes);
        map.put(attribute, value);
        return new UserCriteria(map);
    }

    @Override
    public String toString() {
        return "UserCriteria" + attributes;
    }
}
