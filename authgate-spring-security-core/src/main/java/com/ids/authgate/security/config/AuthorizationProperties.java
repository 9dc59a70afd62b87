package com.ids.authgate.security.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

/**
 * AuthGate Security 인가(Authorization) 관련 설정을 담는 Properties 클래스입니다.
 * <p>
 * application.yaml:
 * <pre>
 * authgate:
 *   security:
 *     authorization:
 *       rules:
 *         - pattern: /admin/**
 *           required: [admin, editor]
 *         - pattern: /posts/new
 *           accepted: [editor, author]
 * </pre>
 * </p>
 */
@Getter
@Setter
public class AuthorizationProperties {

    /**
     * 경로별 역할 정책 목록. 선언 순서대로 매칭됩니다.
     */
    private List<RoleRule> rules = new ArrayList<>();

    @Getter
    @Setter
    public static class RoleRule {

        /** Ant 경로 패턴 */
        private String pattern;

        /** 모두 보유해야 하는 역할 */
        private List<String> required = new ArrayList<>();

        /** 하나 이상 보유해야 하는 역할 */
        private List<String> accepted = new ArrayList<>();
    }
}
