package com.ids.authgate.security.authorization;

import com.ids.authgate.security.model.SecurityPrincipal;
import lombok.extern.slf4j.Slf4j;

/**
 * 인증된 주체의 역할 집합이 {@link RolePolicy}를 충족하는지 판단합니다.
 * 익명 주체는 역할이 없으므로 어떤 정책도 충족하지 못합니다.
 */
@Slf4j
public class AuthorizationEngine {

    public boolean isSatisfied(RolePolicy policy, SecurityPrincipal principal) {
        return switch (policy.getMode()) {
            case REQUIRED -> checkRequired(policy, principal);
            case ACCEPTED -> checkAccepted(policy, principal);
        };
    }

    private boolean checkRequired(RolePolicy policy, SecurityPrincipal principal) {
        for (String role : policy.getRoles()) {
            if (!principal.hasRole(role)) {
                log.debug("[Authorization] 필수 역할을 충족하지 못했습니다. required={}, principal={}",
                    policy.getRoles(), principal.getId());
                return false;
            }
        }
        return true;
    }

    private boolean checkAccepted(RolePolicy policy, SecurityPrincipal principal) {
        boolean accepted = policy.getRoles().stream().anyMatch(principal::hasRole);
        if (!accepted) {
            log.debug("[Authorization] 허용 역할 중 보유한 역할이 없습니다. accepted={}, provided={}",
                policy.getRoles(), principal.getRoles());
        }
        return accepted;
    }
}
