package com.ids.authgate.security.manager;

import com.ids.authgate.security.authorization.AuthorizationEngine;
import com.ids.authgate.security.authorization.RolePolicy;
import com.ids.authgate.security.model.SecurityPrincipal;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

/**
 * {@link RolePolicy}를 이용한 커스텀 인가 관리자.
 * <p>
 * 인증 주체가 {@link SecurityPrincipal}이면 그 역할을 그대로 사용하고, 다른 인증 객체(remember-me 등)는
 * {@code ROLE_} 접두사가 붙은 권한에서 역할 이름을 추출합니다. 익명 요청은 항상 거부합니다.
 * </p>
 */
@RequiredArgsConstructor
@Slf4j
public class RolePolicyAuthorizationManager implements AuthorizationManager<RequestAuthorizationContext> {

    private final AuthorizationEngine authorizationEngine;
    private final RolePolicy policy;

    public static RolePolicyAuthorizationManager rolesRequired(AuthorizationEngine engine, String... roles) {
        return new RolePolicyAuthorizationManager(engine, RolePolicy.rolesRequired(roles));
    }

    public static RolePolicyAuthorizationManager rolesAccepted(AuthorizationEngine engine, String... roles) {
        return new RolePolicyAuthorizationManager(engine, RolePolicy.rolesAccepted(roles));
    }

    /**
     * 특정 요청(RequestAuthorizationContext)에 대한 접근 허용 여부를 결정합니다.
     */
    @Override
    public AuthorizationDecision check(Supplier<Authentication> authentication, RequestAuthorizationContext context) {
        HttpServletRequest request = context.getRequest();
        log.debug("[Authorization] 인가 검증 시작: {} {} {}", request.getMethod(), request.getRequestURI(), policy);

        Authentication auth = authentication.get();
        if (auth == null || !auth.isAuthenticated() || auth instanceof AnonymousAuthenticationToken) {
            log.debug("[Authorization] 인증되지 않은 사용자입니다.");
            return new AuthorizationDecision(false);
        }

        boolean granted = authorizationEngine.isSatisfied(policy, toPrincipal(auth));
        log.debug("[Authorization] 인가 결과: {} {} -> {}", request.getMethod(), request.getRequestURI(), granted ? "허용" : "거부");
        return new AuthorizationDecision(granted);
    }

    public RolePolicy getPolicy() {
        return policy;
    }

    private SecurityPrincipal toPrincipal(Authentication auth) {
        if (auth.getPrincipal() instanceof SecurityPrincipal principal) {
            return principal;
        }
        Set<String> roles = auth.getAuthorities().stream()
            .map(GrantedAuthority::getAuthority)
            .filter(authority -> authority != null && authority.startsWith(SecurityPrincipal.ROLE_PREFIX))
            .map(authority -> authority.substring(SecurityPrincipal.ROLE_PREFIX.length()))
            .collect(Collectors.toSet());
        return SecurityPrincipal.authenticated(auth.getName(), auth.getName(), roles);
    }
}
