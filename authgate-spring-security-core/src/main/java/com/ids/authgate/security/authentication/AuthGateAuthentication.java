package com.ids.authgate.security.authentication;

import com.ids.authgate.security.model.SecurityPrincipal;
import org.springframework.security.authentication.AbstractAuthenticationToken;

/**
 * 인증이 완료된 요청을 나타내는 {@link org.springframework.security.core.Authentication} 구현체입니다.
 * 권한은 {@link SecurityPrincipal}의 역할에 {@code ROLE_} 접두사를 붙여 만듭니다.
 */
public class AuthGateAuthentication extends AbstractAuthenticationToken {

    public static final String BASIC = "basic";
    public static final String TOKEN = "token";
    public static final String SESSION = "session";
    public static final String FORM = "form";

    private final SecurityPrincipal principal;
    private final String authType;

    public AuthGateAuthentication(SecurityPrincipal principal, String authType) {
        super(principal.getAuthorities());
        this.principal = principal;
        this.authType = authType;
        setAuthenticated(principal.isAuthenticated());
    }

    /**
     * 자격 증명은 인증 직후 폐기되므로 항상 null입니다.
     */
    @Override
    public Object getCredentials() {
        return null;
    }

    @Override
    public SecurityPrincipal getPrincipal() {
        return principal;
    }

    /**
     * 인증 방식 (basic, token, session, form)
     */
    public String getAuthType() {
        return authType;
    }
}
