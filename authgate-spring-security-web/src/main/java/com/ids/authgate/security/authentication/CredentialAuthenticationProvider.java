package com.ids.authgate.security.authentication;

import com.ids.authgate.security.exception.AccountDisabledException;
import com.ids.authgate.security.exception.InvalidCredentialException;
import com.ids.authgate.security.exception.UserNotFoundException;
import com.ids.authgate.security.model.SecurityPrincipal;
import com.ids.authgate.security.model.UserAccount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.AuthenticationProvider;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.DisabledException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.AuthenticationException;

/**
 * 폼 로그인의 이메일/비밀번호를 {@link AuthenticationEngine}으로 검증하는 AuthenticationProvider입니다.
 * <p>
 * 존재하지 않는 이메일과 틀린 비밀번호는 구분하지 않고 {@link BadCredentialsException}으로 보고합니다.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class CredentialAuthenticationProvider implements AuthenticationProvider {

    private static final String BAD_CREDENTIALS_MESSAGE = "이메일 또는 비밀번호가 올바르지 않습니다.";

    private final AuthenticationEngine authenticationEngine;

    @Override
    public Authentication authenticate(Authentication authentication) throws AuthenticationException {
        String email = authentication.getName();
        String password = authentication.getCredentials() != null ? authentication.getCredentials().toString() : null;
        log.debug("[Provider] 폼 자격 증명 검증 시작: {}", email);

        try {
            UserAccount user = authenticationEngine.verifyCredentials(email, password);
            log.debug("[Provider] 폼 자격 증명 검증 성공: {}", user.getId());
            return new AuthGateAuthentication(SecurityPrincipal.of(user), AuthGateAuthentication.FORM);
        } catch (AccountDisabledException e) {
            log.debug("[Provider] 비활성화된 계정입니다: {}", email);
            throw new DisabledException(e.getMessage(), e);
        } catch (UserNotFoundException | InvalidCredentialException e) {
            log.debug("[Provider] 폼 자격 증명 검증 실패: {}", e.getErrorCode());
            throw new BadCredentialsException(BAD_CREDENTIALS_MESSAGE, e);
        }
    }

    @Override
    public boolean supports(Class<?> authentication) {
        return UsernamePasswordAuthenticationToken.class.isAssignableFrom(authentication);
    }
}
