package com.ids.authgate.security.authentication;

import com.ids.authgate.security.crypto.CredentialCodec;
import com.ids.authgate.security.directory.UserDirectory;
import com.ids.authgate.security.event.SecurityEvent;
import com.ids.authgate.security.event.SecurityEventPublisher;
import com.ids.authgate.security.exception.AccountDisabledException;
import com.ids.authgate.security.exception.InvalidCredentialException;
import com.ids.authgate.security.exception.UserNotFoundException;
import com.ids.authgate.security.model.UserAccount;
import com.ids.authgate.security.model.UserCriteria;
import com.ids.authgate.security.token.AuthenticationTokenCodec;
import com.ids.authgate.security.token.RememberTokenCodec;
import com.ids.authgate.security.token.TokenPayload;
import com.ids.authgate.security.token.UserTokenCodec;
import lombok.extern.slf4j.Slf4j;

/**
 * 요청이 제시한 자격 증명이나 토큰을 검증하여 인증된 주체를 만들어 냅니다.
 * <p>
 * 지원하는 방식:
 * <ul>
 *   <li>Basic 자격 증명: 이메일로 사용자를 찾고 비밀번호 해시를 검증합니다.</li>
 *   <li>인증 토큰: 서명을 검증한 뒤 사용자를 다시 조회하고 이메일 지문을 비교합니다.</li>
 *   <li>remember-me 토큰: 서명을 검증한 뒤 이메일/비밀번호 해시 지문을 비교합니다.</li>
 *   <li>폼 자격 증명: {@link #verifyCredentials(String, String)}로 실패 원인을 예외로 구분합니다.</li>
 * </ul>
 * 비활성 사용자는 어떤 방식으로도 인증되지 않습니다.
 * </p>
 */
@Slf4j
public class AuthenticationEngine {

    private final UserDirectory userDirectory;
    private final CredentialCodec credentialCodec;
    private final AuthenticationTokenCodec authenticationTokenCodec;
    private final RememberTokenCodec rememberTokenCodec;
    private final SecurityEventPublisher eventPublisher;

    public AuthenticationEngine(UserDirectory userDirectory,
                                CredentialCodec credentialCodec,
                                AuthenticationTokenCodec authenticationTokenCodec,
                                RememberTokenCodec rememberTokenCodec,
                                SecurityEventPublisher eventPublisher) {
        this.userDirectory = userDirectory;
        this.credentialCodec = credentialCodec;
        this.authenticationTokenCodec = authenticationTokenCodec;
        this.rememberTokenCodec = rememberTokenCodec;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Basic 자격 증명으로 인증합니다. 성공 시 identity-changed 이벤트를 발행합니다.
     */
    public AuthenticationResult authenticateBasic(BasicCredentials credentials) {
        if (credentials == null) {
            return AuthenticationResult.failure();
        }
        try {
            UserAccount user = verifyCredentials(credentials.username(), credentials.password());
            log.debug("[Engine] Basic 인증 성공: {}", user.getId());
            return succeed(user);
        } catch (UserNotFoundException | InvalidCredentialException e) {
            log.debug("[Engine] Basic 인증 실패: {}", e.getErrorCode());
            return AuthenticationResult.failure();
        }
    }

    /**
     * 인증 토큰으로 인증합니다. 어떤 예외가 발생하더라도 인증 실패로 처리합니다.
     */
    public AuthenticationResult authenticateToken(String token) {
        return authenticateWith(authenticationTokenCodec, token, "토큰");
    }

    /**
     * remember-me 토큰으로 인증합니다. 비밀번호가 바뀐 뒤에는 기존 토큰이 모두 실패합니다.
     */
    public AuthenticationResult authenticateRememberToken(String token) {
        return authenticateWith(rememberTokenCodec, token, "remember-me");
    }

    /**
     * 이메일과 비밀번호를 검증하고 사용자를 반환합니다.
     * 사용자가 없을 때도 더미 해시를 검증하여 응답 시간 차이를 줄입니다.
     *
     * @throws UserNotFoundException      사용자가 없는 경우
     * @throws InvalidCredentialException 비밀번호가 틀린 경우
     * @throws AccountDisabledException   비활성 사용자인 경우
     */
    public UserAccount verifyCredentials(String email, String password) {
        UserAccount user;
        try {
            user = userDirectory.findUser(UserCriteria.byEmail(email));
        } catch (UserNotFoundException e) {
            credentialCodec.verifyDecoy(password);
            throw e;
        }

        if (!credentialCodec.verify(password, user.getPassword())) {
            throw new InvalidCredentialException();
        }
        if (!user.isActive()) {
            throw new AccountDisabledException();
        }
        return user;
    }

    private AuthenticationResult authenticateWith(UserTokenCodec codec, String token, String kind) {
        if (token == null || token.isBlank()) {
            return AuthenticationResult.failure();
        }
        try {
            TokenPayload payload = codec.parse(token);
            UserAccount user = userDirectory.findUser(UserCriteria.byId(payload.subject()));
            if (!codec.matches(payload, user) || !user.isActive()) {
                log.debug("[Engine] {} 지문이 일치하지 않거나 비활성 사용자입니다.", kind);
                return AuthenticationResult.failure();
            }
            log.debug("[Engine] {} 인증 성공: {}", kind, user.getId());
            return succeed(user);
        } catch (RuntimeException e) {
            log.debug("[Engine] {} 인증 실패: {}", kind, e.getClass().getSimpleName());
            return AuthenticationResult.failure();
        }
    }

    private AuthenticationResult succeed(UserAccount user) {
        eventPublisher.publish(new SecurityEvent.IdentityChanged(user.getId()));
        return AuthenticationResult.success(user);
    }
}
