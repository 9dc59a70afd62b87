package com.ids.authgate.security.session;

import com.ids.authgate.security.directory.UserDirectory;
import com.ids.authgate.security.event.SecurityEvent;
import com.ids.authgate.security.event.SecurityEventPublisher;
import com.ids.authgate.security.model.UserAccount;
import com.ids.authgate.security.token.AuthenticationTokenCodec;
import com.ids.authgate.security.token.RememberTokenCodec;
import java.time.Clock;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;

/**
 * 로그인/로그아웃의 부수 효과를 조율합니다.
 * <p>
 * 로그인: 세션 바인딩 → 인증 토큰 발급(없는 경우) → remember-me 토큰 발급(요청 시) →
 * 로그인 추적(활성화 시) → 저장 → identity-changed 이벤트 발행.
 * </p>
 * <p>
 * 동시에 로그인하는 경우 카운터와 타임스탬프는 마지막 저장이 이깁니다.
 * </p>
 */
@Slf4j
public class LoginSessionManager {

    private final UserDirectory userDirectory;
    private final AuthenticationTokenCodec authenticationTokenCodec;
    private final RememberTokenCodec rememberTokenCodec;
    private final SecurityEventPublisher eventPublisher;
    private final boolean trackable;
    private final Clock clock;

    public LoginSessionManager(UserDirectory userDirectory,
                               AuthenticationTokenCodec authenticationTokenCodec,
                               RememberTokenCodec rememberTokenCodec,
                               SecurityEventPublisher eventPublisher,
                               boolean trackable,
                               Clock clock) {
        this.userDirectory = userDirectory;
        this.authenticationTokenCodec = authenticationTokenCodec;
        this.rememberTokenCodec = rememberTokenCodec;
        this.eventPublisher = eventPublisher;
        this.trackable = trackable;
        this.clock = clock;
    }

    /**
     * 사용자를 로그인시킵니다.
     *
     * @param user     로그인할 사용자
     * @param remember remember-me 토큰 발급 여부
     * @param context  세션 계층
     * @return 세션 계층이 사용자를 거부하면 false
     */
    public boolean login(UserAccount user, boolean remember, SessionContext context) {
        if (!context.bind(user, remember)) {
            log.info("[SessionManager] 세션 바인딩이 거부되었습니다: {}", user.getId());
            return false;
        }

        if (user.getAuthenticationToken() == null) {
            user.setAuthenticationToken(authenticationTokenCodec.issue(user));
        }

        if (remember) {
            String rememberToken = rememberTokenCodec.issue(user);
            user.setRememberToken(rememberToken);
            context.remember(rememberToken);
        }

        if (trackable) {
            track(user, context.remoteAddress());
        }

        userDirectory.persist(user);
        eventPublisher.publish(new SecurityEvent.IdentityChanged(user.getId()));
        log.info("[SessionManager] 로그인 완료: {}", user.getId());
        return true;
    }

    /**
     * 현재 세션을 로그아웃합니다. 세션 계층이나 리스너에서 오류가 발생해도 실패하지 않습니다.
     */
    public void logout(SessionContext context) {
        try {
            context.clearIdentity();
        } catch (RuntimeException e) {
            log.warn("[SessionManager] 인증 표식 제거 중 오류가 발생했습니다: {}", e.getMessage());
        }

        eventPublisher.publish(new SecurityEvent.IdentityCleared());

        try {
            context.unbind();
        } catch (RuntimeException e) {
            log.warn("[SessionManager] 세션 해제 중 오류가 발생했습니다: {}", e.getMessage());
        }
        log.info("[SessionManager] 로그아웃 완료");
    }

    private void track(UserAccount user, String remoteAddress) {
        Instant now = clock.instant();

        user.setLastLoginAt(user.getCurrentLoginAt() != null ? user.getCurrentLoginAt() : now);
        user.setCurrentLoginAt(now);

        user.setLastLoginIp(user.getCurrentLoginIp() != null ? user.getCurrentLoginIp() : remoteAddress);
        user.setCurrentLoginIp(remoteAddress);

        int previous = user.getLoginCount() != null ? user.getLoginCount() : 0;
        user.setLoginCount(previous + 1);
    }
}
