package com.ids.authgate.security.event;

import com.ids.authgate.security.model.UserAccount;

/**
 * 인증/계정 흐름에서 발생하는 보안 이벤트입니다.
 */
public sealed interface SecurityEvent
    permits SecurityEvent.IdentityChanged, SecurityEvent.IdentityCleared,
            SecurityEvent.UserRegistered, SecurityEvent.PasswordResetRequested {

    /**
     * 인증된 주체가 설정되었습니다 (로그인, Basic/토큰 인증 성공).
     */
    record IdentityChanged(String principalId) implements SecurityEvent {
    }

    /**
     * 인증된 주체가 해제되었습니다 (로그아웃).
     */
    record IdentityCleared() implements SecurityEvent {
    }

    record UserRegistered(UserAccount user) implements SecurityEvent {
    }

    /**
     * 비밀번호 재설정 토큰이 발급되었습니다. 메일 발송은 리스너가 담당합니다.
     */
    record PasswordResetRequested(UserAccount user, String token) implements SecurityEvent {

        @Override
        public String toString() {
            return "PasswordResetRequested[user=" + user.getId() + "]";
        }
    }
}
