package com.ids.authgate.security.account;

import com.ids.authgate.security.crypto.CredentialCodec;
import com.ids.authgate.security.directory.UserDirectory;
import com.ids.authgate.security.event.SecurityEvent;
import com.ids.authgate.security.event.SecurityEventPublisher;
import com.ids.authgate.security.exception.InvalidTokenException;
import com.ids.authgate.security.exception.UserNotFoundException;
import com.ids.authgate.security.exception.ValidationFailedException;
import com.ids.authgate.security.model.UserAccount;
import com.ids.authgate.security.model.UserCriteria;
import com.ids.authgate.security.token.PasswordResetTokenCodec;
import com.ids.authgate.security.token.RememberTokenCodec;
import com.ids.authgate.security.token.TokenPayload;
import com.ids.authgate.security.validation.AccountValidators;
import lombok.extern.slf4j.Slf4j;

/**
 * 비밀번호 재설정 요청, 토큰 기반 재설정, 비밀번호 변경을 처리합니다.
 * <p>
 * 재설정 토큰의 지문은 현재 비밀번호 해시에서 계산되므로, 재설정이 한 번 완료되면 같은 토큰은 다시 쓸 수 없습니다.
 * 비밀번호가 바뀌면 기존 remember-me 토큰도 함께 무효가 되며, 사용자가 remember-me를 쓰고 있었다면 새 토큰을 발급합니다.
 * </p>
 */
@Slf4j
public class PasswordRecoveryService {

    private final UserDirectory userDirectory;
    private final CredentialCodec credentialCodec;
    private final PasswordResetTokenCodec resetTokenCodec;
    private final RememberTokenCodec rememberTokenCodec;
    private final SecurityEventPublisher eventPublisher;

    public PasswordRecoveryService(UserDirectory userDirectory,
                                   CredentialCodec credentialCodec,
                                   PasswordResetTokenCodec resetTokenCodec,
                                   RememberTokenCodec rememberTokenCodec,
                                   SecurityEventPublisher eventPublisher) {
        this.userDirectory = userDirectory;
        this.credentialCodec = credentialCodec;
        this.resetTokenCodec = resetTokenCodec;
        this.rememberTokenCodec = rememberTokenCodec;
        this.eventPublisher = eventPublisher;
    }

    /**
     * 재설정 토큰을 발급하고 {@link SecurityEvent.PasswordResetRequested} 이벤트를 발행합니다.
     *
     * @return 발급된 재설정 토큰
     * @throws ValidationFailedException 이메일 형식이 잘못되었거나 가입되지 않은 이메일인 경우
     */
    public String requestReset(String email) {
        AccountValidators.existingUserEmail(userDirectory).validateOrThrow(email);

        UserAccount user = userDirectory.findUser(UserCriteria.byEmail(email));
        String token = resetTokenCodec.issue(user);
        eventPublisher.publish(new SecurityEvent.PasswordResetRequested(user, token));
        log.info("[PasswordRecovery] 비밀번호 재설정 요청: {}", user.getId());
        return token;
    }

    /**
     * 재설정 토큰을 검증하고 비밀번호를 바꿉니다.
     *
     * @throws InvalidTokenException     토큰이 위조/만료되었거나 이미 사용된 경우
     * @throws ValidationFailedException 새 비밀번호가 비어 있는 경우
     */
    public UserAccount resetPassword(String token, String newPassword) {
        AccountValidators.password().validateOrThrow(newPassword);

        TokenPayload payload = resetTokenCodec.parse(token);
        UserAccount user;
        try {
            user = userDirectory.findUser(UserCriteria.byId(payload.subject()));
        } catch (UserNotFoundException e) {
            throw new InvalidTokenException("재설정 토큰의 사용자가 존재하지 않습니다.", e);
        }
        if (!resetTokenCodec.matches(payload, user)) {
            throw new InvalidTokenException("이미 사용되었거나 유효하지 않은 재설정 토큰입니다.");
        }

        applyPassword(user, newPassword);
        log.info("[PasswordRecovery] 비밀번호 재설정 완료: {}", user.getId());
        return user;
    }

    /**
     * 로그인한 사용자의 비밀번호를 바꿉니다.
     *
     * @throws ValidationFailedException 새 비밀번호가 비어 있는 경우
     */
    public UserAccount changePassword(UserAccount user, String newPassword) {
        AccountValidators.password().validateOrThrow(newPassword);
        applyPassword(user, newPassword);
        log.info("[PasswordRecovery] 비밀번호 변경 완료: {}", user.getId());
        return user;
    }

    private void applyPassword(UserAccount user, String newPassword) {
        user.setPassword(credentialCodec.hash(newPassword));
        if (user.getRememberToken() != null) {
            user.setRememberToken(rememberTokenCodec.issue(user));
        }
        userDirectory.persist(user);
    }
}
