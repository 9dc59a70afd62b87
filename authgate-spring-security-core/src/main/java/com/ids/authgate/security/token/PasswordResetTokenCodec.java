package com.ids.authgate.security.token;

import com.ids.authgate.security.crypto.Fingerprints;
import com.ids.authgate.security.model.UserAccount;
import java.time.Duration;

/**
 * 비밀번호 재설정 토큰 {@code (user_id, md5(password_hash))}을 발급/검증합니다.
 * 재설정이 한 번 수행되면 해시가 바뀌므로 같은 토큰은 다시 사용할 수 없습니다.
 */
public class PasswordResetTokenCodec extends UserTokenCodec {

    public static final String NAMESPACE = "reset-password-token";

    public PasswordResetTokenCodec(SignedTokenSerializer serializer, Duration within) {
        super(serializer, within);
    }

    @Override
    protected String fingerprint(UserAccount user) {
        return Fingerprints.md5Hex(user.getPassword());
    }
}
