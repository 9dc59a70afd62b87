package com.ids.authgate.security.token;

import com.ids.authgate.security.crypto.Fingerprints;
import com.ids.authgate.security.model.UserAccount;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HexFormat;

/**
 * 브라우저 재시작 후에도 세션을 복원하기 위한 remember-me 토큰을 발급/검증합니다.
 * <p>
 * 지문은 {@code HMAC-SHA256(secretKey, email + '\0' + passwordHash)}입니다.
 * 비밀번호가 바뀌면 해시가 달라지므로 이전에 발급된 remember-me 토큰은 모두 무효가 됩니다.
 * </p>
 */
public class RememberTokenCodec extends UserTokenCodec {

    public static final String NAMESPACE = "remember-token";

    private final byte[] fingerprintKey;

    public RememberTokenCodec(SignedTokenSerializer serializer, String secretKey, Duration within) {
        super(serializer, within);
        this.fingerprintKey = secretKey.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String issue(UserAccount user) {
        if (user.getEmail() == null || user.getPassword() == null) {
            throw new IllegalArgumentException("remember-me 토큰을 만들려면 이메일과 비밀번호 해시가 필요합니다.");
        }
        return super.issue(user);
    }

    @Override
    protected String fingerprint(UserAccount user) {
        String material = user.getEmail() + '\0' + user.getPassword();
        return HexFormat.of().formatHex(Fingerprints.hmacSha256(fingerprintKey, material));
    }
}
