package com.ids.authgate.security.token;

import com.ids.authgate.security.crypto.Fingerprints;
import com.ids.authgate.security.model.UserAccount;
import java.time.Duration;

/**
 * API 접근용 인증 토큰 {@code (user_id, md5(email))}을 발급/검증합니다.
 * <p>
 * md5는 이메일 변경을 감지하기 위한 비밀이 아닌 지문으로만 쓰입니다. 토큰의 위조 불가능성은 바깥의 서명이 보장합니다.
 * 이메일이나 서명 키가 바뀌면 발급된 토큰은 모두 무효가 되며, 비밀번호 변경은 영향을 주지 않습니다.
 * </p>
 */
public class AuthenticationTokenCodec extends UserTokenCodec {

    public static final String NAMESPACE = "authentication-token";

    public AuthenticationTokenCodec(SignedTokenSerializer serializer, Duration within) {
        super(serializer, within);
    }

    @Override
    protected String fingerprint(UserAccount user) {
        return Fingerprints.md5Hex(user.getEmail());
    }
}
