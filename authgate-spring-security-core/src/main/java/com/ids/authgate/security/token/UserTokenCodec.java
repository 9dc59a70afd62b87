package com.ids.authgate.security.token;

import com.ids.authgate.security.crypto.Fingerprints;
import com.ids.authgate.security.exception.InvalidTokenException;
import com.ids.authgate.security.model.UserAccount;
import java.time.Duration;

/**
 * 사용자 레코드로부터 {@code (user_id, fingerprint)} 토큰을 발급하고 검증하는 codec의 공통 골격입니다.
 * <p>
 * 지문은 하위 클래스가 정의하며, 지문의 재료가 되는 사용자 데이터가 바뀌면 기존 토큰은 검증에 실패합니다.
 * </p>
 */
public abstract class UserTokenCodec {

    private final SignedTokenSerializer serializer;
    private final Duration within;

    protected UserTokenCodec(SignedTokenSerializer serializer, Duration within) {
        this.serializer = serializer;
        this.within = within;
    }

    /**
     * 사용자 데이터로부터 지문을 계산합니다.
     */
    protected abstract String fingerprint(UserAccount user);

    public String issue(UserAccount user) {
        return serializer.dumps(new TokenPayload(user.getId(), fingerprint(user)), within);
    }

    /**
     * @throws InvalidTokenException 서명, 형식, 만료 검증에 실패한 경우
     */
    public TokenPayload parse(String token) {
        return serializer.loads(token);
    }

    /**
     * 토큰의 지문이 사용자 레코드의 현재 지문과 일치하는지 상수 시간으로 비교합니다.
     */
    public boolean matches(TokenPayload payload, UserAccount user) {
        if (payload == null || user == null || user.getId() == null) {
            return false;
        }
        boolean fingerprintMatches = Fingerprints.constantTimeEquals(fingerprint(user), payload.fingerprint());
        return fingerprintMatches && user.getId().equals(payload.subject());
    }

    public Duration getWithin() {
        return within;
    }
}
