package com.ids.authgate.security.token;

import com.ids.authgate.security.crypto.Fingerprints;
import com.ids.authgate.security.exception.ConfigurationException;
import com.ids.authgate.security.exception.InvalidTokenException;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jose.util.Base64URL;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

/**
 * {@link TokenPayload}를 HS256으로 서명된 compact JWS 문자열로 직렬화하고, 역직렬화 시 서명과 만료를 검증합니다.
 * <p>
 * Nimbus JOSE + JWT 라이브러리를 사용합니다. 서명 키는 서버 비밀 키와 토큰 종류별 namespace로부터
 * {@code HMAC-SHA256(secretKey, namespace)}로 파생되므로, 한 종류의 토큰은 다른 종류로 해석되지 않습니다.
 * namespace는 audience 클레임에도 기록됩니다.
 * </p>
 */
@Slf4j
public class SignedTokenSerializer {

    static final String FINGERPRINT_CLAIM = "fp";

    private final String namespace;
    private final JWSSigner signer;
    private final JWSVerifier verifier;
    private final Clock clock;

    public SignedTokenSerializer(String secretKey, String namespace, Clock clock) {
        if (!StringUtils.hasText(secretKey)) {
            throw new ConfigurationException("토큰 서명을 위한 secret-key 설정이 필요합니다.");
        }
        if (!StringUtils.hasText(namespace)) {
            throw new ConfigurationException("토큰 namespace가 비어 있습니다.");
        }
        this.namespace = namespace;
        this.clock = clock;

        byte[] derivedKey = Fingerprints.hmacSha256(secretKey.getBytes(StandardCharsets.UTF_8), namespace);
        try {
            this.signer = new MACSigner(derivedKey);
            this.verifier = new MACVerifier(derivedKey);
        } catch (JOSEException e) {
            throw new ConfigurationException("토큰 서명 키를 초기화할 수 없습니다.", e);
        }
    }

    public String getNamespace() {
        return namespace;
    }

    /**
     * 페이로드를 서명된 토큰 문자열로 직렬화합니다.
     *
     * @param payload 직렬화할 페이로드
     * @param ttl     유효 기간. null이면 만료 시각을 기록하지 않습니다.
     * @return compact JWS 문자열
     */
    public String dumps(TokenPayload payload, Duration ttl) {
        Instant now = clock.instant();
        JWTClaimsSet.Builder claims = new JWTClaimsSet.Builder()
            .subject(payload.subject())
            .audience(namespace)
            .claim(FINGERPRINT_CLAIM, payload.fingerprint())
            .issueTime(Date.from(now));
        if (ttl != null) {
            claims.expirationTime(Date.from(now.plus(ttl)));
        }

        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims.build());
        try {
            jwt.sign(signer);
        } catch (JOSEException e) {
            throw new ConfigurationException("토큰 서명에 실패했습니다.", e);
        }
        return jwt.serialize();
    }

    /**
     * 토큰 문자열을 검증하고 페이로드를 복원합니다.
     *
     * @param token 토큰 문자열
     * @return 복원된 페이로드
     * @throws InvalidTokenException 형식 오류, 서명 불일치, namespace 불일치, 만료된 경우
     */
    public TokenPayload loads(String token) {
        if (!StringUtils.hasText(token)) {
            throw new InvalidTokenException("토큰이 비어 있습니다.");
        }
        try {
            SignedJWT jwt = SignedJWT.parse(token);
            if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm())) {
                throw new InvalidTokenException("지원하지 않는 서명 알고리즘입니다.");
            }
            if (!isCanonical(jwt.getSignature()) || !jwt.verify(verifier)) {
                throw new InvalidTokenException("토큰 서명이 일치하지 않습니다.");
            }

            JWTClaimsSet claims = jwt.getJWTClaimsSet();
            List<String> audience = claims.getAudience();
            if (audience == null || !audience.contains(namespace)) {
                throw new InvalidTokenException("토큰 용도가 일치하지 않습니다.");
            }

            Date expiration = claims.getExpirationTime();
            if (expiration != null && !clock.instant().isBefore(expiration.toInstant())) {
                throw new InvalidTokenException("토큰이 만료되었습니다.");
            }

            String subject = claims.getSubject();
            String fingerprint = claims.getStringClaim(FINGERPRINT_CLAIM);
            if (subject == null || fingerprint == null) {
                throw new InvalidTokenException("토큰에 필수 클레임이 없습니다.");
            }
            return new TokenPayload(subject, fingerprint);

        } catch (InvalidTokenException e) {
            throw e;
        } catch (ParseException | JOSEException e) {
            throw new InvalidTokenException("토큰 형식이 올바르지 않습니다.", e);
        } catch (RuntimeException e) {
            log.debug("[TokenSerializer] 토큰 해석 중 예상치 못한 오류: {}", e.getClass().getSimpleName());
            throw new InvalidTokenException("토큰을 해석할 수 없습니다.", e);
        }
    }

    /**
     * 서명 부분이 정규 Base64URL 표현인지 확인합니다. 디코딩 시 무시되는 비트나 문자를 바꾼 변조를 거부합니다.
     */
    private boolean isCanonical(Base64URL signature) {
        return signature != null && Base64URL.encode(signature.decode()).toString().equals(signature.toString());
    }
}
