package com.ids.authgate.security.crypto;

import com.ids.authgate.security.config.PasswordProperties;
import com.ids.authgate.security.exception.ConfigurationException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.util.StringUtils;

/**
 * 비밀번호 해시 생성과 검증을 담당합니다.
 * <p>
 * HMAC 사전 해시가 활성화되면 원문 비밀번호를 {@code Base64(HMAC(key=salt, message=secret))}로 변환한 뒤
 * 적응형 해시 함수({@link PasswordEncoder}, 기본 BCrypt)에 전달합니다. 검증도 동일한 경로를 거치며,
 * 최종 비교는 {@link PasswordEncoder#matches}의 상수 시간 비교에 맡깁니다.
 * </p>
 * <p>
 * 저장된 해시가 손상되었거나 형식이 맞지 않으면 예외를 던지지 않고 false를 반환합니다.
 * </p>
 */
@Slf4j
public class CredentialCodec {

    private static final String DECOY_SECRET = "authgate-decoy-secret";

    private final PasswordEncoder passwordEncoder;
    private final String salt;
    private final boolean hmacEnabled;
    private final String hmacAlgorithm;

    private volatile String decoyHash;

    public CredentialCodec(PasswordEncoder passwordEncoder, PasswordProperties properties) {
        this.passwordEncoder = passwordEncoder;
        this.salt = properties.getSalt();
        this.hmacEnabled = properties.isHmacEnabled();
        this.hmacAlgorithm = properties.getHmacAlgorithm();

        if (hmacEnabled) {
            if (!StringUtils.hasText(salt)) {
                throw new ConfigurationException("HMAC 사전 해시를 사용하려면 password.salt 설정이 필요합니다.");
            }
            // 알고리즘 이름 오류는 요청 시점이 아니라 기동 시점에 드러나야 합니다.
            Fingerprints.hmac(hmacAlgorithm, salt.getBytes(StandardCharsets.UTF_8), new byte[0]);
        }
        log.debug("[CredentialCodec] 초기화 완료. HMAC 사전 해시: {}", hmacEnabled ? hmacAlgorithm : "사용 안 함");
    }

    /**
     * 설정된 salt로 비밀번호 해시를 생성합니다.
     */
    public String hash(String secret) {
        return hash(secret, salt);
    }

    /**
     * 지정한 salt로 비밀번호 해시를 생성합니다.
     *
     * @param secret 원문 비밀번호
     * @param salt   HMAC 키로 사용할 salt (HMAC 비활성 시 무시)
     * @return 저장용 해시 문자열
     */
    public String hash(String secret, String salt) {
        if (secret == null) {
            throw new IllegalArgumentException("비밀번호는 null일 수 없습니다.");
        }
        return passwordEncoder.encode(preHash(secret, salt));
    }

    /**
     * 설정된 salt로 비밀번호를 검증합니다.
     */
    public boolean verify(String secret, String storedHash) {
        return verify(secret, storedHash, salt);
    }

    /**
     * 비밀번호가 저장된 해시와 일치하는지 검증합니다.
     *
     * @param secret     원문 비밀번호
     * @param storedHash 저장된 해시
     * @param salt       HMAC 키로 사용할 salt
     * @return 일치하면 true, 불일치하거나 해시가 손상된 경우 false
     */
    public boolean verify(String secret, String storedHash, String salt) {
        if (secret == null || !StringUtils.hasText(storedHash)) {
            return false;
        }
        try {
            return passwordEncoder.matches(preHash(secret, salt), storedHash);
        } catch (RuntimeException e) {
            log.warn("[CredentialCodec] 비밀번호 검증 중 오류가 발생하여 실패로 처리합니다: {}", e.getClass().getSimpleName());
            return false;
        }
    }

    /**
     * 존재하지 않는 사용자에 대해서도 실제 검증과 비슷한 시간을 소비하도록 더미 해시를 검증합니다.
     * 결과는 항상 무시됩니다.
     */
    public void verifyDecoy(String secret) {
        String hash = decoyHash;
        if (hash == null) {
            hash = passwordEncoder.encode(preHash(DECOY_SECRET, salt));
            decoyHash = hash;
        }
        verify(secret != null ? secret : "", hash);
    }

    private String preHash(String secret, String salt) {
        if (!hmacEnabled) {
            return secret;
        }
        if (salt == null) {
            throw new ConfigurationException("HMAC 사전 해시에 사용할 salt가 없습니다.");
        }
        byte[] mac = Fingerprints.hmac(
            hmacAlgorithm,
            salt.getBytes(StandardCharsets.UTF_8),
            secret.getBytes(StandardCharsets.UTF_8)
        );
        return Base64.getEncoder().encodeToString(mac);
    }
}
