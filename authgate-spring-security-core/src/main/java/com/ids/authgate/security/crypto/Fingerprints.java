package com.ids.authgate.security.crypto;

import com.ids.authgate.security.exception.ConfigurationException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import lombok.experimental.UtilityClass;
import org.springframework.util.DigestUtils;

/**
 * 지문(fingerprint) 계산과 HMAC, 상수 시간 비교를 위한 유틸리티 클래스입니다.
 * <p>
 * {@link #md5Hex(String)}는 데이터 변경 감지용 비밀이 아닌 지문입니다.
 * 충돌 저항성이 필요한 보안 경계에는 사용하지 않습니다.
 * </p>
 */
@UtilityClass
public class Fingerprints {

    /**
     * 문자열의 MD5 해시를 16진수 문자열로 반환합니다.
     *
     * @param value 원본 문자열 (null이면 빈 문자열로 취급)
     * @return 32자리 16진수 문자열
     */
    public static String md5Hex(String value) {
        String source = value != null ? value : "";
        return DigestUtils.md5DigestAsHex(source.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 주어진 알고리즘으로 HMAC을 계산합니다.
     *
     * @param algorithm javax.crypto Mac 알고리즘 이름 (예: HmacSHA256)
     * @param key       HMAC 키
     * @param message   메시지
     * @return HMAC 바이트 배열
     * @throws ConfigurationException 알고리즘을 사용할 수 없거나 키가 유효하지 않은 경우
     */
    public static byte[] hmac(String algorithm, byte[] key, byte[] message) {
        try {
            Mac mac = Mac.getInstance(algorithm);
            mac.init(new SecretKeySpec(key, algorithm));
            return mac.doFinal(message);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new ConfigurationException("HMAC 계산에 실패했습니다. 알고리즘: " + algorithm, e);
        }
    }

    public static byte[] hmacSha256(byte[] key, String message) {
        return hmac("HmacSHA256", key, message.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 두 문자열을 상수 시간으로 비교합니다. 어느 한쪽이 null이면 false입니다.
     */
    public static boolean constantTimeEquals(String expected, String actual) {
        if (expected == null || actual == null) {
            return false;
        }
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            actual.getBytes(StandardCharsets.UTF_8)
        );
    }
}
