package com.ids.authgate.security.config;

import com.ids.authgate.security.exception.ConfigurationException;
import java.time.Duration;
import java.util.Locale;
import lombok.experimental.UtilityClass;

/**
 * {@code "<amount> <unit>"} 형식의 유효 기간 설정값을 {@link Duration}으로 변환합니다.
 * <p>
 * 예: {@code "5 days"}, {@code "10 minutes"}, {@code "1 week"}
 * </p>
 */
@UtilityClass
public class ExpiryWindow {

    /**
     * @param value 설정값
     * @return 변환된 기간
     * @throws ConfigurationException 형식이 잘못되었거나 단위를 알 수 없는 경우
     */
    public static Duration parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("유효 기간 설정값이 비어 있습니다.");
        }
        String[] parts = value.trim().split("\\s+");
        if (parts.length != 2) {
            throw new ConfigurationException("유효 기간은 '<amount> <unit>' 형식이어야 합니다: " + value);
        }

        long amount;
        try {
            amount = Long.parseLong(parts[0]);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("유효 기간의 수량이 숫자가 아닙니다: " + value, e);
        }
        if (amount < 0) {
            throw new ConfigurationException("유효 기간은 음수일 수 없습니다: " + value);
        }

        return toDuration(amount, parts[1], value);
    }

    private static Duration toDuration(long amount, String unit, String original) {
        String normalized = unit.toLowerCase(Locale.ROOT);
        if (normalized.endsWith("s")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        try {
            return switch (normalized) {
                case "second" -> Duration.ofSeconds(amount);
                case "minute" -> Duration.ofMinutes(amount);
                case "hour" -> Duration.ofHours(amount);
                case "day" -> Duration.ofDays(amount);
                case "week" -> Duration.ofDays(Math.multiplyExact(amount, 7L));
                default -> throw new ConfigurationException("알 수 없는 유효 기간 단위입니다: " + original);
            };
        } catch (ArithmeticException e) {
            throw new ConfigurationException("유효 기간이 표현 가능한 범위를 넘었습니다: " + original, e);
        }
    }
}
