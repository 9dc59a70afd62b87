package com.ids.authgate.security.validation;

import java.util.function.Predicate;

/**
 * 검증 조건과 실패 시 메시지의 쌍입니다.
 *
 * @param <T> 검증 대상 타입
 */
public record ValidationRule<T>(Predicate<T> predicate, String message) {

    public static <T> ValidationRule<T> of(Predicate<T> predicate, String message) {
        return new ValidationRule<>(predicate, message);
    }

    public boolean test(T value) {
        return predicate.test(value);
    }
}
