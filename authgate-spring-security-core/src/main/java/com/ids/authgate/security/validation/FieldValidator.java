package com.ids.authgate.security.validation;

import com.ids.authgate.security.exception.ValidationFailedException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 하나의 입력 필드에 대해 규칙을 순서대로 평가하고, 처음 실패한 규칙의 메시지를 반환합니다.
 *
 * @param <T> 검증 대상 타입
 */
public final class FieldValidator<T> {

    private final List<ValidationRule<T>> rules;

    private FieldValidator(List<ValidationRule<T>> rules) {
        this.rules = List.copyOf(rules);
    }

    @SafeVarargs
    public static <T> FieldValidator<T> of(ValidationRule<T>... rules) {
        return new FieldValidator<>(List.of(rules));
    }

    /**
     * 규칙을 추가한 새 검증기를 반환합니다.
     */
    public FieldValidator<T> then(ValidationRule<T> rule) {
        List<ValidationRule<T>> extended = new ArrayList<>(rules);
        extended.add(rule);
        return new FieldValidator<>(extended);
    }

    /**
     * @return 처음 실패한 규칙의 메시지. 모두 통과하면 빈 Optional
     */
    public Optional<String> validate(T value) {
        for (ValidationRule<T> rule : rules) {
            if (!rule.test(value)) {
                return Optional.of(rule.message());
            }
        }
        return Optional.empty();
    }

    /**
     * @throws ValidationFailedException 규칙 하나가 실패한 경우
     */
    public void validateOrThrow(T value) {
        validate(value).ifPresent(message -> {
            throw new ValidationFailedException(List.of(message));
        });
    }
}
