package com.ids.authgate.security.validation;

import com.ids.authgate.security.directory.UserDirectory;
import com.ids.authgate.security.model.UserCriteria;
import java.util.Objects;
import java.util.regex.Pattern;
import lombok.experimental.UtilityClass;
import org.springframework.util.StringUtils;

/**
 * 계정 관련 입력 검증 규칙 모음입니다.
 */
@UtilityClass
public class AccountValidators {

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    public static ValidationRule<String> emailRequired() {
        return ValidationRule.of(value -> StringUtils.hasText(value), "이메일이 입력되지 않았습니다.");
    }

    public static ValidationRule<String> emailFormat() {
        return ValidationRule.of(value -> value != null && EMAIL_PATTERN.matcher(value).matches(),
            "이메일 형식이 올바르지 않습니다.");
    }

    /**
     * 이미 가입된 이메일이면 실패합니다.
     */
    public static ValidationRule<String> uniqueEmail(UserDirectory directory) {
        return new ValidationRule<>(
            value -> !directory.exists(UserCriteria.byEmail(value)),
            "이미 사용 중인 이메일입니다.");
    }

    /**
     * 가입되지 않은 이메일이면 실패합니다.
     */
    public static ValidationRule<String> existingEmail(UserDirectory directory) {
        return new ValidationRule<>(
            value -> directory.exists(UserCriteria.byEmail(value)),
            "등록되지 않은 이메일입니다.");
    }

    public static ValidationRule<String> passwordRequired() {
        return ValidationRule.of(value -> StringUtils.hasText(value), "비밀번호가 입력되지 않았습니다.");
    }

    /**
     * 확인용 비밀번호가 원래 비밀번호와 같아야 합니다.
     */
    public static ValidationRule<String> passwordConfirm(String password) {
        return ValidationRule.of(confirm -> Objects.equals(password, confirm), "비밀번호가 일치하지 않습니다.");
    }

    public static FieldValidator<String> email() {
        return FieldValidator.of(emailRequired(), emailFormat());
    }

    public static FieldValidator<String> uniqueUserEmail(UserDirectory directory) {
        return email().then(uniqueEmail(directory));
    }

    public static FieldValidator<String> existingUserEmail(UserDirectory directory) {
        return email().then(existingEmail(directory));
    }

    public static FieldValidator<String> password() {
        return FieldValidator.of(passwordRequired());
    }
}
