package com.ids.authgate.security.account;

import com.ids.authgate.security.directory.UserDatastore;
import com.ids.authgate.security.event.SecurityEvent;
import com.ids.authgate.security.event.SecurityEventPublisher;
import com.ids.authgate.security.exception.ValidationFailedException;
import com.ids.authgate.security.model.RoleRef;
import com.ids.authgate.security.model.UserAccount;
import com.ids.authgate.security.validation.AccountValidators;
import com.ids.authgate.security.validation.ValidationRule;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * 신규 사용자 등록을 처리합니다.
 * <p>
 * 입력값을 검증한 뒤 사용자를 생성하고 {@link SecurityEvent.UserRegistered} 이벤트를 발행합니다.
 * 별도의 이메일 확인 절차가 없으므로 가입 시각을 확인 시각({@code confirmedAt})으로 기록합니다.
 * 환영 메일 발송 등은 이벤트 리스너의 책임입니다.
 * </p>
 */
@Slf4j
public class RegistrationService {

    private final UserDatastore userDatastore;
    private final SecurityEventPublisher eventPublisher;
    private final Clock clock;

    public RegistrationService(UserDatastore userDatastore, SecurityEventPublisher eventPublisher, Clock clock) {
        this.userDatastore = userDatastore;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public UserAccount register(String email, String password, RoleRef... roles) {
        return register(email, password, password, roles);
    }

    /**
     * @throws ValidationFailedException 이메일/비밀번호 검증에 실패한 경우. 필드별 첫 번째 오류가 모두 담깁니다.
     */
    public UserAccount register(String email, String password, String passwordConfirm, RoleRef... roles) {
        List<String> errors = new ArrayList<>();
        AccountValidators.uniqueUserEmail(userDatastore.getDirectory()).validate(email).ifPresent(errors::add);
        AccountValidators.password().validate(password).ifPresent(errors::add);

        ValidationRule<String> confirm = AccountValidators.passwordConfirm(password);
        if (!confirm.test(passwordConfirm)) {
            errors.add(confirm.message());
        }
        if (!errors.isEmpty()) {
            log.debug("[Registration] 가입 입력값 검증 실패: {}", errors);
            throw new ValidationFailedException(errors);
        }

        UserAccount user = userDatastore.createUser(email, password, roles);
        user.setConfirmedAt(clock.instant());
        userDatastore.getDirectory().persist(user);
        eventPublisher.publish(new SecurityEvent.UserRegistered(user));
        log.info("[Registration] 사용자 등록 완료: {}", user.getId());
        return user;
    }
}
