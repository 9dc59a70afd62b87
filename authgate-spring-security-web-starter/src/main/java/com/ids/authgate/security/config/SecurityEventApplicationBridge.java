package com.ids.authgate.security.config;

import com.ids.authgate.security.event.SecurityEvent;
import com.ids.authgate.security.event.SecurityEventListener;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;

/**
 * AuthGate 보안 이벤트를 Spring {@link ApplicationEventPublisher}로 다시 발행합니다.
 * <p>
 * 애플리케이션에서는 {@code @EventListener}로 {@link SecurityEvent} 하위 타입을 구독할 수 있습니다.
 * 예: 비밀번호 재설정 메일 발송은 {@link SecurityEvent.PasswordResetRequested}를 구독하여 처리합니다.
 * </p>
 */
@RequiredArgsConstructor
public class SecurityEventApplicationBridge implements SecurityEventListener {

    private final ApplicationEventPublisher applicationEventPublisher;

    @Override
    public void onEvent(SecurityEvent event) {
        applicationEventPublisher.publishEvent(event);
    }
}
