package com.ids.authgate.security.event;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;

/**
 * 보안 이벤트 리스너 레지스트리입니다.
 * <p>
 * 리스너는 등록 순서대로 호출되며, 리스너에서 발생한 예외는 로그로 남기고 다음 리스너로 진행합니다.
 * 따라서 이벤트 발행이 로그인/로그아웃 흐름을 실패시키지 않습니다.
 * </p>
 */
@Slf4j
public class SecurityEventPublisher {

    private final List<SecurityEventListener> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(SecurityEventListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(SecurityEventListener listener) {
        listeners.remove(listener);
    }

    public void publish(SecurityEvent event) {
        log.debug("[EventPublisher] 이벤트 발행: {}", event);
        for (SecurityEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("[EventPublisher] 리스너 처리 중 오류가 발생했습니다: {}", event.getClass().getSimpleName(), e);
            }
        }
    }
}
