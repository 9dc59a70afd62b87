package com.ids.authgate.security.logging;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.MDC;

/**
 * Servlet 환경용 MDC 직접 연동 어댑터.
 * <p>
 * Servlet 환경에서는 요청당 하나의 스레드가 점유되므로 ThreadLocal 기반 MDC를 그대로 사용합니다.
 * 비동기 작업으로 넘길 때는 {@link #capture()}로 스냅샷을 떠서 작업 스레드에서 {@link #restore(Map)}합니다.
 * </p>
 */
public class WebMdcContextAccessor implements LoggingContextAccessor, LoggingContextPropagator {

    @Override
    public void put(String key, String value) {
        if (key != null && value != null) {
            MDC.put(key, value);
        }
    }

    @Override
    public String get(String key) {
        return key != null ? MDC.get(key) : null;
    }

    @Override
    public void remove(String key) {
        if (key != null) {
            MDC.remove(key);
        }
    }

    @Override
    public void clear() {
        MDC.clear();
    }

    @Override
    public Map<String, String> capture() {
        Map<String, String> contextMap = MDC.getCopyOfContextMap();
        return contextMap != null ? new HashMap<>(contextMap) : Collections.emptyMap();
    }

    @Override
    public void restore(Map<String, String> snapshot) {
        if (snapshot != null) {
            snapshot.forEach(this::put);
        }
    }
}
