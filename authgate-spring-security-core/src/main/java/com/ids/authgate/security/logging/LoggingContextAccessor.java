package com.ids.authgate.security.logging;

/**
 * 로깅 컨텍스트에 데이터를 읽고 쓰는 추상화 인터페이스.
 * Servlet 환경에서는 SLF4J MDC 기반으로 구현됩니다.
 */
public interface LoggingContextAccessor {

    void put(String key, String value);

    String get(String key);

    void remove(String key);

    /**
     * 컨텍스트를 초기화합니다.
     */
    void clear();
}
