package com.ids.authgate.security.event;

@FunctionalInterface
public interface SecurityEventListener {

    void onEvent(SecurityEvent event);
}
