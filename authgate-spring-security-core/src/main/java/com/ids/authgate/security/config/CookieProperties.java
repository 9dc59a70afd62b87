package com.ids.authgate.security.config;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class CookieProperties {
    private boolean httpOnly = true;
    private boolean secure = false;
    private String domain;
    private String path = "/";
    private String sameSite; // Lax, Strict, None
}
