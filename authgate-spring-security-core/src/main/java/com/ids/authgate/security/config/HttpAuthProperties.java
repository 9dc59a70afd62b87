package com.ids.authgate.security.config;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class HttpAuthProperties {

    /** Basic 인증 실패 시 WWW-Authenticate 헤더에 표시할 기본 realm */
    private String realm = "Login Required";
}
