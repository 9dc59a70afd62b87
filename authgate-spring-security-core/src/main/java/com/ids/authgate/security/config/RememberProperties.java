package com.ids.authgate.security.config;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class RememberProperties {

    private String cookieName = "remember_token";

    private String within = "365 days";
}
