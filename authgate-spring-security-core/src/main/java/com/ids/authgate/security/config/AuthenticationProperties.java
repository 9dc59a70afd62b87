package com.ids.authgate.security.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

/**
 * AuthGate Security 인증(Authentication) 관련 설정을 담는 Properties 클래스입니다.
 * <p>
 * 경로는 Ant 패턴을 지원합니다: /api/**, /public/*, etc.
 * </p>
 */
@Getter
@Setter
public class AuthenticationProperties {

    /**
     * 인증 없이 접근 가능한 경로 목록 (permitAll)
     */
    private List<String> permitAllPaths = new ArrayList<>();

    /**
     * HTTP Basic 자격 증명으로 보호할 경로 목록
     */
    private List<String> httpAuthPaths = new ArrayList<>();

    /**
     * 인증 토큰으로 보호할 경로 목록
     */
    private List<String> tokenAuthPaths = new ArrayList<>();
}
