package com.ids.authgate.security.config;

/**
 * AuthGate Security 웹 계층에서 사용하는 상수를 정의하는 클래스입니다.
 */
public final class AuthGateSecurityConstants {

    private AuthGateSecurityConstants() {
        // 인스턴스화 방지
    }

    /** 로그아웃 URL */
    public static final String LOGOUT_URL = "/logout";

    /** 로그인 폼의 이메일 파라미터 */
    public static final String EMAIL_PARAMETER = "email";

    /** 로그인 폼의 비밀번호 파라미터 */
    public static final String PASSWORD_PARAMETER = "password";

    /** 로그인 폼의 remember-me 파라미터 */
    public static final String REMEMBER_PARAMETER = "remember";

    /** 로그인 후 이동할 경로를 전달하는 파라미터 */
    public static final String NEXT_PARAMETER = "next";

    // ===== Session Attributes =====

    /** 세션에 바인딩된 사용자 ID */
    public static final String IDENTITY_NAME_ATTR = "identity.name";

    /** 세션에 바인딩된 인증 방식 */
    public static final String IDENTITY_AUTH_TYPE_ATTR = "identity.auth_type";

    // ===== Flash =====

    /** 플래시 메시지 키 */
    public static final String FLASH_MESSAGE_KEY = "message";

    /** 플래시 메시지 분류 키 */
    public static final String FLASH_CATEGORY_KEY = "category";
}
