package com.ids.authgate.security.exception;

/**
 * 비밀번호는 맞지만 비활성화된 계정으로 로그인하려는 경우 발생합니다.
 */
public class AccountDisabledException extends InvalidCredentialException {

    public AccountDisabledException() {
        super("비활성화된 계정입니다.");
    }
}
