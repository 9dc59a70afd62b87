package com.ids.authgate.security.authentication;

/**
 * {@code Authorization: Basic} 헤더에서 추출한 자격 증명입니다.
 */
public record BasicCredentials(String username, String password) {

    @Override
    public String toString() {
        return "BasicCredentials[username=" + username + "]";
    }
}
