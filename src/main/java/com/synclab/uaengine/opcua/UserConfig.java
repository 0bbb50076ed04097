package com.synclab.uaengine.opcua;

import java.util.Objects;

/**
 * 사용자 이름 / 비밀번호 한 쌍.
 */
public final class UserConfig {

    private final String username;
    private final String password;

    public UserConfig(String username, String password) {
        this.username = Objects.requireNonNull(username, "username");
        this.password = password == null ? "" : password;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    boolean matches(String username, String password) {
        return this.username.equals(username) && this.password.equals(password);
    }

    @Override
    public String toString() {
        return "UserConfig{" + username + "}";
    }
}
