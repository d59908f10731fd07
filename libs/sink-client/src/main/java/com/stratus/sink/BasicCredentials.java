package com.stratus.sink;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * HTTP Basic credentials for the sink.
 *
 * @param username the account name
 * @param password the account password
 */
public record BasicCredentials(String username, String password) {

    public BasicCredentials {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username must not be null or blank");
        }
        if (password == null) {
            throw new IllegalArgumentException("password must not be null");
        }
    }

    /**
     * The value of the {@code Authorization} header: {@code Basic base64(username:password)}.
     */
    public String headerValue() {
        String token = username + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "BasicCredentials[username=" + username + ", password=****]";
    }
}
