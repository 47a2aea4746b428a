package com.couchbase.lite.changefeed.auth;

import com.couchbase.lite.changefeed.internal.InterfaceAudience;

import java.net.URL;
import java.nio.charset.StandardCharsets;

import okhttp3.Credentials;

/**
 * HTTP Basic auth with a fixed username and password.
 */
public class BasicAuthorizer implements Authorizer {

    private final String username;
    private final String password;

    @InterfaceAudience.Public
    public BasicAuthorizer(String username, String password) {
        if (username == null || password == null) {
            throw new IllegalArgumentException("username and password are required");
        }
        this.username = username;
        this.password = password;
    }

    @Override
    public String authorizeURLRequest(URL url, String realm) {
        return Credentials.basic(username, password, StandardCharsets.UTF_8);
    }

    public String getUsername() {
        return username;
    }

    @Override
    public String toString() {
        // never print the password
        return "BasicAuthorizer[" + username + "]";
    }
}
