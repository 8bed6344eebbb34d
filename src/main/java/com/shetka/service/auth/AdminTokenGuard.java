package com.shetka.service.auth;

import com.shetka.config.AppProperties;
import com.shetka.error.AuthException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the X-Admin-Token header against ADMIN_API_TOKEN.
 * Exact match only, compared in constant time.
 */
@Component
public class AdminTokenGuard {

    private final byte[] expected;

    @Autowired
    public AdminTokenGuard(AppProperties properties) {
        this(properties.getAdmin().getApiToken());
    }

    AdminTokenGuard(String adminToken) {
        this.expected = adminToken.strip().getBytes(StandardCharsets.UTF_8);
    }

    public void require(String presentedToken) {
        byte[] presented = presentedToken == null
                ? new byte[0]
                : presentedToken.getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expected, presented)) {
            throw new AuthException("bad admin token");
        }
    }
}
