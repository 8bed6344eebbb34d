package com.shetka.model;

import com.shetka.error.AuthException;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decoded {@code user} object from a verified initData payload.
 * Attributes are kept as sent by Telegram (id, first_name, username, ...).
 */
public record AuthenticatedUser(Map<String, Object> attributes) {

    public AuthenticatedUser {
        // user objects may hold null values
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Telegram user id used as the order owner.
     *
     * @throws AuthException when {@code id} is absent or not an integer
     */
    public long tgId() {
        Object id = attributes.get("id");
        if (id instanceof Integer || id instanceof Long) {
            return ((Number) id).longValue();
        }
        if (id instanceof String text) {
            try {
                return Long.parseLong(text.strip());
            } catch (NumberFormatException e) {
                throw new AuthException("bad user id");
            }
        }
        if (id instanceof Number number) {
            try {
                return new BigDecimal(number.toString()).longValueExact();
            } catch (ArithmeticException | NumberFormatException e) {
                throw new AuthException("bad user id");
            }
        }
        throw new AuthException("bad user id");
    }

    public String username() {
        Object username = attributes.get("username");
        return username == null ? null : username.toString();
    }
}
