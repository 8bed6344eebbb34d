package com.shetka.error;

/**
 * initData verification or admin token failure. Rendered as 401.
 *
 * The message names the failed check only ("missing hash", "bad signature", ...)
 * and must never carry tokens or signature material.
 */
public class AuthException extends ApiException {

    public AuthException(String reason) {
        super(reason);
    }
}
