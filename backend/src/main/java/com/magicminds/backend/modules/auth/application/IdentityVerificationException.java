package com.magicminds.backend.modules.auth.application;

import org.springframework.http.HttpStatus;

/**
 * Terminal failure of bearer token verification. Never retried.
 */
public class IdentityVerificationException extends RuntimeException {

    public enum Reason {
        INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "auth.invalid_token"),
        TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED, "auth.token_expired"),
        INVALID_CLAIMS(HttpStatus.UNAUTHORIZED, "auth.invalid_claims"),
        SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "auth.signing_keys_unavailable");

        private final HttpStatus status;
        private final String code;

        Reason(HttpStatus status, String code) {
            this.status = status;
            this.code = code;
        }

        public HttpStatus getStatus() {
            return status;
        }

        public String getCode() {
            return code;
        }
    }

    private final Reason reason;

    public IdentityVerificationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public IdentityVerificationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
