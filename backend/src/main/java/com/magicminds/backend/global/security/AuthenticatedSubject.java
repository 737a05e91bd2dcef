package com.magicminds.backend.global.security;

/**
 * Verified caller identity: the identity provider's stable subject and, when the token carries one, an email.
 * Controllers receive it as the authentication principal and hand it explicitly to every unit of work.
 */
public record AuthenticatedSubject(String subject, String email) {

    public AuthenticatedSubject {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be blank");
        }
    }

    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }
}
