package com.magicminds.backend.global.error;

import java.util.Locale;

import org.springframework.http.HttpStatus;

/**
 * RFC 7807 body shared by the controller advice and the security handlers. {@code code} is the value
 * clients branch on; {@code type} is derived from it.
 */
public record ProblemResponse(String type, String title, int status, String detail, String instance, String code) {

    static final String TYPE_PREFIX = "https://magicminds.app/problems/";

    public static ProblemResponse of(HttpStatus status, String code, String detail, String instance) {
        String resolvedCode = (code != null && !code.isBlank()) ? code : status.name().toLowerCase(Locale.ROOT);
        String resolvedDetail = (detail != null && !detail.isBlank()) ? detail : status.getReasonPhrase();
        return new ProblemResponse(typeOf(resolvedCode), status.getReasonPhrase(), status.value(),
                resolvedDetail, instance, resolvedCode);
    }

    public static ProblemResponse of(ProblemException ex, String instance) {
        return of(ex.getHttpStatus(), ex.getCode(), ex.getDetailMessage(), instance);
    }

    static String typeOf(String code) {
        return TYPE_PREFIX + code.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._-]+", "-");
    }
}
