package net.spookly.exthost.auth;

/**
 * Redacts tokens and keys for logs.
 */
public final class TokenRedactor {
    private static final String REDACTED = "REDACTED";
    private static final String BEARER_PREFIX = "bearer ";

    private TokenRedactor() {
    }

    /**
     * @return {@code null} for {@code null}, empty for empty, otherwise {@code REDACTED}
     */
    public static String redact(String token) {
        if (token == null) {
            return null;
        }
        if (token.isEmpty()) {
            return "";
        }
        return REDACTED;
    }

    /**
     * Keep the auth scheme of an {@code authorization} header but hide its credential.
     */
    public static String redactAuthorization(String header) {
        if (header == null || header.isEmpty()) {
            return redact(header);
        }
        if (header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return header.substring(0, BEARER_PREFIX.length()) + REDACTED;
        }
        return REDACTED;
    }

    public static String redactKey(byte[] key) {
        if (key == null) {
            return null;
        }
        return REDACTED + "(" + key.length + " bytes)";
    }
}
