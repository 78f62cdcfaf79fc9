package net.spookly.exthost.error;

import io.grpc.Status;

/**
 * Missing, malformed, forged or expired access token.
 */
public final class AuthenticationException extends ExtensionHostException {
    public AuthenticationException(String message) {
        super(Status.Code.UNAUTHENTICATED, message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(Status.Code.UNAUTHENTICATED, message, cause);
    }
}
