package net.spookly.exthost.error;

import io.grpc.Status;

/**
 * Authenticated extension lacks the capability an RPC requires.
 */
public final class AuthorizationException extends ExtensionHostException {
    public AuthorizationException(String message) {
        super(Status.Code.PERMISSION_DENIED, message);
    }
}
