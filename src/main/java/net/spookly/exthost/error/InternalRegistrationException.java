package net.spookly.exthost.error;

import io.grpc.Status;

/**
 * Building the provider adapter for a registration failed.
 */
public final class InternalRegistrationException extends ExtensionHostException {
    public InternalRegistrationException(String message, Throwable cause) {
        super(Status.Code.INTERNAL, message, cause);
    }
}
