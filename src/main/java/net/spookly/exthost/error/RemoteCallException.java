package net.spookly.exthost.error;

import io.grpc.Status;

/**
 * The extension answered a request with an error envelope.
 */
public final class RemoteCallException extends ExtensionHostException {
    public RemoteCallException(String message) {
        super(Status.Code.UNKNOWN, message);
    }
}
