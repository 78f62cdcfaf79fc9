package net.spookly.exthost.error;

import io.grpc.Status;

/**
 * A pending call was abandoned because its stream stopped.
 */
public final class StreamClosedException extends ExtensionHostException {
    public StreamClosedException(String message) {
        super(Status.Code.UNAVAILABLE, message);
    }
}
