package net.spookly.exthost.error;

import io.grpc.Status;

/**
 * The peer sent a message the stream state does not allow.
 */
public final class ProtocolViolationException extends ExtensionHostException {
    public ProtocolViolationException(String message) {
        super(Status.Code.FAILED_PRECONDITION, message);
    }
}
