package net.spookly.exthost.error;

import io.grpc.Status;

/**
 * Receiving from or sending to a stream failed for a reason other than close or cancellation.
 */
public final class StreamFailedException extends ExtensionHostException {
    public StreamFailedException(String message, Throwable cause) {
        super(codeOf(cause), message, cause);
    }

    private static Status.Code codeOf(Throwable cause) {
        Status status = Status.fromThrowable(cause);
        return status.getCode() == Status.Code.UNKNOWN ? Status.Code.UNAVAILABLE : status.getCode();
    }
}
