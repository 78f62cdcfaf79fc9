package net.spookly.exthost.error;

import io.grpc.Status;

/**
 * Base failure raised by the extension host, tagged with the gRPC status code it surfaces as.
 */
public class ExtensionHostException extends RuntimeException {
    private final Status.Code code;

    public ExtensionHostException(Status.Code code, String message) {
        super(message);
        this.code = code;
    }

    public ExtensionHostException(Status.Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public Status.Code code() {
        return code;
    }

    /**
     * Convert to a gRPC status carrying this exception's message.
     */
    public Status toStatus() {
        Status status = Status.fromCode(code).withDescription(getMessage());
        return getCause() == null ? status : status.withCause(getCause());
    }
}
