package net.spookly.exthost.error;

import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;

/**
 * Maps failures to the gRPC status a call ends with.
 */
public final class StatusMapper {
    private StatusMapper() {
    }

    public static Status toStatus(Throwable error) {
        if (error instanceof ExtensionHostException hostError) {
            return hostError.toStatus();
        }
        if (error instanceof StatusRuntimeException || error instanceof StatusException) {
            return Status.fromThrowable(error);
        }
        if (error instanceof IllegalArgumentException) {
            return Status.INVALID_ARGUMENT.withDescription(error.getMessage()).withCause(error);
        }
        String message = error == null ? null : error.getMessage();
        return Status.INTERNAL.withDescription(message == null ? "internal error" : message).withCause(error);
    }

    /**
     * Whether the failure only means the call went away, which ends a stream without an error.
     */
    public static boolean isGracefulTermination(Throwable error) {
        if (error instanceof OperationCancelledException) {
            return true;
        }
        return error instanceof StreamClosedException;
    }
}
