package net.spookly.exthost.error;

import java.util.concurrent.TimeoutException;

import io.grpc.Context;
import io.grpc.Status;

/**
 * A blocking wait ended because its context was cancelled or its deadline passed.
 */
public final class OperationCancelledException extends ExtensionHostException {
    private OperationCancelledException(Status.Code code, String message, Throwable cause) {
        super(code, message, cause);
    }

    public static OperationCancelledException from(Context context, String operation) {
        Throwable cause = context == null ? null : context.cancellationCause();
        if (cause instanceof TimeoutException) {
            return new OperationCancelledException(Status.Code.DEADLINE_EXCEEDED, operation + " timed out", cause);
        }
        return new OperationCancelledException(Status.Code.CANCELLED, operation + " cancelled", cause);
    }

    public static OperationCancelledException interrupted(String operation, InterruptedException cause) {
        return new OperationCancelledException(Status.Code.CANCELLED, operation + " interrupted", cause);
    }
}
