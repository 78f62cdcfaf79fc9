package net.spookly.exthost.error;

import io.grpc.Status;

/**
 * An extension reported a lifecycle hook as failed, or the hook could not be delivered.
 */
public final class LifecycleHookException extends ExtensionHostException {
    public LifecycleHookException(String message) {
        super(Status.Code.ABORTED, message);
    }

    public LifecycleHookException(String message, Throwable cause) {
        super(Status.Code.ABORTED, message, cause);
    }
}
