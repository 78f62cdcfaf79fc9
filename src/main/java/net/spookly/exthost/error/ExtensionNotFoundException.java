package net.spookly.exthost.error;

import io.grpc.Status;

/**
 * Token subject does not match an installed extension.
 */
public final class ExtensionNotFoundException extends ExtensionHostException {
    public ExtensionNotFoundException(String extensionId) {
        super(Status.Code.FAILED_PRECONDITION, "extension not installed: " + extensionId);
    }
}
