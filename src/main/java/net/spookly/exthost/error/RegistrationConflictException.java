package net.spookly.exthost.error;

import io.grpc.Status;

/**
 * A provider key is already held by another live registration.
 */
public final class RegistrationConflictException extends ExtensionHostException {
    private final String key;

    public RegistrationConflictException(String kind, String key) {
        super(Status.Code.ALREADY_EXISTS, kind + " provider '" + key + "' is already registered");
        this.key = key;
    }

    public String key() {
        return key;
    }
}
