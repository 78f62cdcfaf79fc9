package net.spookly.exthost.provider;

import lombok.extern.slf4j.Slf4j;

/**
 * State of one provider stream's registration handshake.
 * <p>
 * Steps only move forward: {@code CONNECTED -> AWAITING_REGISTRATION -> REGISTERED}. {@link #close()} is
 * allowed from any state and is final.
 */
@Slf4j
final class RegistrationSession {
    private final ProviderKind kind;
    private final String extensionId;
    private RegistrationState state = RegistrationState.CONNECTED;

    RegistrationSession(ProviderKind kind, String extensionId) {
        this.kind = kind;
        this.extensionId = extensionId;
    }

    /**
     * Capability confirmed; the next message must be the register request.
     */
    void awaitRegistration() {
        advance(RegistrationState.CONNECTED, RegistrationState.AWAITING_REGISTRATION);
    }

    /**
     * The provider key is now owned by this stream.
     */
    void markRegistered() {
        advance(RegistrationState.AWAITING_REGISTRATION, RegistrationState.REGISTERED);
    }

    void close() {
        if (state != RegistrationState.CLOSED) {
            log.debug("{} stream for {}: {} -> {}", kind.id(), extensionId, state, RegistrationState.CLOSED);
            state = RegistrationState.CLOSED;
        }
    }

    RegistrationState state() {
        return state;
    }

    private void advance(RegistrationState expected, RegistrationState next) {
        if (state != expected) {
            throw new IllegalStateException(kind.id() + " stream for " + extensionId + " expected " + expected
                    + " but was " + state);
        }
        log.debug("{} stream for {}: {} -> {}", kind.id(), extensionId, state, next);
        state = next;
    }
}
