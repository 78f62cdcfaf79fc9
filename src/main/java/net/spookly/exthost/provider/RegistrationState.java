package net.spookly.exthost.provider;

/**
 * Lifecycle of one provider stream.
 */
public enum RegistrationState {
    /** Stream open, identity not yet checked. */
    CONNECTED,
    /** Capability confirmed, waiting for the register request. */
    AWAITING_REGISTRATION,
    /** Provider key owned by this stream. */
    REGISTERED,
    CLOSED
}
