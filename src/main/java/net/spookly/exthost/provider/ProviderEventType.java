package net.spookly.exthost.provider;

/**
 * Audit event types emitted by provider registries.
 */
public enum ProviderEventType {
    REGISTER,
    CONFLICT,
    REMOVE
}
