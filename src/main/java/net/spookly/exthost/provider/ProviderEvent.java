package net.spookly.exthost.provider;

import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Snapshot of a provider registry change for audit logging.
 */
@Value
@Accessors(fluent = true)
public class ProviderEvent {
    ProviderEventType type;
    Instant timestamp;
    ProviderKind kind;
    String key;
    String extensionId;
}
