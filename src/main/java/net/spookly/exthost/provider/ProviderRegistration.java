package net.spookly.exthost.provider;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.exthost.broker.MessageBroker;

/**
 * Active claim of one provider key by one extension stream.
 *
 * @param <T> provider interface
 */
@Getter
@Accessors(fluent = true)
public final class ProviderRegistration<T> {
    private final ProviderKind kind;
    private final String key;
    private final String extensionId;
    private final MessageBroker broker;
    private final T provider;
    private final Instant registeredAt;
    @Getter(AccessLevel.NONE)
    private final ProviderRegistry<T> registry;
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean released = new AtomicBoolean();

    ProviderRegistration(ProviderRegistry<T> registry,
                         String key,
                         String extensionId,
                         MessageBroker broker,
                         T provider,
                         Instant registeredAt) {
        this.registry = registry;
        this.kind = registry.kind();
        this.key = key;
        this.extensionId = extensionId;
        this.broker = broker;
        this.provider = provider;
        this.registeredAt = registeredAt;
    }

    /**
     * Give the key back to the registry. Only the first call has an effect.
     *
     * @return {@code true} when this call removed the registration
     */
    public boolean release() {
        if (!released.compareAndSet(false, true)) {
            return false;
        }
        return registry.remove(this);
    }

    public boolean isReleased() {
        return released.get();
    }
}
