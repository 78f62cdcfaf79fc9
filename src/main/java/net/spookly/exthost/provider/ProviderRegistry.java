package net.spookly.exthost.provider;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import net.spookly.exthost.broker.MessageBroker;
import net.spookly.exthost.error.InternalRegistrationException;
import net.spookly.exthost.error.RegistrationConflictException;

/**
 * Registry of the providers of one kind, keyed by provider key (host, language or provider name).
 * At most one registration exists per key; the registry owns the lock guarding its map.
 *
 * @param <T> provider interface
 */
public final class ProviderRegistry<T> {
    private final ProviderKind kind;
    private final ProviderEventListener eventListener;
    private final Clock clock;
    private final Object lock = new Object();
    private final Map<String, ProviderRegistration<T>> registrations = new HashMap<>();

    public ProviderRegistry(ProviderKind kind) {
        this(kind, ProviderEventListener.NOOP, Clock.systemUTC());
    }

    public ProviderRegistry(ProviderKind kind, ProviderEventListener eventListener, Clock clock) {
        this.kind = kind;
        this.eventListener = eventListener == null ? ProviderEventListener.NOOP : eventListener;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public ProviderKind kind() {
        return kind;
    }

    /**
     * Claim the key for the broker's stream, building the provider adapter with the factory.
     * The conflict check, adapter construction and insert happen atomically.
     *
     * @throws RegistrationConflictException when the key is already registered; the existing entry is untouched
     * @throws InternalRegistrationException when the factory fails; nothing is inserted
     */
    public ProviderRegistration<T> register(String key, String extensionId, MessageBroker broker, ProviderFactory<T> factory) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("provider key is required");
        }
        ProviderRegistration<T> registration = null;
        synchronized (lock) {
            if (!registrations.containsKey(key)) {
                registration = insert(key, extensionId, broker, factory);
            }
        }
        if (registration == null) {
            emit(ProviderEventType.CONFLICT, key, extensionId);
            throw new RegistrationConflictException(kind.id(), key);
        }
        emit(ProviderEventType.REGISTER, key, extensionId);
        return registration;
    }

    // Caller holds the lock.
    private ProviderRegistration<T> insert(String key, String extensionId, MessageBroker broker, ProviderFactory<T> factory) {
        T provider;
        try {
            provider = factory.create(key, broker);
        } catch (RuntimeException e) {
            throw new InternalRegistrationException("failed to create " + kind.id() + " provider for " + key, e);
        }
        if (provider == null) {
            throw new InternalRegistrationException("factory returned no " + kind.id() + " provider for " + key, null);
        }
        ProviderRegistration<T> registration =
                new ProviderRegistration<>(this, key, extensionId, broker, provider, clock.instant());
        registrations.put(key, registration);
        return registration;
    }

    public Optional<T> lookup(String key) {
        return find(key).map(ProviderRegistration::provider);
    }

    public Optional<ProviderRegistration<T>> find(String key) {
        if (key == null) {
            return Optional.empty();
        }
        synchronized (lock) {
            return Optional.ofNullable(registrations.get(key));
        }
    }

    /**
     * Remove the registration only if it still owns its key.
     */
    boolean remove(ProviderRegistration<T> registration) {
        boolean removed;
        synchronized (lock) {
            removed = registrations.remove(registration.key(), registration);
        }
        if (removed) {
            emit(ProviderEventType.REMOVE, registration.key(), registration.extensionId());
        }
        return removed;
    }

    public List<String> keys() {
        synchronized (lock) {
            List<String> keys = new ArrayList<>(registrations.keySet());
            keys.sort(String::compareTo);
            return keys;
        }
    }

    public int size() {
        synchronized (lock) {
            return registrations.size();
        }
    }

    private void emit(ProviderEventType type, String key, String extensionId) {
        eventListener.onEvent(new ProviderEvent(type, clock.instant(), kind, key, extensionId));
    }
}
