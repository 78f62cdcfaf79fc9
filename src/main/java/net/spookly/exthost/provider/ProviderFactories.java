package net.spookly.exthost.provider;

import java.util.EnumMap;
import java.util.Map;

/**
 * Explicit mapping from provider kind to the factory that builds its adapter.
 */
public final class ProviderFactories {
    private final Map<ProviderKind, ProviderFactory<?>> factories = new EnumMap<>(ProviderKind.class);

    /**
     * Factories producing the remote adapters that forward calls over the registering stream.
     */
    public static ProviderFactories defaults() {
        ProviderFactories factories = new ProviderFactories();
        factories.register(ProviderKind.SERVICE_TARGET, RemoteServiceTarget::new);
        factories.register(ProviderKind.FRAMEWORK_SERVICE, RemoteFrameworkService::new);
        factories.register(ProviderKind.PROVISIONING, RemoteProvisioningProvider::new);
        return factories;
    }

    /**
     * Set or replace the factory for a kind.
     */
    public ProviderFactories register(ProviderKind kind, ProviderFactory<?> factory) {
        factories.put(kind, factory);
        return this;
    }

    /**
     * @throws IllegalStateException when no factory is registered for the kind
     */
    @SuppressWarnings("unchecked")
    public <T> ProviderFactory<T> factory(ProviderKind kind) {
        ProviderFactory<?> factory = factories.get(kind);
        if (factory == null) {
            throw new IllegalStateException("no provider factory registered for " + kind.id());
        }
        return (ProviderFactory<T>) factory;
    }
}
