package net.spookly.exthost.provider;

import net.spookly.exthost.broker.MessageBroker;

/**
 * Builds the host-side adapter for a newly registered provider.
 *
 * @param <T> provider interface
 */
@FunctionalInterface
public interface ProviderFactory<T> {
    T create(String key, MessageBroker broker);
}
