package net.spookly.exthost.provider;

/**
 * Listener for provider registry audit events.
 */
@FunctionalInterface
public interface ProviderEventListener {
    ProviderEventListener NOOP = event -> {
    };

    void onEvent(ProviderEvent event);
}
