package net.spookly.exthost.provider;

import java.time.Clock;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * The three provider registries of one host instance.
 */
@Getter
@Accessors(fluent = true)
public final class ProviderRegistries {
    private final ProviderRegistry<ServiceTargetProvider> serviceTargets;
    private final ProviderRegistry<FrameworkServiceProvider> frameworkServices;
    private final ProviderRegistry<ProvisioningProvider> provisioningProviders;

    public ProviderRegistries() {
        this(ProviderAuditLogger.INSTANCE, Clock.systemUTC());
    }

    public ProviderRegistries(ProviderEventListener eventListener, Clock clock) {
        this.serviceTargets = new ProviderRegistry<>(ProviderKind.SERVICE_TARGET, eventListener, clock);
        this.frameworkServices = new ProviderRegistry<>(ProviderKind.FRAMEWORK_SERVICE, eventListener, clock);
        this.provisioningProviders = new ProviderRegistry<>(ProviderKind.PROVISIONING, eventListener, clock);
    }
}
