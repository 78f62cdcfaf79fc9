package net.spookly.exthost.provider;

import net.spookly.exthost.extension.Capability;

/**
 * The provider roles an extension can register for, each gated by one capability.
 */
public enum ProviderKind {
    SERVICE_TARGET("service-target", Capability.SERVICE_TARGET_PROVIDER, ServiceTargetProvider.class),
    FRAMEWORK_SERVICE("framework-service", Capability.FRAMEWORK_SERVICE_PROVIDER, FrameworkServiceProvider.class),
    PROVISIONING("provisioning", Capability.PROVISIONING_PROVIDER, ProvisioningProvider.class);

    private final String id;
    private final Capability capability;
    private final Class<?> providerType;

    ProviderKind(String id, Capability capability, Class<?> providerType) {
        this.id = id;
        this.capability = capability;
        this.providerType = providerType;
    }

    public String id() {
        return id;
    }

    public Capability capability() {
        return capability;
    }

    public Class<?> providerType() {
        return providerType;
    }
}
