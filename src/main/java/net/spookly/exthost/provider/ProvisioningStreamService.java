package net.spookly.exthost.provider;

import java.util.concurrent.Executor;

import io.grpc.MethodDescriptor;
import net.spookly.exthost.extension.ExtensionCatalog;
import net.spookly.exthost.protocol.HostServiceDescriptors;
import net.spookly.exthost.protocol.Payload;
import net.spookly.exthost.protocol.ProviderMessages;
import net.spookly.exthost.protocol.StreamMessage;

/**
 * {@code ProvisioningService/Stream}: registers a named provisioning provider.
 */
public final class ProvisioningStreamService
        extends ProviderStreamService<ProvisioningProvider, ProviderMessages.RegisterProvisioningProviderRequest> {

    public ProvisioningStreamService(ProviderRegistry<ProvisioningProvider> registry,
                                     ProviderFactories factories,
                                     ExtensionCatalog catalog,
                                     Executor workers) {
        super(ProviderKind.PROVISIONING, ProviderMessages.RegisterProvisioningProviderRequest.class, registry, factories,
                catalog, workers);
    }

    @Override
    protected String providerKey(ProviderMessages.RegisterProvisioningProviderRequest request) {
        return request.name;
    }

    @Override
    protected Payload registeredResponse() {
        return new ProviderMessages.RegisterProvisioningProviderResponse();
    }

    @Override
    protected MethodDescriptor<StreamMessage, StreamMessage> method() {
        return HostServiceDescriptors.PROVISIONING_STREAM;
    }
}
