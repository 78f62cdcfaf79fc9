package net.spookly.exthost.provider;

import java.util.concurrent.Executor;

import io.grpc.MethodDescriptor;
import net.spookly.exthost.extension.ExtensionCatalog;
import net.spookly.exthost.protocol.HostServiceDescriptors;
import net.spookly.exthost.protocol.Payload;
import net.spookly.exthost.protocol.ProviderMessages;
import net.spookly.exthost.protocol.StreamMessage;

/**
 * {@code ServiceTargetService/Stream}: registers a deployment target for one host type.
 */
public final class ServiceTargetStreamService
        extends ProviderStreamService<ServiceTargetProvider, ProviderMessages.RegisterServiceTargetRequest> {

    public ServiceTargetStreamService(ProviderRegistry<ServiceTargetProvider> registry,
                                      ProviderFactories factories,
                                      ExtensionCatalog catalog,
                                      Executor workers) {
        super(ProviderKind.SERVICE_TARGET, ProviderMessages.RegisterServiceTargetRequest.class, registry, factories,
                catalog, workers);
    }

    @Override
    protected String providerKey(ProviderMessages.RegisterServiceTargetRequest request) {
        return request.host;
    }

    @Override
    protected Payload registeredResponse() {
        return new ProviderMessages.RegisterServiceTargetResponse();
    }

    @Override
    protected MethodDescriptor<StreamMessage, StreamMessage> method() {
        return HostServiceDescriptors.SERVICE_TARGET_STREAM;
    }
}
