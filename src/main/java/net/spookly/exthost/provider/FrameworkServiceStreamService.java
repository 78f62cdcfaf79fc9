package net.spookly.exthost.provider;

import java.util.concurrent.Executor;

import io.grpc.MethodDescriptor;
import net.spookly.exthost.extension.ExtensionCatalog;
import net.spookly.exthost.protocol.HostServiceDescriptors;
import net.spookly.exthost.protocol.Payload;
import net.spookly.exthost.protocol.ProviderMessages;
import net.spookly.exthost.protocol.StreamMessage;

/**
 * {@code FrameworkService/Stream}: registers the build tooling for one language.
 */
public final class FrameworkServiceStreamService
        extends ProviderStreamService<FrameworkServiceProvider, ProviderMessages.RegisterFrameworkServiceRequest> {

    public FrameworkServiceStreamService(ProviderRegistry<FrameworkServiceProvider> registry,
                                         ProviderFactories factories,
                                         ExtensionCatalog catalog,
                                         Executor workers) {
        super(ProviderKind.FRAMEWORK_SERVICE, ProviderMessages.RegisterFrameworkServiceRequest.class, registry, factories,
                catalog, workers);
    }

    @Override
    protected String providerKey(ProviderMessages.RegisterFrameworkServiceRequest request) {
        return request.language;
    }

    @Override
    protected Payload registeredResponse() {
        return new ProviderMessages.RegisterFrameworkServiceResponse();
    }

    @Override
    protected MethodDescriptor<StreamMessage, StreamMessage> method() {
        return HostServiceDescriptors.FRAMEWORK_SERVICE_STREAM;
    }
}
