package net.spookly.exthost.provider;

import java.util.function.Consumer;

import io.grpc.Context;
import net.spookly.exthost.broker.MessageBroker;
import net.spookly.exthost.protocol.ProviderMessages;

/**
 * Framework service implemented by an extension on the other end of a provider stream.
 */
public final class RemoteFrameworkService implements FrameworkServiceProvider {
    private final String language;
    private final MessageBroker broker;

    public RemoteFrameworkService(String language, MessageBroker broker) {
        this.language = language;
        this.broker = broker;
    }

    public String language() {
        return language;
    }

    @Override
    public void initialize(Context context, String projectPath, String serviceName) {
        broker.request(context, new ProviderMessages.InitializeRequest(projectPath, serviceName),
                ProviderMessages.InitializeResponse.class, null);
    }

    @Override
    public String build(Context context, String serviceName, String sourcePath, Consumer<String> progress) {
        return broker.request(context, new ProviderMessages.BuildRequest(serviceName, sourcePath),
                ProviderMessages.BuildResponse.class, progress).artifact;
    }

    @Override
    public String packageArtifact(Context context, String serviceName, String buildArtifact, Consumer<String> progress) {
        return broker.request(context, new ProviderMessages.PackageRequest(serviceName, buildArtifact),
                ProviderMessages.PackageResponse.class, progress).artifact;
    }
}
