package net.spookly.exthost.provider;

import java.util.List;
import java.util.function.Consumer;

import io.grpc.Context;
import net.spookly.exthost.broker.MessageBroker;
import net.spookly.exthost.protocol.ProviderMessages;

/**
 * Service target implemented by an extension on the other end of a provider stream.
 */
public final class RemoteServiceTarget implements ServiceTargetProvider {
    private final String host;
    private final MessageBroker broker;

    public RemoteServiceTarget(String host, MessageBroker broker) {
        this.host = host;
        this.broker = broker;
    }

    public String host() {
        return host;
    }

    @Override
    public void initialize(Context context, String projectPath, String serviceName) {
        broker.request(context, new ProviderMessages.InitializeRequest(projectPath, serviceName),
                ProviderMessages.InitializeResponse.class, null);
    }

    @Override
    public ProviderMessages.DeployResponse deploy(Context context, String serviceName, String artifact, Consumer<String> progress) {
        return broker.request(context, new ProviderMessages.DeployRequest(serviceName, artifact),
                ProviderMessages.DeployResponse.class, progress);
    }

    @Override
    public List<String> endpoints(Context context, String serviceName) {
        ProviderMessages.EndpointsResponse response = broker.request(context,
                new ProviderMessages.EndpointsRequest(serviceName), ProviderMessages.EndpointsResponse.class, null);
        return response.endpoints == null ? List.of() : List.copyOf(response.endpoints);
    }
}
