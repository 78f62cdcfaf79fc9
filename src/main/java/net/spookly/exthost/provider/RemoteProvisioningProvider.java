package net.spookly.exthost.provider;

import java.util.Map;
import java.util.function.Consumer;

import io.grpc.Context;
import net.spookly.exthost.broker.MessageBroker;
import net.spookly.exthost.protocol.ProviderMessages;

/**
 * Provisioning provider implemented by an extension on the other end of a provider stream.
 */
public final class RemoteProvisioningProvider implements ProvisioningProvider {
    private final String name;
    private final MessageBroker broker;

    public RemoteProvisioningProvider(String name, MessageBroker broker) {
        this.name = name;
        this.broker = broker;
    }

    public String name() {
        return name;
    }

    @Override
    public void initialize(Context context, String projectPath) {
        broker.request(context, new ProviderMessages.InitializeRequest(projectPath, null),
                ProviderMessages.InitializeResponse.class, null);
    }

    @Override
    public String preview(Context context, String environmentName) {
        return broker.request(context, new ProviderMessages.PreviewRequest(environmentName),
                ProviderMessages.PreviewResponse.class, null).summary;
    }

    @Override
    public Map<String, String> provision(Context context, String environmentName, Consumer<String> progress) {
        ProviderMessages.ProvisionResponse response = broker.request(context,
                new ProviderMessages.ProvisionRequest(environmentName), ProviderMessages.ProvisionResponse.class, progress);
        return response.outputs == null ? Map.of() : Map.copyOf(response.outputs);
    }
}
