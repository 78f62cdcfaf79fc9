package net.spookly.exthost.provider;

import java.util.List;
import java.util.function.Consumer;

import io.grpc.Context;
import net.spookly.exthost.protocol.ProviderMessages;

/**
 * Deploys services to one host type.
 */
public interface ServiceTargetProvider {
    void initialize(Context context, String projectPath, String serviceName);

    ProviderMessages.DeployResponse deploy(Context context, String serviceName, String artifact, Consumer<String> progress);

    List<String> endpoints(Context context, String serviceName);
}
