package net.spookly.exthost.provider;

import java.util.Map;
import java.util.function.Consumer;

import io.grpc.Context;

/**
 * Provisions infrastructure for an environment.
 */
public interface ProvisioningProvider {
    void initialize(Context context, String projectPath);

    String preview(Context context, String environmentName);

    /**
     * @return outputs of the provisioned resources
     */
    Map<String, String> provision(Context context, String environmentName, Consumer<String> progress);
}
