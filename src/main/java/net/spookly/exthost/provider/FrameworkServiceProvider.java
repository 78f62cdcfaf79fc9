package net.spookly.exthost.provider;

import java.util.function.Consumer;

import io.grpc.Context;

/**
 * Builds and packages services written in one language.
 */
public interface FrameworkServiceProvider {
    void initialize(Context context, String projectPath, String serviceName);

    /**
     * @return location of the build output
     */
    String build(Context context, String serviceName, String sourcePath, Consumer<String> progress);

    /**
     * @return location of the deployable package
     */
    String packageArtifact(Context context, String serviceName, String buildArtifact, Consumer<String> progress);
}
