package net.spookly.exthost.protocol;

import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;

/**
 * Payloads exchanged on the provider streams (service target, framework service, provisioning).
 */
public final class ProviderMessages {
    /**
     * First message on a service target stream; {@code host} is the deployment host type it serves.
     */
    @NoArgsConstructor
    @AllArgsConstructor
    public static final class RegisterServiceTargetRequest implements Payload {
        public String host;
    }

    public static final class RegisterServiceTargetResponse implements Payload {
    }

    /**
     * First message on a framework service stream; {@code language} is the language it builds.
     */
    @NoArgsConstructor
    @AllArgsConstructor
    public static final class RegisterFrameworkServiceRequest implements Payload {
        public String language;
    }

    public static final class RegisterFrameworkServiceResponse implements Payload {
    }

    /**
     * First message on a provisioning stream; {@code name} is the provider name.
     */
    @NoArgsConstructor
    @AllArgsConstructor
    public static final class RegisterProvisioningProviderRequest implements Payload {
        public String name;
    }

    public static final class RegisterProvisioningProviderResponse implements Payload {
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class InitializeRequest implements Payload {
        public String projectPath;
        public String serviceName;
    }

    public static final class InitializeResponse implements Payload {
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class DeployRequest implements Payload {
        public String serviceName;
        public String artifact;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class DeployResponse implements Payload {
        public String message;
        public List<String> endpoints;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class EndpointsRequest implements Payload {
        public String serviceName;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class EndpointsResponse implements Payload {
        public List<String> endpoints;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class BuildRequest implements Payload {
        public String serviceName;
        public String sourcePath;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class BuildResponse implements Payload {
        public String artifact;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class PackageRequest implements Payload {
        public String serviceName;
        public String buildArtifact;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class PackageResponse implements Payload {
        public String artifact;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class PreviewRequest implements Payload {
        public String environmentName;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class PreviewResponse implements Payload {
        public String summary;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class ProvisionRequest implements Payload {
        public String environmentName;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class ProvisionResponse implements Payload {
        public Map<String, String> outputs;
    }

    /**
     * Intermediate status for a request still in flight; carries the request's id.
     */
    @NoArgsConstructor
    @AllArgsConstructor
    public static final class ProgressMessage implements Payload {
        public String message;
    }

    private ProviderMessages() {
    }
}
