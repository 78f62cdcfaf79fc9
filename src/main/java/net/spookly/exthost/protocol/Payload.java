package net.spookly.exthost.protocol;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Marker for every message variant that can travel inside a {@link StreamMessage}.
 * The {@code type} property on the wire names the variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ProviderMessages.RegisterServiceTargetRequest.class, name = "registerServiceTargetRequest"),
        @JsonSubTypes.Type(value = ProviderMessages.RegisterServiceTargetResponse.class, name = "registerServiceTargetResponse"),
        @JsonSubTypes.Type(value = ProviderMessages.RegisterFrameworkServiceRequest.class, name = "registerFrameworkServiceRequest"),
        @JsonSubTypes.Type(value = ProviderMessages.RegisterFrameworkServiceResponse.class, name = "registerFrameworkServiceResponse"),
        @JsonSubTypes.Type(value = ProviderMessages.RegisterProvisioningProviderRequest.class, name = "registerProvisioningProviderRequest"),
        @JsonSubTypes.Type(value = ProviderMessages.RegisterProvisioningProviderResponse.class, name = "registerProvisioningProviderResponse"),
        @JsonSubTypes.Type(value = ProviderMessages.InitializeRequest.class, name = "initializeRequest"),
        @JsonSubTypes.Type(value = ProviderMessages.InitializeResponse.class, name = "initializeResponse"),
        @JsonSubTypes.Type(value = ProviderMessages.DeployRequest.class, name = "deployRequest"),
        @JsonSubTypes.Type(value = ProviderMessages.DeployResponse.class, name = "deployResponse"),
        @JsonSubTypes.Type(value = ProviderMessages.EndpointsRequest.class, name = "endpointsRequest"),
        @JsonSubTypes.Type(value = ProviderMessages.EndpointsResponse.class, name = "endpointsResponse"),
        @JsonSubTypes.Type(value = ProviderMessages.BuildRequest.class, name = "buildRequest"),
        @JsonSubTypes.Type(value = ProviderMessages.BuildResponse.class, name = "buildResponse"),
        @JsonSubTypes.Type(value = ProviderMessages.PackageRequest.class, name = "packageRequest"),
        @JsonSubTypes.Type(value = ProviderMessages.PackageResponse.class, name = "packageResponse"),
        @JsonSubTypes.Type(value = ProviderMessages.PreviewRequest.class, name = "previewRequest"),
        @JsonSubTypes.Type(value = ProviderMessages.PreviewResponse.class, name = "previewResponse"),
        @JsonSubTypes.Type(value = ProviderMessages.ProvisionRequest.class, name = "provisionRequest"),
        @JsonSubTypes.Type(value = ProviderMessages.ProvisionResponse.class, name = "provisionResponse"),
        @JsonSubTypes.Type(value = ProviderMessages.ProgressMessage.class, name = "progressMessage"),
        @JsonSubTypes.Type(value = EventMessages.SubscribeProjectEvent.class, name = "subscribeProjectEvent"),
        @JsonSubTypes.Type(value = EventMessages.SubscribeServiceEvent.class, name = "subscribeServiceEvent"),
        @JsonSubTypes.Type(value = EventMessages.InvokeProjectHandler.class, name = "invokeProjectHandler"),
        @JsonSubTypes.Type(value = EventMessages.InvokeServiceHandler.class, name = "invokeServiceHandler"),
        @JsonSubTypes.Type(value = EventMessages.ProjectHandlerStatus.class, name = "projectHandlerStatus"),
        @JsonSubTypes.Type(value = EventMessages.ServiceHandlerStatus.class, name = "serviceHandlerStatus"),
        @JsonSubTypes.Type(value = EventMessages.ExtensionReadyEvent.class, name = "extensionReadyEvent")
})
public interface Payload {
}
