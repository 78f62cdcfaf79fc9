package net.spookly.exthost.protocol;

import io.grpc.MethodDescriptor;

/**
 * Method descriptors of every RPC the extension host serves.
 * Shared by the server bindings and by clients written in Java.
 */
public final class HostServiceDescriptors {
    public static final String SERVICE_TARGET_SERVICE = "exthost.ServiceTargetService";
    public static final String FRAMEWORK_SERVICE = "exthost.FrameworkService";
    public static final String PROVISIONING_SERVICE = "exthost.ProvisioningService";
    public static final String EVENT_SERVICE = "exthost.EventService";
    public static final String PROMPT_SERVICE = "exthost.PromptService";

    public static final MethodDescriptor<StreamMessage, StreamMessage> SERVICE_TARGET_STREAM =
            bidi(SERVICE_TARGET_SERVICE, "Stream");
    public static final MethodDescriptor<StreamMessage, StreamMessage> FRAMEWORK_SERVICE_STREAM =
            bidi(FRAMEWORK_SERVICE, "Stream");
    public static final MethodDescriptor<StreamMessage, StreamMessage> PROVISIONING_STREAM =
            bidi(PROVISIONING_SERVICE, "Stream");
    public static final MethodDescriptor<StreamMessage, StreamMessage> EVENT_STREAM =
            bidi(EVENT_SERVICE, "EventStream");

    public static final MethodDescriptor<PromptMessages.ConfirmRequest, PromptMessages.ConfirmResponse> PROMPT_CONFIRM =
            unary(PROMPT_SERVICE, "Confirm", PromptMessages.ConfirmRequest.class, PromptMessages.ConfirmResponse.class);
    public static final MethodDescriptor<PromptMessages.PromptRequest, PromptMessages.PromptResponse> PROMPT_PROMPT =
            unary(PROMPT_SERVICE, "Prompt", PromptMessages.PromptRequest.class, PromptMessages.PromptResponse.class);
    public static final MethodDescriptor<PromptMessages.SelectRequest, PromptMessages.SelectResponse> PROMPT_SELECT =
            unary(PROMPT_SERVICE, "Select", PromptMessages.SelectRequest.class, PromptMessages.SelectResponse.class);
    public static final MethodDescriptor<PromptMessages.MultiSelectRequest, PromptMessages.MultiSelectResponse> PROMPT_MULTI_SELECT =
            unary(PROMPT_SERVICE, "MultiSelect", PromptMessages.MultiSelectRequest.class, PromptMessages.MultiSelectResponse.class);

    private HostServiceDescriptors() {
    }

    private static MethodDescriptor<StreamMessage, StreamMessage> bidi(String service, String method) {
        return MethodDescriptor.<StreamMessage, StreamMessage>newBuilder()
                .setType(MethodDescriptor.MethodType.BIDI_STREAMING)
                .setFullMethodName(MethodDescriptor.generateFullMethodName(service, method))
                .setRequestMarshaller(JsonMarshaller.of(StreamMessage.class))
                .setResponseMarshaller(JsonMarshaller.of(StreamMessage.class))
                .build();
    }

    private static <Q, R> MethodDescriptor<Q, R> unary(String service, String method, Class<Q> request, Class<R> response) {
        return MethodDescriptor.<Q, R>newBuilder()
                .setType(MethodDescriptor.MethodType.UNARY)
                .setFullMethodName(MethodDescriptor.generateFullMethodName(service, method))
                .setRequestMarshaller(JsonMarshaller.of(request))
                .setResponseMarshaller(JsonMarshaller.of(response))
                .build();
    }
}
