package net.spookly.exthost.prompt;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import io.grpc.Context;
import io.grpc.ServerServiceDefinition;
import io.grpc.Status;
import io.grpc.stub.ServerCalls;
import io.grpc.stub.StreamObserver;
import lombok.extern.slf4j.Slf4j;
import net.spookly.exthost.auth.RequestIdentity;
import net.spookly.exthost.error.ExtensionHostException;
import net.spookly.exthost.error.StatusMapper;
import net.spookly.exthost.protocol.HostServiceDescriptors;
import net.spookly.exthost.protocol.PromptMessages;

/**
 * Unary prompt RPCs. Interactive prompts are serialized through one {@link PromptLock};
 * in no-prompt mode answers come from the request defaults and the lock is never taken.
 */
@Slf4j
public final class PromptService {
    private final Prompter prompter;
    private final PromptLock lock;
    private final boolean noPrompt;

    public PromptService(Prompter prompter, PromptLock lock, boolean noPrompt) {
        this.prompter = prompter;
        this.lock = lock;
        this.noPrompt = noPrompt;
    }

    public ServerServiceDefinition bindService() {
        return ServerServiceDefinition.builder(HostServiceDescriptors.PROMPT_SERVICE)
                .addMethod(HostServiceDescriptors.PROMPT_CONFIRM, ServerCalls.asyncUnaryCall(
                        (request, observer) -> respond(observer, request, this::confirm)))
                .addMethod(HostServiceDescriptors.PROMPT_PROMPT, ServerCalls.asyncUnaryCall(
                        (request, observer) -> respond(observer, request, this::prompt)))
                .addMethod(HostServiceDescriptors.PROMPT_SELECT, ServerCalls.asyncUnaryCall(
                        (request, observer) -> respond(observer, request, this::select)))
                .addMethod(HostServiceDescriptors.PROMPT_MULTI_SELECT, ServerCalls.asyncUnaryCall(
                        (request, observer) -> respond(observer, request, this::multiSelect)))
                .build();
    }

    public PromptMessages.ConfirmResponse confirm(PromptMessages.ConfirmRequest request) {
        if (noPrompt) {
            if (request.defaultValue == null) {
                throw noDefault("no default response for prompt '" + request.message + "'");
            }
            return new PromptMessages.ConfirmResponse(request.defaultValue);
        }
        try (PromptLock.Release ignored = lock.acquire(Context.current())) {
            return new PromptMessages.ConfirmResponse(prompter.confirm(request));
        }
    }

    public PromptMessages.PromptResponse prompt(PromptMessages.PromptRequest request) {
        if (noPrompt) {
            String defaultValue = request.defaultValue == null ? "" : request.defaultValue;
            if (request.required && defaultValue.isEmpty()) {
                throw noDefault("no default response for prompt '" + request.message + "'");
            }
            return new PromptMessages.PromptResponse(defaultValue);
        }
        try (PromptLock.Release ignored = lock.acquire(Context.current())) {
            return new PromptMessages.PromptResponse(prompter.prompt(request));
        }
    }

    public PromptMessages.SelectResponse select(PromptMessages.SelectRequest request) {
        if (noPrompt) {
            if (request.selectedIndex == null) {
                throw noDefault("no default selection for prompt '" + request.message + "'");
            }
            return new PromptMessages.SelectResponse(request.selectedIndex);
        }
        try (PromptLock.Release ignored = lock.acquire(Context.current())) {
            return new PromptMessages.SelectResponse(prompter.select(request));
        }
    }

    public PromptMessages.MultiSelectResponse multiSelect(PromptMessages.MultiSelectRequest request) {
        if (noPrompt) {
            List<PromptMessages.Choice> selected = new ArrayList<>();
            if (request.choices != null) {
                for (PromptMessages.Choice choice : request.choices) {
                    if (choice.selected) {
                        selected.add(choice);
                    }
                }
            }
            return new PromptMessages.MultiSelectResponse(selected);
        }
        try (PromptLock.Release ignored = lock.acquire(Context.current())) {
            return new PromptMessages.MultiSelectResponse(prompter.multiSelect(request));
        }
    }

    private <Q, R> void respond(StreamObserver<R> observer, Q request, Function<Q, R> call) {
        R response;
        try {
            response = call.apply(request);
        } catch (RuntimeException e) {
            log.debug("Prompt from {} failed: {}", caller(), e.getMessage());
            observer.onError(StatusMapper.toStatus(e).asRuntimeException());
            return;
        }
        observer.onNext(response);
        observer.onCompleted();
    }

    private static String caller() {
        RequestIdentity identity = RequestIdentity.CONTEXT_KEY.get();
        return identity == null ? "<unknown>" : identity.extensionId();
    }

    private static ExtensionHostException noDefault(String message) {
        return new ExtensionHostException(Status.Code.FAILED_PRECONDITION, message);
    }
}
