package net.spookly.exthost.provider;

import java.util.concurrent.Executor;

import io.grpc.Context;
import io.grpc.MethodDescriptor;
import io.grpc.ServerServiceDefinition;
import io.grpc.stub.ServerCalls;
import io.grpc.stub.StreamObserver;
import lombok.extern.slf4j.Slf4j;
import net.spookly.exthost.auth.RequestIdentity;
import net.spookly.exthost.broker.BidiStream;
import net.spookly.exthost.broker.GrpcBidiStream;
import net.spookly.exthost.broker.MessageBroker;
import net.spookly.exthost.error.AuthorizationException;
import net.spookly.exthost.error.ExtensionNotFoundException;
import net.spookly.exthost.error.ProtocolViolationException;
import net.spookly.exthost.error.StatusMapper;
import net.spookly.exthost.extension.ExtensionCatalog;
import net.spookly.exthost.extension.ExtensionIdentity;
import net.spookly.exthost.protocol.Payload;
import net.spookly.exthost.protocol.StreamMessage;

/**
 * Registration handshake shared by the provider streams.
 * <p>
 * A stream moves through {@link RegistrationState}: the caller's extension must be installed and
 * declare the kind's capability, its first message must be the kind's register request, and the
 * requested key must be free. The stream then owns the key until it ends, whatever the reason.
 *
 * @param <T> provider interface
 * @param <R> register request payload
 */
@Slf4j
public abstract class ProviderStreamService<T, R extends Payload> {
    private final ProviderKind kind;
    private final Class<R> registerType;
    private final ProviderRegistry<T> registry;
    private final ProviderFactory<T> factory;
    private final ExtensionCatalog catalog;
    private final Executor workers;

    protected ProviderStreamService(ProviderKind kind,
                                    Class<R> registerType,
                                    ProviderRegistry<T> registry,
                                    ProviderFactories factories,
                                    ExtensionCatalog catalog,
                                    Executor workers) {
        this.kind = kind;
        this.registerType = registerType;
        this.registry = registry;
        this.factory = factories.factory(kind);
        this.catalog = catalog;
        this.workers = workers;
    }

    /**
     * Provider key carried by the register request.
     */
    protected abstract String providerKey(R request);

    protected abstract Payload registeredResponse();

    protected abstract MethodDescriptor<StreamMessage, StreamMessage> method();

    public ProviderKind kind() {
        return kind;
    }

    public ProviderRegistry<T> registry() {
        return registry;
    }

    public ServerServiceDefinition bindService() {
        MethodDescriptor<StreamMessage, StreamMessage> method = method();
        return ServerServiceDefinition.builder(method.getServiceName())
                .addMethod(method, ServerCalls.asyncBidiStreamingCall(this::open))
                .build();
    }

    private StreamObserver<StreamMessage> open(StreamObserver<StreamMessage> responseObserver) {
        GrpcBidiStream<StreamMessage> stream = GrpcBidiStream.attach(responseObserver);
        workers.execute(stream.context().wrap(() -> serve(stream)));
        return stream.inboundObserver();
    }

    private void serve(GrpcBidiStream<StreamMessage> stream) {
        try {
            handle(stream);
            stream.complete();
        } catch (RuntimeException e) {
            if (StatusMapper.isGracefulTermination(e)) {
                log.debug("{} stream ended: {}", kind.id(), e.getMessage());
                stream.complete();
                return;
            }
            log.warn("{} stream failed: {}", kind.id(), e.getMessage());
            stream.fail(StatusMapper.toStatus(e));
        }
    }

    /**
     * Run the handshake and then serve the stream until it ends.
     * Returns normally on end of stream; every failure is thrown.
     */
    public void handle(BidiStream<StreamMessage> stream) {
        Context context = stream.context();
        RequestIdentity identity = RequestIdentity.from(context);
        ExtensionIdentity extension = catalog.findInstalled(identity.extensionId())
                .orElseThrow(() -> new ExtensionNotFoundException(identity.extensionId()));
        if (!extension.hasCapability(kind.capability())) {
            throw new AuthorizationException("extension " + extension.id() + " does not declare capability "
                    + kind.capability().id());
        }
        RegistrationSession session = new RegistrationSession(kind, extension.id());
        session.awaitRegistration();

        StreamMessage first = MessageBroker.receive(stream, context, kind.id() + ":" + extension.id());
        if (first == null) {
            log.debug("{} stream from {} closed before registering", kind.id(), extension.id());
            session.close();
            return;
        }
        if (!registerType.isInstance(first.payload())) {
            throw new ProtocolViolationException("expected " + registerType.getSimpleName() + " as first message, received "
                    + (first.payload() == null ? "no payload" : first.payload().getClass().getSimpleName()));
        }
        String key = providerKey(registerType.cast(first.payload()));
        if (key == null || key.isBlank()) {
            throw new ProtocolViolationException(registerType.getSimpleName() + " is missing its provider key");
        }
        key = key.trim();

        MessageBroker broker = new MessageBroker(stream, kind.id() + ":" + key);
        ProviderRegistration<T> registration = registry.register(key, extension.id(), broker, factory);
        try {
            session.markRegistered();
            String registeredKey = key;
            broker.on(registerType, (handlerContext, duplicate) -> {
                throw new ProtocolViolationException(kind.id() + " provider already registered on this stream as "
                        + registeredKey);
            });
            broker.send(context, StreamMessage.of(first.requestId(), registeredResponse()));
            log.info("Registered {} provider '{}' for extension {}", kind.id(), key, extension.id());
            broker.run(context);
        } finally {
            registration.release();
            session.close();
        }
    }
}
