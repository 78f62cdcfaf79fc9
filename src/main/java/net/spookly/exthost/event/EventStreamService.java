package net.spookly.exthost.event;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

import io.grpc.Context;
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
import net.spookly.exthost.error.StatusMapper;
import net.spookly.exthost.extension.Capability;
import net.spookly.exthost.extension.ExtensionCatalog;
import net.spookly.exthost.extension.ExtensionIdentity;
import net.spookly.exthost.extension.ExtensionReadiness;
import net.spookly.exthost.protocol.EventMessages;
import net.spookly.exthost.protocol.HostServiceDescriptors;
import net.spookly.exthost.protocol.StreamMessage;

/**
 * {@code EventService/EventStream}: lifecycle subscriptions and hook status replies of one extension.
 */
@Slf4j
public final class EventStreamService {
    private final EventBridge bridge;
    private final ExtensionCatalog catalog;
    private final ExtensionReadiness readiness;
    private final Executor workers;

    public EventStreamService(EventBridge bridge, ExtensionCatalog catalog, ExtensionReadiness readiness, Executor workers) {
        this.bridge = bridge;
        this.catalog = catalog;
        this.readiness = readiness;
        this.workers = workers;
    }

    public ServerServiceDefinition bindService() {
        return ServerServiceDefinition.builder(HostServiceDescriptors.EVENT_SERVICE)
                .addMethod(HostServiceDescriptors.EVENT_STREAM, ServerCalls.asyncBidiStreamingCall(this::open))
                .build();
    }

    private StreamObserver<StreamMessage> open(
            StreamObserver<StreamMessage> responseObserver) {
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
                log.debug("Event stream ended: {}", e.getMessage());
                stream.complete();
                return;
            }
            log.warn("Event stream failed: {}", e.getMessage());
            stream.fail(StatusMapper.toStatus(e));
        }
    }

    /**
     * Serve one event stream until it ends, then drop its subscriptions and fail its waiting hooks.
     */
    public void handle(BidiStream<StreamMessage> stream) {
        Context context = stream.context();
        RequestIdentity identity = RequestIdentity.from(context);
        ExtensionIdentity extension = catalog.findInstalled(identity.extensionId())
                .orElseThrow(() -> new ExtensionNotFoundException(identity.extensionId()));
        if (!extension.hasCapability(Capability.LIFECYCLE_EVENTS)) {
            throw new AuthorizationException("extension " + extension.id() + " does not support lifecycle events");
        }

        MessageBroker broker = new MessageBroker(stream, "events:" + extension.id());
        EventChannel channel = broker::send;
        List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

        broker.on(EventMessages.SubscribeProjectEvent.class, (handlerContext, request) -> {
            subscriptions.add(bridge.subscribeProject(extension, request.eventNames, channel));
            return null;
        });
        broker.on(EventMessages.SubscribeServiceEvent.class, (handlerContext, request) -> {
            ServiceFilter filter = new ServiceFilter(request.language, request.host);
            subscriptions.add(bridge.subscribeService(extension, request.eventNames, filter, channel));
            return null;
        });
        broker.on(EventMessages.ProjectHandlerStatus.class, (handlerContext, status) -> {
            bridge.dispatchProjectStatus(channel, extension.id(), status);
            return null;
        });
        broker.on(EventMessages.ServiceHandlerStatus.class, (handlerContext, status) -> {
            bridge.dispatchServiceStatus(channel, extension.id(), status);
            return null;
        });
        broker.on(EventMessages.ExtensionReadyEvent.class, (handlerContext, ready) -> {
            readiness.markReady(extension.id());
            return null;
        });

        try {
            broker.run(context);
        } finally {
            for (Subscription subscription : subscriptions) {
                subscription.close();
            }
            bridge.abandon(channel, extension.id());
            readiness.reset(extension.id());
        }
    }
}
