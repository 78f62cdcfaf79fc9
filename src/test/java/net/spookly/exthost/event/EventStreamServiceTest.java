package net.spookly.exthost.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import io.grpc.Context;
import net.spookly.exthost.auth.ExtensionClaims;
import net.spookly.exthost.auth.RequestIdentity;
import net.spookly.exthost.broker.QueueBidiStream;
import net.spookly.exthost.error.AuthorizationException;
import net.spookly.exthost.error.StreamClosedException;
import net.spookly.exthost.extension.Capability;
import net.spookly.exthost.extension.ExtensionIdentity;
import net.spookly.exthost.extension.ExtensionReadiness;
import net.spookly.exthost.extension.InMemoryExtensionCatalog;
import net.spookly.exthost.project.ProjectConfig;
import net.spookly.exthost.project.ServiceConfig;
import net.spookly.exthost.protocol.EventMessages;
import net.spookly.exthost.protocol.StreamMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EventStreamServiceTest {
    private final ProjectConfig project = new ProjectConfig("shop", "/work/shop", List.of(
            new ServiceConfig("api", "python", "containerapp", "src/api")));
    private final InMemoryExtensionCatalog catalog = new InMemoryExtensionCatalog();
    private final ExtensionReadiness readiness = new ExtensionReadiness();
    private final EventBridge bridge = new EventBridge(() -> project, null);
    private EventStreamService service;

    @BeforeEach
    void setUp() {
        catalog.install(new ExtensionIdentity("demo.hooks", "demo", "Hooks", "1.0.0",
                List.of(Capability.LIFECYCLE_EVENTS), null));
        catalog.install(new ExtensionIdentity("demo.target", "demo", "Target", "1.0.0",
                List.of(Capability.SERVICE_TARGET_PROVIDER), null));
        service = new EventStreamService(bridge, catalog, readiness, Runnable::run);
    }

    @Test
    void subscribedHookRoundTripsOverStream() throws Exception {
        QueueBidiStream stream = new QueueBidiStream(contextFor("demo.hooks"));
        CompletableFuture<Void> session = CompletableFuture.runAsync(() -> service.handle(stream));
        stream.push(StreamMessage.of(new EventMessages.SubscribeProjectEvent(List.of("predeploy"))));
        awaitTrue(() -> project.events().handlerCount("predeploy") == 1);

        CompletableFuture<Void> raised = CompletableFuture.runAsync(() -> project.raise(Context.ROOT, "predeploy"));
        StreamMessage invoke = stream.next();
        assertInstanceOf(EventMessages.InvokeProjectHandler.class, invoke.payload());
        stream.push(StreamMessage.of(
                new EventMessages.ProjectHandlerStatus("predeploy", EventMessages.STATUS_SUCCEEDED, "")));

        raised.get(2, TimeUnit.SECONDS);
        stream.finish();
        session.get(2, TimeUnit.SECONDS);
        assertEquals(0, project.events().handlerCount("predeploy"));
    }

    @Test
    void serviceSubscriptionUsesFilter() throws Exception {
        QueueBidiStream stream = new QueueBidiStream(contextFor("demo.hooks"));
        CompletableFuture<Void> session = CompletableFuture.runAsync(() -> service.handle(stream));
        stream.push(StreamMessage.of(
                new EventMessages.SubscribeServiceEvent(List.of("prepackage"), "python", "containerapp")));
        ServiceConfig api = project.services().get("api");
        awaitTrue(() -> api.events().handlerCount("prepackage") == 1);

        CompletableFuture<Void> raised =
                CompletableFuture.runAsync(() -> project.raise(Context.ROOT, "prepackage", "api"));
        EventMessages.InvokeServiceHandler invoke = (EventMessages.InvokeServiceHandler) stream.next().payload();
        assertEquals("api", invoke.service.name);
        stream.push(StreamMessage.of(new EventMessages.ServiceHandlerStatus("prepackage", "api",
                EventMessages.STATUS_SUCCEEDED, "")));

        raised.get(2, TimeUnit.SECONDS);
        stream.finish();
        session.get(2, TimeUnit.SECONDS);
        assertEquals(0, api.events().handlerCount("prepackage"));
    }

    @Test
    void closingStreamFailsWaitingHook() throws Exception {
        QueueBidiStream stream = new QueueBidiStream(contextFor("demo.hooks"));
        CompletableFuture<Void> session = CompletableFuture.runAsync(() -> service.handle(stream));
        stream.push(StreamMessage.of(new EventMessages.SubscribeProjectEvent(List.of("predeploy"))));
        awaitTrue(() -> project.events().handlerCount("predeploy") == 1);

        CompletableFuture<Void> raised = CompletableFuture.runAsync(() -> project.raise(Context.ROOT, "predeploy"));
        stream.next();
        stream.finish();
        session.get(2, TimeUnit.SECONDS);

        ExecutionException failure = assertThrows(ExecutionException.class, () -> raised.get(2, TimeUnit.SECONDS));
        assertInstanceOf(StreamClosedException.class, failure.getCause());
        assertEquals(0, bridge.pendingCount());
    }

    @Test
    void readyEventMarksExtensionReady() throws Exception {
        QueueBidiStream stream = new QueueBidiStream(contextFor("demo.hooks"));
        CompletableFuture<Void> session = CompletableFuture.runAsync(() -> service.handle(stream));
        stream.push(StreamMessage.of(new EventMessages.ExtensionReadyEvent()));

        awaitTrue(() -> readiness.isReady("demo.hooks"));

        stream.finish();
        session.get(2, TimeUnit.SECONDS);
    }

    @Test
    void requiresLifecycleCapability() {
        QueueBidiStream stream = new QueueBidiStream(contextFor("demo.target"));

        assertThrows(AuthorizationException.class, () -> service.handle(stream));
    }

    private static Context contextFor(String extensionId) {
        ExtensionClaims claims = new ExtensionClaims(extensionId, "exthost", List.of("127.0.0.1:0"), 0L, 0L, List.of());
        return Context.ROOT.withValue(RequestIdentity.CONTEXT_KEY, RequestIdentity.fromClaims(claims));
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 2s");
            }
            Thread.sleep(10);
        }
        assertTrue(condition.getAsBoolean());
    }
}
