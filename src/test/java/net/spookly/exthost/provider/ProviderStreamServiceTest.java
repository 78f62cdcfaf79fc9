package net.spookly.exthost.provider;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import io.grpc.Context;
import net.spookly.exthost.auth.ExtensionClaims;
import net.spookly.exthost.auth.RequestIdentity;
import net.spookly.exthost.broker.QueueBidiStream;
import net.spookly.exthost.error.AuthorizationException;
import net.spookly.exthost.error.ExtensionNotFoundException;
import net.spookly.exthost.error.OperationCancelledException;
import net.spookly.exthost.error.ProtocolViolationException;
import net.spookly.exthost.error.RegistrationConflictException;
import net.spookly.exthost.extension.Capability;
import net.spookly.exthost.extension.ExtensionIdentity;
import net.spookly.exthost.extension.InMemoryExtensionCatalog;
import net.spookly.exthost.protocol.ProviderMessages;
import net.spookly.exthost.protocol.StreamMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProviderStreamServiceTest {
    private final InMemoryExtensionCatalog catalog = new InMemoryExtensionCatalog();
    private final ProviderRegistries registries = new ProviderRegistries(ProviderEventListener.NOOP, null);
    private ServiceTargetStreamService service;

    @BeforeEach
    void setUp() {
        catalog.install(extension("demo.azure", Capability.SERVICE_TARGET_PROVIDER));
        catalog.install(extension("demo.other", Capability.SERVICE_TARGET_PROVIDER));
        catalog.install(extension("demo.events", Capability.LIFECYCLE_EVENTS));
        service = new ServiceTargetStreamService(registries.serviceTargets(), ProviderFactories.defaults(), catalog,
                Runnable::run);
    }

    @Test
    void registersAndReleasesOnEndOfStream() throws Exception {
        QueueBidiStream stream = new QueueBidiStream(contextFor("demo.azure"));
        CompletableFuture<Void> session = CompletableFuture.runAsync(() -> service.handle(stream));
        stream.push("reg-1", new ProviderMessages.RegisterServiceTargetRequest("containerapp"));

        StreamMessage reply = stream.next();
        assertEquals("reg-1", reply.requestId());
        assertInstanceOf(ProviderMessages.RegisterServiceTargetResponse.class, reply.payload());
        assertTrue(registries.serviceTargets().lookup("containerapp").isPresent());

        stream.finish();
        session.get(2, TimeUnit.SECONDS);
        assertTrue(registries.serviceTargets().lookup("containerapp").isEmpty());
    }

    @Test
    void secondStreamForSameKeyConflicts() throws Exception {
        QueueBidiStream first = new QueueBidiStream(contextFor("demo.azure"));
        CompletableFuture<Void> firstSession = CompletableFuture.runAsync(() -> service.handle(first));
        first.push("reg-1", new ProviderMessages.RegisterServiceTargetRequest("containerapp"));
        assertNotNull(first.next());

        QueueBidiStream second = new QueueBidiStream(contextFor("demo.other"));
        second.push("reg-2", new ProviderMessages.RegisterServiceTargetRequest("containerapp"));
        assertThrows(RegistrationConflictException.class, () -> service.handle(second));

        assertEquals("demo.azure", registries.serviceTargets().find("containerapp").orElseThrow().extensionId());
        first.finish();
        firstSession.get(2, TimeUnit.SECONDS);

        QueueBidiStream third = new QueueBidiStream(contextFor("demo.other"));
        CompletableFuture<Void> thirdSession = CompletableFuture.runAsync(() -> service.handle(third));
        third.push("reg-3", new ProviderMessages.RegisterServiceTargetRequest("containerapp"));
        assertInstanceOf(ProviderMessages.RegisterServiceTargetResponse.class, third.next().payload());
        third.finish();
        thirdSession.get(2, TimeUnit.SECONDS);
    }

    @Test
    void missingCapabilityIsRejectedBeforeReading() {
        QueueBidiStream stream = new QueueBidiStream(contextFor("demo.events"));
        stream.push("reg-1", new ProviderMessages.RegisterServiceTargetRequest("containerapp"));

        assertThrows(AuthorizationException.class, () -> service.handle(stream));

        assertEquals(0, stream.sentCount());
        assertEquals(0, registries.serviceTargets().size());
    }

    @Test
    void unknownExtensionIsRejected() {
        QueueBidiStream stream = new QueueBidiStream(contextFor("not.installed"));

        assertThrows(ExtensionNotFoundException.class, () -> service.handle(stream));
    }

    @Test
    void firstMessageMustRegister() {
        QueueBidiStream stream = new QueueBidiStream(contextFor("demo.azure"));
        stream.push("req-1", new ProviderMessages.DeployRequest("api", "image"));

        assertThrows(ProtocolViolationException.class, () -> service.handle(stream));
        assertEquals(0, registries.serviceTargets().size());
    }

    @Test
    void blankKeyIsRejected() {
        QueueBidiStream stream = new QueueBidiStream(contextFor("demo.azure"));
        stream.push("reg-1", new ProviderMessages.RegisterServiceTargetRequest("  "));

        assertThrows(ProtocolViolationException.class, () -> service.handle(stream));
    }

    @Test
    void endOfStreamBeforeRegisteringEndsQuietly() {
        QueueBidiStream stream = new QueueBidiStream(contextFor("demo.azure"));
        stream.finish();

        service.handle(stream);

        assertEquals(0, registries.serviceTargets().size());
    }

    @Test
    void duplicateRegisterOnSameStreamIsAnsweredWithError() throws Exception {
        QueueBidiStream stream = new QueueBidiStream(contextFor("demo.azure"));
        CompletableFuture<Void> session = CompletableFuture.runAsync(() -> service.handle(stream));
        stream.push("reg-1", new ProviderMessages.RegisterServiceTargetRequest("containerapp"));
        assertNotNull(stream.next());

        stream.push("reg-2", new ProviderMessages.RegisterServiceTargetRequest("aks"));
        StreamMessage reply = stream.next();

        assertEquals("reg-2", reply.requestId());
        assertTrue(reply.hasError());
        assertEquals(List.of("containerapp"), registries.serviceTargets().keys());
        stream.finish();
        session.get(2, TimeUnit.SECONDS);
    }

    @Test
    void registeredProviderForwardsCallsOverStream() throws Exception {
        QueueBidiStream stream = new QueueBidiStream(contextFor("demo.azure"));
        CompletableFuture<Void> session = CompletableFuture.runAsync(() -> service.handle(stream));
        stream.push("reg-1", new ProviderMessages.RegisterServiceTargetRequest("containerapp"));
        assertNotNull(stream.next());

        ServiceTargetProvider provider = registries.serviceTargets().lookup("containerapp").orElseThrow();
        CompletableFuture<List<String>> endpoints =
                CompletableFuture.supplyAsync(() -> provider.endpoints(Context.ROOT, "api"));
        StreamMessage request = stream.next();
        assertEquals("api", ((ProviderMessages.EndpointsRequest) request.payload()).serviceName);
        stream.push(request.requestId(), new ProviderMessages.EndpointsResponse(List.of("https://api.example")));

        assertEquals(List.of("https://api.example"), endpoints.get(2, TimeUnit.SECONDS));
        stream.finish();
        session.get(2, TimeUnit.SECONDS);
    }

    @Test
    void cancellationReleasesKey() throws Exception {
        Context.CancellableContext context = contextFor("demo.azure").withCancellation();
        QueueBidiStream stream = new QueueBidiStream(context);
        CompletableFuture<Void> session = CompletableFuture.runAsync(() -> service.handle(stream));
        stream.push("reg-1", new ProviderMessages.RegisterServiceTargetRequest("containerapp"));
        assertNotNull(stream.next());

        context.cancel(null);

        Exception failure = assertThrows(Exception.class, () -> session.get(2, TimeUnit.SECONDS));
        assertInstanceOf(OperationCancelledException.class, failure.getCause());
        assertEquals(0, registries.serviceTargets().size());
    }

    private static Context contextFor(String extensionId) {
        ExtensionClaims claims = new ExtensionClaims(extensionId, "exthost", List.of("127.0.0.1:0"), 0L, 0L,
                List.of(Capability.SERVICE_TARGET_PROVIDER.id()));
        return Context.ROOT.withValue(RequestIdentity.CONTEXT_KEY, RequestIdentity.fromClaims(claims));
    }

    private static ExtensionIdentity extension(String id, Capability capability) {
        return new ExtensionIdentity(id, "demo", id, "1.0.0", List.of(capability), null);
    }
}
