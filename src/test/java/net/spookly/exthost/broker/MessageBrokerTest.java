package net.spookly.exthost.broker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import io.grpc.Context;
import net.spookly.exthost.error.OperationCancelledException;
import net.spookly.exthost.error.RemoteCallException;
import net.spookly.exthost.error.StreamClosedException;
import net.spookly.exthost.error.StreamFailedException;
import net.spookly.exthost.protocol.ProviderMessages;
import net.spookly.exthost.protocol.StreamMessage;
import org.junit.jupiter.api.Test;

class MessageBrokerTest {
    @Test
    void dispatchesInReceiveOrderAndEchoesRequestId() throws Exception {
        QueueBidiStream stream = new QueueBidiStream(Context.ROOT);
        MessageBroker broker = new MessageBroker(stream, "test");
        List<String> seen = new CopyOnWriteArrayList<>();
        broker.on(ProviderMessages.BuildRequest.class, (context, request) -> {
            seen.add(request.serviceName);
            return new ProviderMessages.BuildResponse("artifact-" + request.serviceName);
        });
        for (int i = 0; i < 5; i++) {
            stream.push("req-" + i, new ProviderMessages.BuildRequest("svc" + i, "src"));
        }
        stream.finish();

        broker.run(Context.ROOT);

        assertEquals(List.of("svc0", "svc1", "svc2", "svc3", "svc4"), seen);
        for (int i = 0; i < 5; i++) {
            StreamMessage reply = stream.next();
            assertEquals("req-" + i, reply.requestId());
            assertEquals("artifact-svc" + i, ((ProviderMessages.BuildResponse) reply.payload()).artifact);
        }
        assertTrue(broker.isClosed());
    }

    @Test
    void rejectsSecondHandlerForSameType() {
        MessageBroker broker = new MessageBroker(new QueueBidiStream(Context.ROOT), "test");
        broker.on(ProviderMessages.BuildRequest.class, (context, request) -> null);

        assertThrows(IllegalStateException.class,
                () -> broker.on(ProviderMessages.BuildRequest.class, (context, request) -> null));
    }

    @Test
    void rejectsSecondRun() throws Exception {
        QueueBidiStream stream = new QueueBidiStream(Context.ROOT);
        MessageBroker broker = new MessageBroker(stream, "test");
        CompletableFuture<Void> first = CompletableFuture.runAsync(() -> broker.run(Context.ROOT));
        broker.awaitReady(Context.ROOT);

        assertThrows(IllegalStateException.class, () -> broker.run(Context.ROOT));

        stream.finish();
        first.get(2, TimeUnit.SECONDS);
    }

    @Test
    void handlerFailureBecomesErrorEnvelope() throws Exception {
        QueueBidiStream stream = new QueueBidiStream(Context.ROOT);
        MessageBroker broker = new MessageBroker(stream, "test");
        broker.on(ProviderMessages.BuildRequest.class, (context, request) -> {
            throw new IllegalStateException("compiler exploded");
        });
        broker.on(ProviderMessages.PackageRequest.class,
                (context, request) -> new ProviderMessages.PackageResponse("pkg"));
        stream.push("req-1", new ProviderMessages.BuildRequest("api", "src"));
        stream.push("req-2", new ProviderMessages.PackageRequest("api", "build"));
        stream.finish();

        broker.run(Context.ROOT);

        StreamMessage failed = stream.next();
        assertEquals("req-1", failed.requestId());
        assertEquals("compiler exploded", failed.error().message());
        assertNull(failed.payload());
        StreamMessage next = stream.next();
        assertEquals("req-2", next.requestId());
        assertInstanceOf(ProviderMessages.PackageResponse.class, next.payload());
    }

    @Test
    void dropsMessagesWithoutHandler() throws Exception {
        QueueBidiStream stream = new QueueBidiStream(Context.ROOT);
        MessageBroker broker = new MessageBroker(stream, "test");
        stream.push("req-1", new ProviderMessages.BuildRequest("api", "src"));
        stream.finish();

        broker.run(Context.ROOT);

        assertEquals(0, stream.sentCount());
    }

    @Test
    void sendAndWaitCorrelatesResponseAndProgress() throws Exception {
        QueueBidiStream stream = new QueueBidiStream(Context.ROOT);
        MessageBroker broker = new MessageBroker(stream, "test");
        CompletableFuture<Void> loop = CompletableFuture.runAsync(() -> broker.run(Context.ROOT));
        broker.awaitReady(Context.ROOT);
        List<String> progress = new CopyOnWriteArrayList<>();

        CompletableFuture<ProviderMessages.DeployResponse> call = CompletableFuture.supplyAsync(() -> broker.request(
                Context.ROOT,
                new ProviderMessages.DeployRequest("api", "image:1"),
                ProviderMessages.DeployResponse.class,
                progress::add));
        StreamMessage sent = stream.next();
        assertNotNull(sent.requestId());
        stream.push(sent.requestId(), new ProviderMessages.ProgressMessage("pushing image"));
        stream.push(sent.requestId(), new ProviderMessages.DeployResponse("deployed", List.of("https://api")));

        ProviderMessages.DeployResponse response = call.get(2, TimeUnit.SECONDS);

        assertEquals("deployed", response.message);
        assertEquals(List.of("pushing image"), progress);
        stream.finish();
        loop.get(2, TimeUnit.SECONDS);
    }

    @Test
    void sendAndWaitSurfacesRemoteError() throws Exception {
        QueueBidiStream stream = new QueueBidiStream(Context.ROOT);
        MessageBroker broker = new MessageBroker(stream, "test");
        CompletableFuture<Void> loop = CompletableFuture.runAsync(() -> broker.run(Context.ROOT));
        broker.awaitReady(Context.ROOT);

        CompletableFuture<StreamMessage> call = CompletableFuture.supplyAsync(
                () -> broker.sendAndWait(Context.ROOT, new ProviderMessages.PreviewRequest("dev")));
        StreamMessage sent = stream.next();
        stream.push(StreamMessage.error(sent.requestId(), "quota exceeded"));

        ExecutionException failure = assertThrows(ExecutionException.class, () -> call.get(2, TimeUnit.SECONDS));
        assertInstanceOf(RemoteCallException.class, failure.getCause());
        assertEquals("quota exceeded", failure.getCause().getMessage());
        stream.finish();
        loop.get(2, TimeUnit.SECONDS);
    }

    @Test
    void closingStreamFailsPendingCalls() throws Exception {
        QueueBidiStream stream = new QueueBidiStream(Context.ROOT);
        MessageBroker broker = new MessageBroker(stream, "test");
        CompletableFuture<Void> loop = CompletableFuture.runAsync(() -> broker.run(Context.ROOT));
        broker.awaitReady(Context.ROOT);

        CompletableFuture<StreamMessage> call = CompletableFuture.supplyAsync(
                () -> broker.sendAndWait(Context.ROOT, new ProviderMessages.PreviewRequest("dev")));
        assertNotNull(stream.next());
        stream.finish();

        ExecutionException failure = assertThrows(ExecutionException.class, () -> call.get(2, TimeUnit.SECONDS));
        assertInstanceOf(StreamClosedException.class, failure.getCause());
        loop.get(2, TimeUnit.SECONDS);
        assertThrows(StreamClosedException.class,
                () -> broker.send(Context.ROOT, new ProviderMessages.PreviewRequest("dev")));
    }

    @Test
    void cancelledContextEndsRun() {
        Context.CancellableContext context = Context.current().withCancellation();
        QueueBidiStream stream = new QueueBidiStream(context);
        MessageBroker broker = new MessageBroker(stream, "test");
        context.cancel(null);

        assertThrows(OperationCancelledException.class, () -> broker.run(context));
    }

    @Test
    void cancelledCallerStopsWaiting() throws Exception {
        QueueBidiStream stream = new QueueBidiStream(Context.ROOT);
        MessageBroker broker = new MessageBroker(stream, "test");
        CompletableFuture<Void> loop = CompletableFuture.runAsync(() -> broker.run(Context.ROOT));
        broker.awaitReady(Context.ROOT);
        Context.CancellableContext caller = Context.current().withCancellation();

        CompletableFuture<StreamMessage> call = CompletableFuture.supplyAsync(
                () -> broker.sendAndWait(caller, new ProviderMessages.PreviewRequest("dev")));
        assertNotNull(stream.next());
        caller.cancel(null);

        ExecutionException failure = assertThrows(ExecutionException.class, () -> call.get(2, TimeUnit.SECONDS));
        assertInstanceOf(OperationCancelledException.class, failure.getCause());
        stream.finish();
        loop.get(2, TimeUnit.SECONDS);
    }

    @Test
    void receiveFailureIsStreamFailure() {
        QueueBidiStream stream = new QueueBidiStream(Context.ROOT);
        MessageBroker broker = new MessageBroker(stream, "test");
        stream.fail(new IllegalStateException("connection reset"));

        assertThrows(StreamFailedException.class, () -> broker.run(Context.ROOT));
    }

    @Test
    void handlerProgressIsSentWithRequestId() throws Exception {
        QueueBidiStream stream = new QueueBidiStream(Context.ROOT);
        MessageBroker broker = new MessageBroker(stream, "test");
        broker.on(ProviderMessages.BuildRequest.class, (context, request) -> {
            context.progress("compiling");
            return new ProviderMessages.BuildResponse("out");
        });
        stream.push("req-9", new ProviderMessages.BuildRequest("api", "src"));
        stream.finish();

        broker.run(Context.ROOT);

        StreamMessage progress = stream.next();
        assertEquals("req-9", progress.requestId());
        assertEquals("compiling", ((ProviderMessages.ProgressMessage) progress.payload()).message);
        assertInstanceOf(ProviderMessages.BuildResponse.class, stream.next().payload());
    }
}
