package net.spookly.exthost.broker;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import io.grpc.Context;
import lombok.extern.slf4j.Slf4j;
import net.spookly.exthost.error.OperationCancelledException;
import net.spookly.exthost.error.ProtocolViolationException;
import net.spookly.exthost.error.RemoteCallException;
import net.spookly.exthost.error.StreamClosedException;
import net.spookly.exthost.error.StreamFailedException;
import net.spookly.exthost.protocol.Payload;
import net.spookly.exthost.protocol.ProviderMessages;
import net.spookly.exthost.protocol.StreamMessage;
import net.spookly.exthost.util.ContextAwait;

/**
 * Multiplexes request/response pairs and typed handlers over one bidirectional stream.
 * <p>
 * Inbound messages are handled strictly in receive order on the thread running {@link #run(Context)}:
 * a message whose request id matches an outstanding {@link #sendAndWait} completes that call,
 * anything else goes to the handler registered for its payload type. A slow handler therefore delays
 * every later message on the same stream, which is the backpressure an extension connection gets.
 * <p>
 * All writes, whether from {@code run}, from handlers or from other threads, go through a single lock.
 * <p>
 * A handler must not call {@link #sendAndWait} on its own broker: the response can only be read by
 * the loop that is busy running the handler, so the call never completes.
 */
@Slf4j
public final class MessageBroker {
    private final BidiStream<StreamMessage> stream;
    private final String name;
    private final Map<Class<? extends Payload>, MessageHandler<? extends Payload>> handlers = new ConcurrentHashMap<>();
    private final Map<String, PendingRequest> pending = new ConcurrentHashMap<>();
    private final Object sendLock = new Object();
    private final AtomicBoolean started = new AtomicBoolean();
    private final CompletableFuture<Void> ready = new CompletableFuture<>();
    private volatile boolean closed;

    public MessageBroker(BidiStream<StreamMessage> stream, String name) {
        this.stream = stream;
        this.name = name;
    }

    public String name() {
        return name;
    }

    /**
     * Register the handler for one payload type.
     *
     * @throws IllegalStateException when a handler for the type is already registered
     */
    public <P extends Payload> void on(Class<P> type, MessageHandler<P> handler) {
        if (handlers.putIfAbsent(type, handler) != null) {
            throw new IllegalStateException("handler already registered for " + type.getSimpleName() + " on " + name);
        }
        log.debug("[{}] Registered handler for {}", name, type.getSimpleName());
    }

    /**
     * Receive and dispatch until the stream ends. Only one call may be active per broker.
     *
     * @throws OperationCancelledException when the stream's context is cancelled
     * @throws StreamFailedException when receiving fails for another reason
     */
    public void run(Context context) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("broker " + name + " is already running");
        }
        ready.complete(null);
        try {
            while (true) {
                StreamMessage message = receive(context);
                if (message == null) {
                    log.debug("[{}] Stream closed by peer", name);
                    return;
                }
                dispatch(context, message);
            }
        } finally {
            close();
        }
    }

    /**
     * Block until {@link #run(Context)} has started receiving.
     */
    public void awaitReady(Context context) {
        ContextAwait.await(context, ready, "broker " + name + " readiness");
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Fire-and-forget write.
     */
    public void send(Context context, Payload payload) {
        send(context, StreamMessage.of(payload));
    }

    public void send(Context context, StreamMessage message) {
        if (context != null && context.isCancelled()) {
            throw OperationCancelledException.from(context, "send on " + name);
        }
        ensureOpen();
        write(message);
    }

    /**
     * Send a request under a fresh request id and block for the matching response.
     */
    public StreamMessage sendAndWait(Context context, Payload payload) {
        return sendAndWait(context, payload, null);
    }

    /**
     * Like {@link #sendAndWait(Context, Payload)}, delivering progress messages for the request to the listener.
     *
     * @throws RemoteCallException when the peer answered with an error envelope
     * @throws StreamClosedException when the stream ends before the response arrives
     * @throws OperationCancelledException when the context is cancelled while waiting
     */
    public StreamMessage sendAndWait(Context context, Payload payload, Consumer<String> progressListener) {
        String requestId = UUID.randomUUID().toString();
        PendingRequest request = new PendingRequest(progressListener);
        pending.put(requestId, request);
        try {
            ensureOpen();
            log.debug("[{}] [{}] Sending {}", name, requestId, payload.getClass().getSimpleName());
            write(StreamMessage.of(requestId, payload));
            StreamMessage response = ContextAwait.await(context, request.future, "request " + requestId + " on " + name);
            if (response.hasError()) {
                throw new RemoteCallException(response.error().message());
            }
            return response;
        } finally {
            pending.remove(requestId);
        }
    }

    /**
     * Typed variant of {@link #sendAndWait(Context, Payload, Consumer)}.
     *
     * @throws ProtocolViolationException when the response payload is not of the expected type
     */
    public <R extends Payload> R request(Context context, Payload payload, Class<R> responseType, Consumer<String> progressListener) {
        StreamMessage response = sendAndWait(context, payload, progressListener);
        Payload body = response.payload();
        if (!responseType.isInstance(body)) {
            throw new ProtocolViolationException("expected " + responseType.getSimpleName() + " but received "
                    + (body == null ? "no payload" : body.getClass().getSimpleName()));
        }
        return responseType.cast(body);
    }

    void write(StreamMessage message) {
        synchronized (sendLock) {
            stream.send(message);
        }
    }

    private StreamMessage receive(Context context) {
        return receive(stream, context, name);
    }

    /**
     * Receive one message with the same error mapping {@link #run(Context)} applies.
     *
     * @return the message, or {@code null} at end of stream
     */
    public static StreamMessage receive(BidiStream<StreamMessage> stream, Context context, String name) {
        try {
            return stream.recv();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw OperationCancelledException.interrupted("receive on " + name, e);
        } catch (OperationCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            if (context != null && context.isCancelled()) {
                throw OperationCancelledException.from(context, "receive on " + name);
            }
            log.warn("[{}] Stream receive failed: {}", name, e.getMessage());
            throw new StreamFailedException("stream receive failed on " + name, e);
        }
    }

    private void dispatch(Context context, StreamMessage message) {
        String requestId = message.requestId();
        if (requestId != null) {
            PendingRequest request = pending.get(requestId);
            if (request != null) {
                if (message.payload() instanceof ProviderMessages.ProgressMessage progress && !message.hasError()) {
                    request.progress(progress.message);
                    return;
                }
                request.future.complete(message);
                return;
            }
        }
        Payload payload = message.payload();
        if (payload == null) {
            log.warn("[{}] [{}] Dropping message without payload or waiting caller", name, requestId);
            return;
        }
        if (payload instanceof ProviderMessages.ProgressMessage) {
            log.debug("[{}] [{}] Dropping progress for a request nobody waits on", name, requestId);
            return;
        }
        @SuppressWarnings("unchecked")
        MessageHandler<Payload> handler = (MessageHandler<Payload>) handlers.get(payload.getClass());
        if (handler == null) {
            log.warn("[{}] [{}] No handler registered for {}, message dropped", name, requestId,
                    payload.getClass().getSimpleName());
            return;
        }
        Payload response;
        try {
            response = handler.handle(new HandlerContext(requestId, context, this), payload);
        } catch (Exception e) {
            log.warn("[{}] [{}] Handler for {} failed: {}", name, requestId, payload.getClass().getSimpleName(),
                    e.getMessage());
            write(StreamMessage.error(requestId, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()));
            return;
        }
        if (response != null) {
            write(StreamMessage.of(requestId, response));
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new StreamClosedException("stream " + name + " is closed");
        }
    }

    private void close() {
        closed = true;
        List<PendingRequest> stranded = new ArrayList<>(pending.values());
        for (PendingRequest request : stranded) {
            request.future.completeExceptionally(new StreamClosedException("stream " + name + " closed before a response arrived"));
        }
        if (!stranded.isEmpty()) {
            log.debug("[{}] Failed {} pending request(s) on close", name, stranded.size());
        }
    }

    private static final class PendingRequest {
        private final CompletableFuture<StreamMessage> future = new CompletableFuture<>();
        private final Consumer<String> progressListener;

        private PendingRequest(Consumer<String> progressListener) {
            this.progressListener = progressListener;
        }

        private void progress(String message) {
            if (progressListener != null && message != null && !message.isEmpty()) {
                progressListener.accept(message);
            }
        }
    }
}
