package net.spookly.exthost.broker;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

import io.grpc.Context;
import io.grpc.Status;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import lombok.extern.slf4j.Slf4j;
import net.spookly.exthost.error.OperationCancelledException;

/**
 * Adapts the callback style of a gRPC server stream to a blocking {@link BidiStream}.
 * <p>
 * Inbound flow control is manual: one message is requested from the transport only after the
 * previous one was taken by {@link #recv()}, so a slow consumer pushes back on the extension.
 */
@Slf4j
public final class GrpcBidiStream<M> implements BidiStream<M> {
    private final ServerCallStreamObserver<M> outbound;
    private final Context context;
    private final BlockingQueue<Signal<M>> inbound = new LinkedBlockingQueue<>();
    private final StreamObserver<M> inboundObserver;
    private final Context.CancellationListener cancellationListener;
    private final AtomicBoolean finished = new AtomicBoolean();
    private volatile boolean terminated;

    private GrpcBidiStream(ServerCallStreamObserver<M> outbound, Context context) {
        this.outbound = outbound;
        this.context = context;
        this.inboundObserver = new StreamObserver<>() {
            @Override
            public void onNext(M value) {
                inbound.add(Signal.message(value));
            }

            @Override
            public void onError(Throwable t) {
                inbound.add(Signal.error(t));
            }

            @Override
            public void onCompleted() {
                inbound.add(Signal.completed());
            }
        };
        this.cancellationListener = cancelled -> inbound.add(Signal.cancelled());
    }

    /**
     * Attach to a server call. Must be called while the gRPC handler is still being invoked,
     * before flow control settings freeze.
     */
    public static <M> GrpcBidiStream<M> attach(StreamObserver<M> responseObserver) {
        ServerCallStreamObserver<M> outbound = (ServerCallStreamObserver<M>) responseObserver;
        GrpcBidiStream<M> stream = new GrpcBidiStream<>(outbound, Context.current());
        outbound.disableAutoRequest();
        outbound.setOnCancelHandler(() -> stream.inbound.add(Signal.cancelled()));
        stream.context.addListener(stream.cancellationListener, Runnable::run);
        outbound.request(1);
        return stream;
    }

    /**
     * Observer to hand back to gRPC for inbound messages.
     */
    public StreamObserver<M> inboundObserver() {
        return inboundObserver;
    }

    @Override
    public M recv() throws InterruptedException {
        if (terminated) {
            return null;
        }
        Signal<M> signal = inbound.take();
        switch (signal.kind) {
            case MESSAGE:
                outbound.request(1);
                return signal.message;
            case COMPLETED:
                terminated = true;
                return null;
            case CANCELLED:
                terminated = true;
                throw OperationCancelledException.from(context, "stream receive");
            default:
                terminated = true;
                throw Status.fromThrowable(signal.error).asRuntimeException();
        }
    }

    @Override
    public void send(M message) {
        outbound.onNext(message);
    }

    @Override
    public Context context() {
        return context;
    }

    /**
     * End the call successfully. Only the first of {@link #complete()} and {@link #fail(Status)} has an effect.
     */
    public void complete() {
        if (finish()) {
            outbound.onCompleted();
        }
    }

    public void fail(Status status) {
        if (finish()) {
            outbound.onError(status.asRuntimeException());
        }
    }

    private boolean finish() {
        if (!finished.compareAndSet(false, true)) {
            return false;
        }
        context.removeListener(cancellationListener);
        if (outbound.isCancelled()) {
            log.debug("Call already cancelled, skipping close");
            return false;
        }
        return true;
    }

    private enum Kind {
        MESSAGE,
        COMPLETED,
        CANCELLED,
        ERROR
    }

    private static final class Signal<M> {
        private final Kind kind;
        private final M message;
        private final Throwable error;

        private Signal(Kind kind, M message, Throwable error) {
            this.kind = kind;
            this.message = message;
            this.error = error;
        }

        static <M> Signal<M> message(M message) {
            return new Signal<>(Kind.MESSAGE, message, null);
        }

        static <M> Signal<M> completed() {
            return new Signal<>(Kind.COMPLETED, null, null);
        }

        static <M> Signal<M> cancelled() {
            return new Signal<>(Kind.CANCELLED, null, null);
        }

        static <M> Signal<M> error(Throwable error) {
            return new Signal<>(Kind.ERROR, null, error);
        }
    }
}
