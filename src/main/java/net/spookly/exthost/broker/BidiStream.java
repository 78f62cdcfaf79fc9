package net.spookly.exthost.broker;

import io.grpc.Context;

/**
 * One side of a bidirectional message stream.
 *
 * @param <M> message type carried in both directions
 */
public interface BidiStream<M> {
    /**
     * Block for the next inbound message.
     *
     * @return the message, or {@code null} once the peer has half-closed the stream
     * @throws net.spookly.exthost.error.OperationCancelledException when the stream's call was cancelled
     * @throws RuntimeException carrying the transport failure for any other error
     */
    M recv() throws InterruptedException;

    /**
     * Write one message. Callers serialize writes; implementations are not thread-safe.
     */
    void send(M message);

    /**
     * Context of the call this stream belongs to.
     */
    Context context();
}
