package net.spookly.exthost.event;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import io.grpc.Context;
import net.spookly.exthost.util.ContextAwait;

/**
 * One waiting call in a {@link PendingCalls} table. Closing it removes the table entry.
 */
public final class PendingCall<T> implements AutoCloseable {
    private final PendingCalls<T> owner;
    private final String key;
    private final CompletableFuture<T> future;

    PendingCall(PendingCalls<T> owner, String key, CompletableFuture<T> future) {
        this.owner = owner;
        this.key = key;
        this.future = future;
    }

    public String key() {
        return key;
    }

    /**
     * Block for the reply. The entry is removed on every exit path.
     *
     * @param timeout upper bound, or {@code null} to wait until the context is cancelled
     */
    public T await(Context context, Duration timeout) {
        try {
            return ContextAwait.await(context, future, timeout, owner.name() + " call " + key);
        } finally {
            close();
        }
    }

    @Override
    public void close() {
        future.cancel(false);
        owner.remove(key, future);
    }
}
