package net.spookly.exthost.util;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import io.grpc.Context;
import io.grpc.Status;
import net.spookly.exthost.error.ExtensionHostException;
import net.spookly.exthost.error.OperationCancelledException;

/**
 * Blocking waits on a future that give up as soon as a gRPC context is cancelled.
 */
public final class ContextAwait {
    private ContextAwait() {
    }

    public static <T> T await(Context context, CompletableFuture<T> future, String operation) {
        return await(context, future, null, operation);
    }

    /**
     * Wait for the future, the context's cancellation or the optional timeout, whichever comes first.
     * <p>
     * Cancellation of the context cancels the future, so a producer completing it afterwards is a no-op.
     *
     * @throws OperationCancelledException when the context is cancelled, the timeout passes or the thread is interrupted
     */
    public static <T> T await(Context context, CompletableFuture<T> future, Duration timeout, String operation) {
        Context effective = context == null ? Context.ROOT : context;
        Context.CancellationListener listener = cancelled -> future.cancel(false);
        effective.addListener(listener, Runnable::run);
        try {
            if (timeout == null) {
                return future.get();
            }
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (CancellationException e) {
            throw OperationCancelledException.from(effective, operation);
        } catch (TimeoutException e) {
            future.cancel(false);
            throw new ExtensionHostException(Status.Code.DEADLINE_EXCEEDED, operation + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw OperationCancelledException.interrupted(operation, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new ExtensionHostException(Status.Code.INTERNAL, operation + " failed", cause);
        } finally {
            effective.removeListener(listener);
        }
    }
}
