package net.spookly.exthost.prompt;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import io.grpc.Context;
import net.spookly.exthost.error.OperationCancelledException;
import net.spookly.exthost.util.ContextAwait;

/**
 * Serializes interactive prompts so that only one extension talks to the terminal at a time.
 * Waiters are granted the slot in arrival order; a waiter whose call is cancelled leaves the queue
 * without ever holding the slot.
 */
public final class PromptLock {
    private static final String OPERATION = "prompt lock";

    private final Object lock = new Object();
    private final Deque<CompletableFuture<Void>> waiters = new ArrayDeque<>();
    private boolean held;

    /**
     * Block until the slot is free or the context is cancelled.
     *
     * @return handle that frees the slot when closed; closing twice is a no-op
     * @throws OperationCancelledException when the context is cancelled before the slot is granted
     */
    public Release acquire(Context context) {
        Context effective = context == null ? Context.ROOT : context;
        if (effective.isCancelled()) {
            throw OperationCancelledException.from(effective, OPERATION);
        }
        CompletableFuture<Void> grant;
        synchronized (lock) {
            if (!held) {
                held = true;
                return new Release();
            }
            grant = new CompletableFuture<>();
            waiters.addLast(grant);
        }
        try {
            ContextAwait.await(effective, grant, OPERATION);
        } catch (RuntimeException e) {
            abandon(grant);
            throw e;
        }
        Release release = new Release();
        if (effective.isCancelled()) {
            release.close();
            throw OperationCancelledException.from(effective, OPERATION);
        }
        return release;
    }

    public boolean isHeld() {
        synchronized (lock) {
            return held;
        }
    }

    public int waiting() {
        synchronized (lock) {
            return waiters.size();
        }
    }

    private void abandon(CompletableFuture<Void> grant) {
        synchronized (lock) {
            if (waiters.remove(grant)) {
                grant.cancel(false);
                return;
            }
            // Handed over just before the waiter gave up: pass the slot on.
            if (grant.isDone() && !grant.isCancelled() && !grant.isCompletedExceptionally()) {
                handOff();
            }
        }
    }

    private void release() {
        synchronized (lock) {
            handOff();
        }
    }

    // Caller holds the lock.
    private void handOff() {
        CompletableFuture<Void> next;
        while ((next = waiters.pollFirst()) != null) {
            if (next.complete(null)) {
                return;
            }
        }
        held = false;
    }

    /**
     * Ownership of the prompt slot.
     */
    public final class Release implements AutoCloseable {
        private final AtomicBoolean released = new AtomicBoolean();

        private Release() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                release();
            }
        }
    }
}
