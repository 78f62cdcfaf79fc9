package net.spookly.exthost.extension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import lombok.extern.slf4j.Slf4j;
import net.spookly.exthost.error.StreamClosedException;

/**
 * Tracks which extensions have announced that they finished their own startup.
 */
@Slf4j
public final class ExtensionReadiness {
    private final Map<String, CompletableFuture<Void>> signals = new ConcurrentHashMap<>();

    /**
     * Record that an extension is ready; repeated calls are no-ops.
     */
    public void markReady(String extensionId) {
        if (signal(extensionId).complete(null)) {
            log.info("Extension {} reported ready", extensionId);
        }
    }

    public boolean isReady(String extensionId) {
        CompletableFuture<Void> signal = signal(extensionId);
        return signal.isDone() && !signal.isCompletedExceptionally();
    }

    /**
     * Block until the extension is ready or the timeout passes.
     *
     * @return {@code true} when the extension reported ready in time; {@code false} on timeout or when its
     * event stream closed before it did
     */
    public boolean awaitReady(String extensionId, Duration timeout) throws InterruptedException {
        return awaitSignal(signal(extensionId), timeout.toNanos());
    }

    /**
     * Wait for several extensions against one shared deadline.
     *
     * @return ids that did not report ready in time, in the given order
     */
    public List<String> awaitAll(Collection<String> extensionIds, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        List<String> notReady = new ArrayList<>();
        for (String extensionId : extensionIds) {
            if (!awaitSignal(signal(extensionId), deadline - System.nanoTime())) {
                notReady.add(extensionId);
            }
        }
        return notReady;
    }

    /**
     * Forget readiness, for example after the extension's event stream closes.
     * Anyone still waiting on the old signal is released with a not-ready answer.
     */
    public void reset(String extensionId) {
        CompletableFuture<Void> previous = signals.remove(normalize(extensionId));
        if (previous != null
                && previous.completeExceptionally(new StreamClosedException("extension " + extensionId + " went away"))) {
            log.debug("Extension {} left before reporting ready", extensionId);
        }
    }

    private static boolean awaitSignal(CompletableFuture<Void> signal, long remainingNanos)
            throws InterruptedException {
        if (signal.isDone()) {
            return !signal.isCompletedExceptionally();
        }
        if (remainingNanos <= 0) {
            return false;
        }
        try {
            signal.get(remainingNanos, TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException | ExecutionException e) {
            return false;
        }
    }

    private CompletableFuture<Void> signal(String extensionId) {
        return signals.computeIfAbsent(normalize(extensionId), ignored -> new CompletableFuture<>());
    }

    private static String normalize(String extensionId) {
        return extensionId.trim().toLowerCase(Locale.ROOT);
    }
}
