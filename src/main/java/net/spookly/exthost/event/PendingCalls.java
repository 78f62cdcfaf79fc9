package net.spookly.exthost.event;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Table of single-shot calls waiting for a reply, keyed by correlation key.
 * <p>
 * A key has at most one pending call. The waiting side always removes its entry; replies for keys
 * nobody waits on are reported back to the caller instead of being queued.
 *
 * @param <T> reply type
 */
public final class PendingCalls<T> {
    private final String name;
    private final Map<String, Entry<T>> calls = new ConcurrentHashMap<>();

    public PendingCalls(String name) {
        this.name = name;
    }

    /**
     * Open a call for the key before sending the request that will be answered.
     *
     * @param owner the only party allowed to answer; also the tag used by {@link #failOwnedBy(Object, RuntimeException)}
     * @throws IllegalStateException when a call for the key is already pending
     */
    public PendingCall<T> open(String key, Object owner) {
        Entry<T> entry = new Entry<>(new CompletableFuture<>(), owner);
        if (calls.putIfAbsent(key, entry) != null) {
            throw new IllegalStateException(name + " call already pending for " + key);
        }
        return new PendingCall<>(this, key, entry.future);
    }

    /**
     * Deliver the reply for a key. Only the owner the call was opened with may answer it.
     *
     * @return {@code false} when no call is pending for the key, it belongs to another owner
     * or it was already answered
     */
    public boolean resolve(String key, Object owner, T value) {
        Entry<T> entry = calls.get(key);
        return entry != null && entry.owner == owner && entry.future.complete(value);
    }

    /**
     * Fail every pending call opened by the owner, for example when its stream closes.
     *
     * @return number of calls failed
     */
    public int failOwnedBy(Object owner, RuntimeException error) {
        int failed = 0;
        for (Entry<T> entry : calls.values()) {
            if (entry.owner == owner && entry.future.completeExceptionally(error)) {
                failed++;
            }
        }
        return failed;
    }

    public boolean isPending(String key) {
        return calls.containsKey(key);
    }

    public int size() {
        return calls.size();
    }

    String name() {
        return name;
    }

    void remove(String key, CompletableFuture<T> future) {
        calls.computeIfPresent(key, (ignored, entry) -> entry.future == future ? null : entry);
    }

    private static final class Entry<T> {
        private final CompletableFuture<T> future;
        private final Object owner;

        private Entry(CompletableFuture<T> future, Object owner) {
            this.future = future;
            this.owner = owner;
        }
    }
}
