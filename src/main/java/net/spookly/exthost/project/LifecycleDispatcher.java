package net.spookly.exthost.project;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.grpc.Context;

/**
 * Named lifecycle events with their registered handlers.
 * Handlers for one event run sequentially in registration order; the first failure stops the chain.
 *
 * @param <A> event arguments
 */
public final class LifecycleDispatcher<A> {
    private final Object lock = new Object();
    private final Map<String, List<LifecycleHandler<A>>> handlers = new LinkedHashMap<>();

    public void addHandler(String eventName, LifecycleHandler<A> handler) {
        if (eventName == null || eventName.isBlank()) {
            throw new IllegalArgumentException("event name is required");
        }
        synchronized (lock) {
            handlers.computeIfAbsent(eventName, ignored -> new ArrayList<>()).add(handler);
        }
    }

    /**
     * @return {@code true} when the handler was registered for the event
     */
    public boolean removeHandler(String eventName, LifecycleHandler<A> handler) {
        synchronized (lock) {
            List<LifecycleHandler<A>> registered = handlers.get(eventName);
            if (registered == null) {
                return false;
            }
            boolean removed = registered.remove(handler);
            if (registered.isEmpty()) {
                handlers.remove(eventName);
            }
            return removed;
        }
    }

    public int handlerCount(String eventName) {
        synchronized (lock) {
            List<LifecycleHandler<A>> registered = handlers.get(eventName);
            return registered == null ? 0 : registered.size();
        }
    }

    /**
     * Run every handler of the event on the calling thread.
     */
    public void raise(Context context, String eventName, A args) {
        List<LifecycleHandler<A>> snapshot;
        synchronized (lock) {
            List<LifecycleHandler<A>> registered = handlers.get(eventName);
            snapshot = registered == null ? List.of() : new ArrayList<>(registered);
        }
        for (LifecycleHandler<A> handler : snapshot) {
            handler.handle(context, args);
        }
    }
}
