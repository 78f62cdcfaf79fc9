package net.spookly.exthost.event;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import net.spookly.exthost.project.LifecycleDispatcher;
import net.spookly.exthost.project.LifecycleHandler;

/**
 * Handlers installed for one subscribe request; closing removes them from their dispatchers.
 */
public final class Subscription implements AutoCloseable {
    private final List<Runnable> removals = new ArrayList<>();
    private final List<String> keys = new ArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    <A> void add(LifecycleDispatcher<A> dispatcher, String eventName, LifecycleHandler<A> handler, String key) {
        dispatcher.addHandler(eventName, handler);
        removals.add(() -> dispatcher.removeHandler(eventName, handler));
        keys.add(key);
    }

    /**
     * Correlation keys of the installed handlers.
     */
    public List<String> keys() {
        return List.copyOf(keys);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (Runnable removal : removals) {
            removal.run();
        }
    }
}
