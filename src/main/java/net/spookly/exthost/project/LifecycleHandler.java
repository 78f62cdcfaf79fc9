package net.spookly.exthost.project;

import io.grpc.Context;

/**
 * Hook run when a lifecycle event is raised.
 *
 * @param <A> event arguments
 */
@FunctionalInterface
public interface LifecycleHandler<A> {
    void handle(Context context, A args);
}
