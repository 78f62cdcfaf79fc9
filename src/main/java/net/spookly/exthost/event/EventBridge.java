package net.spookly.exthost.event;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import io.grpc.Context;
import lombok.extern.slf4j.Slf4j;
import net.spookly.exthost.error.LifecycleHookException;
import net.spookly.exthost.error.ProtocolViolationException;
import net.spookly.exthost.error.StreamClosedException;
import net.spookly.exthost.extension.ExtensionIdentity;
import net.spookly.exthost.project.ProjectConfig;
import net.spookly.exthost.project.ProjectLifecycleEventArgs;
import net.spookly.exthost.project.ServiceConfig;
import net.spookly.exthost.project.ServiceLifecycleEventArgs;
import net.spookly.exthost.protocol.EventMessages;

/**
 * Turns project and service lifecycle events into invoke-and-await round trips with subscribed extensions.
 * <p>
 * A fired handler opens a pending call under the event's correlation key, sends the invoke message
 * and blocks the event pipeline until the matching status arrives, the caller's context is cancelled
 * or the optional hook timeout passes.
 */
@Slf4j
public final class EventBridge {
    private final Supplier<ProjectConfig> project;
    private final Duration hookTimeout;
    private final PendingCalls<EventMessages.ProjectHandlerStatus> projectCalls = new PendingCalls<>("project hook");
    private final PendingCalls<EventMessages.ServiceHandlerStatus> serviceCalls = new PendingCalls<>("service hook");

    /**
     * @param hookTimeout bound for one hook round trip, {@code null} to wait for the caller's context only
     */
    public EventBridge(Supplier<ProjectConfig> project, Duration hookTimeout) {
        this.project = project;
        this.hookTimeout = hookTimeout == null || hookTimeout.isZero() || hookTimeout.isNegative() ? null : hookTimeout;
    }

    public Subscription subscribeProject(ExtensionIdentity extension, List<String> eventNames, EventChannel channel) {
        ProjectConfig config = requireProject();
        Subscription subscription = new Subscription();
        for (String eventName : names(eventNames)) {
            String key = CorrelationKeys.project(extension.id(), eventName);
            subscription.add(config.events(), eventName,
                    (context, args) -> invokeProject(context, extension, eventName, args, channel), key);
            log.debug("Extension {} subscribed to project event {}", extension.id(), eventName);
        }
        return subscription;
    }

    public Subscription subscribeService(ExtensionIdentity extension,
                                         List<String> eventNames,
                                         ServiceFilter filter,
                                         EventChannel channel) {
        ProjectConfig config = requireProject();
        ServiceFilter effective = filter == null ? ServiceFilter.ANY : filter;
        Subscription subscription = new Subscription();
        for (String eventName : names(eventNames)) {
            for (ServiceConfig service : config.services().values()) {
                if (!effective.matches(service)) {
                    continue;
                }
                String key = CorrelationKeys.service(extension.id(), service.name(), eventName);
                subscription.add(service.events(), eventName,
                        (context, args) -> invokeService(context, extension, eventName, args, channel), key);
                log.debug("Extension {} subscribed to service event {}.{}", extension.id(), service.name(), eventName);
            }
        }
        return subscription;
    }

    /**
     * Deliver a project hook status received on {@code channel}. A status only answers an invocation
     * that was sent on the same channel, so one extension can never complete another's hook.
     *
     * @return {@code false} when nothing on this channel waits for it (late, duplicate or cancelled);
     * such statuses are dropped
     */
    public boolean dispatchProjectStatus(EventChannel channel,
                                         String extensionId,
                                         EventMessages.ProjectHandlerStatus status) {
        String key = CorrelationKeys.project(extensionId, status.eventName);
        if (projectCalls.resolve(key, channel, status)) {
            return true;
        }
        log.warn("Dropping project hook status '{}' for {}: no invocation is waiting", status.status, key);
        return false;
    }

    /**
     * Deliver a service hook status received on {@code channel}.
     *
     * @return {@code false} when nothing on this channel waits for it; such statuses are dropped
     */
    public boolean dispatchServiceStatus(EventChannel channel,
                                         String extensionId,
                                         EventMessages.ServiceHandlerStatus status) {
        String key = CorrelationKeys.service(extensionId, status.serviceName, status.eventName);
        if (serviceCalls.resolve(key, channel, status)) {
            return true;
        }
        log.warn("Dropping service hook status '{}' for {}: no invocation is waiting", status.status, key);
        return false;
    }

    /**
     * Fail the invocations waiting on a channel that is going away.
     */
    public void abandon(EventChannel channel, String extensionId) {
        StreamClosedException closed = new StreamClosedException("event stream of " + extensionId + " closed");
        int failed = projectCalls.failOwnedBy(channel, closed) + serviceCalls.failOwnedBy(channel, closed);
        if (failed > 0) {
            log.warn("Event stream of {} closed with {} hook(s) still waiting", extensionId, failed);
        }
    }

    public int pendingCount() {
        return projectCalls.size() + serviceCalls.size();
    }

    private void invokeProject(Context context,
                               ExtensionIdentity extension,
                               String eventName,
                               ProjectLifecycleEventArgs args,
                               EventChannel channel) {
        String key = CorrelationKeys.project(extension.id(), eventName);
        EventMessages.ProjectHandlerStatus status;
        try (PendingCall<EventMessages.ProjectHandlerStatus> call = projectCalls.open(key, channel)) {
            channel.send(context, new EventMessages.InvokeProjectHandler(eventName, snapshot(args.project())));
            status = call.await(context, hookTimeout);
        }
        if (EventMessages.STATUS_FAILED.equals(status.status)) {
            throw new LifecycleHookException("extension " + extension.id() + " project hook " + eventName
                    + " failed: " + status.message);
        }
    }

    private void invokeService(Context context,
                               ExtensionIdentity extension,
                               String eventName,
                               ServiceLifecycleEventArgs args,
                               EventChannel channel) {
        String key = CorrelationKeys.service(extension.id(), args.service().name(), eventName);
        EventMessages.ServiceHandlerStatus status;
        try (PendingCall<EventMessages.ServiceHandlerStatus> call = serviceCalls.open(key, channel)) {
            channel.send(context, new EventMessages.InvokeServiceHandler(eventName, snapshot(args.project()),
                    snapshot(args.service())));
            status = call.await(context, hookTimeout);
        }
        if (EventMessages.STATUS_FAILED.equals(status.status)) {
            throw new LifecycleHookException("extension " + extension.id() + " service hook " + key
                    + " failed: " + status.message);
        }
    }

    private ProjectConfig requireProject() {
        ProjectConfig config = project == null ? null : project.get();
        if (config == null) {
            throw new ProtocolViolationException("no project is loaded, lifecycle events are unavailable");
        }
        return config;
    }

    private static List<String> names(List<String> eventNames) {
        List<String> names = new ArrayList<>();
        if (eventNames == null) {
            return names;
        }
        for (String name : eventNames) {
            if (name != null && !name.isBlank()) {
                names.add(name.trim());
            }
        }
        return names;
    }

    private static EventMessages.ProjectSnapshot snapshot(ProjectConfig project) {
        List<EventMessages.ServiceSnapshot> services = new ArrayList<>();
        for (ServiceConfig service : project.services().values()) {
            services.add(snapshot(service));
        }
        return new EventMessages.ProjectSnapshot(project.name(), project.path(), services);
    }

    private static EventMessages.ServiceSnapshot snapshot(ServiceConfig service) {
        return new EventMessages.ServiceSnapshot(service.name(), service.language(), service.host(), service.relativePath());
    }
}
