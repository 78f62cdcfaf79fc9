package net.spookly.exthost.project;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.grpc.Context;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.exthost.config.ExtHostConfig;

/**
 * The project the host runs for, with project-level and per-service lifecycle events.
 */
@Getter
@Accessors(fluent = true)
public final class ProjectConfig {
    private final String name;
    private final String path;
    private final Map<String, ServiceConfig> services;
    private final LifecycleDispatcher<ProjectLifecycleEventArgs> events = new LifecycleDispatcher<>();

    public ProjectConfig(String name, String path, List<ServiceConfig> services) {
        this.name = name;
        this.path = path;
        Map<String, ServiceConfig> byName = new LinkedHashMap<>();
        if (services != null) {
            for (ServiceConfig service : services) {
                byName.put(service.name(), service);
            }
        }
        this.services = Collections.unmodifiableMap(byName);
    }

    /**
     * @return the configured project, or {@code null} when the config has no project section
     */
    public static ProjectConfig fromConfig(ExtHostConfig config) {
        if (config == null || config.project == null) {
            return null;
        }
        List<ServiceConfig> services = new ArrayList<>();
        if (config.project.services != null) {
            for (ExtHostConfig.ServiceSettings service : config.project.services) {
                services.add(new ServiceConfig(service.name, service.language, service.host, service.relativePath));
            }
        }
        return new ProjectConfig(config.project.name, config.project.path, services);
    }

    /**
     * Raise a project-scoped event.
     */
    public void raise(Context context, String eventName) {
        events.raise(context, eventName, new ProjectLifecycleEventArgs(this));
    }

    /**
     * Raise a service-scoped event for one service.
     *
     * @throws IllegalArgumentException when the service is unknown
     */
    public void raise(Context context, String eventName, String serviceName) {
        ServiceConfig service = services.get(serviceName);
        if (service == null) {
            throw new IllegalArgumentException("unknown service: " + serviceName);
        }
        service.events().raise(context, eventName, new ServiceLifecycleEventArgs(this, service));
    }
}
