package net.spookly.exthost.project;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * One service of the project with its own lifecycle events.
 */
@Getter
@Accessors(fluent = true)
public final class ServiceConfig {
    private final String name;
    private final String language;
    private final String host;
    private final String relativePath;
    private final LifecycleDispatcher<ServiceLifecycleEventArgs> events = new LifecycleDispatcher<>();

    public ServiceConfig(String name, String language, String host, String relativePath) {
        this.name = name;
        this.language = language;
        this.host = host;
        this.relativePath = relativePath;
    }
}
