package net.spookly.exthost.protocol;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;

/**
 * Payloads exchanged on the lifecycle event stream.
 */
public final class EventMessages {
    public static final String STATUS_SUCCEEDED = "succeeded";
    public static final String STATUS_FAILED = "failed";

    /**
     * Extension asks to handle project-scoped events.
     */
    @NoArgsConstructor
    @AllArgsConstructor
    public static final class SubscribeProjectEvent implements Payload {
        public List<String> eventNames;
    }

    /**
     * Extension asks to handle service-scoped events, optionally only for one language or host.
     * A blank filter matches every service.
     */
    @NoArgsConstructor
    @AllArgsConstructor
    public static final class SubscribeServiceEvent implements Payload {
        public List<String> eventNames;
        public String language;
        public String host;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class InvokeProjectHandler implements Payload {
        public String eventName;
        public ProjectSnapshot project;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class InvokeServiceHandler implements Payload {
        public String eventName;
        public ProjectSnapshot project;
        public ServiceSnapshot service;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class ProjectHandlerStatus implements Payload {
        public String eventName;
        public String status;
        public String message;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class ServiceHandlerStatus implements Payload {
        public String eventName;
        public String serviceName;
        public String status;
        public String message;
    }

    public static final class ExtensionReadyEvent implements Payload {
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class ProjectSnapshot {
        public String name;
        public String path;
        public List<ServiceSnapshot> services;
    }

    @NoArgsConstructor
    @AllArgsConstructor
    public static final class ServiceSnapshot {
        public String name;
        public String language;
        public String host;
        public String relativePath;
    }

    private EventMessages() {
    }
}
