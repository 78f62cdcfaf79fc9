package net.spookly.exthost.event;

/**
 * Correlation keys pairing a lifecycle invocation with the status reply for it.
 */
public final class CorrelationKeys {
    private CorrelationKeys() {
    }

    /**
     * {@code extensionId.eventName}
     */
    public static String project(String extensionId, String eventName) {
        return extensionId + "." + eventName;
    }

    /**
     * {@code extensionId.serviceName.eventName}
     */
    public static String service(String extensionId, String serviceName, String eventName) {
        return extensionId + "." + serviceName + "." + eventName;
    }
}
