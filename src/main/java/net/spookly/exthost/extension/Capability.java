package net.spookly.exthost.extension;

import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Named permission an extension declares in order to use a host feature.
 */
public enum Capability {
    CUSTOM_COMMANDS("custom-commands"),
    LIFECYCLE_EVENTS("lifecycle-events"),
    MCP_SERVER("mcp-server"),
    SERVICE_TARGET_PROVIDER("service-target-provider"),
    FRAMEWORK_SERVICE_PROVIDER("framework-service-provider"),
    PROVISIONING_PROVIDER("provisioning-provider"),
    METADATA("metadata");

    private final String id;

    Capability(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Resolve a wire id, ignoring case; empty when the id is unknown.
     */
    public static Optional<Capability> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (Capability capability : values()) {
            if (capability.id.equals(normalized)) {
                return Optional.of(capability);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static Capability fromId(String id) {
        return find(id).orElseThrow(() -> new IllegalArgumentException("unknown capability: " + id));
    }
}
