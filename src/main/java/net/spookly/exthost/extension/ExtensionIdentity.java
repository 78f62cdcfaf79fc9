package net.spookly.exthost.extension;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Installed extension record, read-only for the lifetime of an RPC session.
 */
@Getter
@Accessors(fluent = true)
public final class ExtensionIdentity {
    private final String id;
    private final String namespace;
    private final String displayName;
    private final String version;
    private final Set<Capability> capabilities;
    /**
     * Executable path, or {@code null} when the host does not launch this extension itself.
     */
    private final String path;

    public ExtensionIdentity(String id,
                             String namespace,
                             String displayName,
                             String version,
                             Collection<Capability> capabilities,
                             String path) {
        this.id = Objects.requireNonNull(id, "id");
        this.namespace = namespace;
        this.displayName = displayName == null || displayName.isBlank() ? id : displayName;
        this.version = version;
        this.capabilities = capabilities == null || capabilities.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(capabilities));
        this.path = path;
    }

    public boolean hasCapability(Capability capability) {
        return capabilities.contains(capability);
    }

    @Override
    public String toString() {
        return "ExtensionIdentity{id=" + id + ", version=" + version + ", capabilities=" + capabilities + "}";
    }
}
