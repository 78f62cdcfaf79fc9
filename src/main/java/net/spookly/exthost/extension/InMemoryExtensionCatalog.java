package net.spookly.exthost.extension;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import lombok.NonNull;
import net.spookly.exthost.config.ConfigException;
import net.spookly.exthost.config.ExtHostConfig;

/**
 * Extension catalog held in memory, seeded from the {@code extensions} config section.
 */
public final class InMemoryExtensionCatalog implements ExtensionCatalog {
    private final Map<String, ExtensionIdentity> extensions = new ConcurrentHashMap<>();

    public static InMemoryExtensionCatalog fromConfig(ExtHostConfig config) {
        InMemoryExtensionCatalog catalog = new InMemoryExtensionCatalog();
        if (config == null || config.extensions == null) {
            return catalog;
        }
        for (ExtHostConfig.ExtensionConfig entry : config.extensions) {
            if (entry == null) {
                continue;
            }
            List<Capability> capabilities = new ArrayList<>();
            if (entry.capabilities != null) {
                for (String raw : entry.capabilities) {
                    capabilities.add(Capability.find(raw)
                            .orElseThrow(() -> new ConfigException("Unknown capability for extension "
                                    + entry.id + ": " + raw)));
                }
            }
            catalog.install(new ExtensionIdentity(
                    entry.id,
                    entry.namespace,
                    entry.displayName,
                    entry.version,
                    capabilities,
                    entry.path
            ));
        }
        return catalog;
    }

    /**
     * Add or replace an installed extension.
     */
    public void install(@NonNull ExtensionIdentity extension) {
        extensions.put(normalize(extension.id()), extension);
    }

    public boolean uninstall(String id) {
        return id != null && extensions.remove(normalize(id)) != null;
    }

    @Override
    public Optional<ExtensionIdentity> findInstalled(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(extensions.get(normalize(id)));
    }

    @Override
    public List<ExtensionIdentity> listInstalled() {
        List<ExtensionIdentity> installed = new ArrayList<>(extensions.values());
        installed.sort(Comparator.comparing(ExtensionIdentity::id));
        return installed;
    }

    private static String normalize(String id) {
        return id.trim().toLowerCase(Locale.ROOT);
    }
}
