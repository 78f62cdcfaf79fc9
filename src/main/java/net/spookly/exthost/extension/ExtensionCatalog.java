package net.spookly.exthost.extension;

import java.util.List;
import java.util.Optional;

/**
 * Lookup of installed extensions by id.
 */
public interface ExtensionCatalog {
    /**
     * Find an installed extension; ids match case-insensitively.
     */
    Optional<ExtensionIdentity> findInstalled(String id);

    List<ExtensionIdentity> listInstalled();
}
