package net.spookly.exthost.event;

import lombok.Value;
import lombok.experimental.Accessors;
import net.spookly.exthost.project.ServiceConfig;

/**
 * Narrows a service subscription to one language and/or host. Blank fields match any service.
 */
@Value
@Accessors(fluent = true)
public class ServiceFilter {
    public static final ServiceFilter ANY = new ServiceFilter(null, null);

    String language;
    String host;

    public boolean matches(ServiceConfig service) {
        if (language != null && !language.isBlank() && !language.equals(service.language())) {
            return false;
        }
        return host == null || host.isBlank() || host.equals(service.host());
    }
}
