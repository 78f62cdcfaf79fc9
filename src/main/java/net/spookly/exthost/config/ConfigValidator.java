package net.spookly.exthost.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import net.spookly.exthost.extension.Capability;

public final class ConfigValidator {
    private static final Set<String> LOOPBACK_HOSTS = Set.of("127.0.0.1", "localhost", "::1");

    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException listing every violation.
     */
    public static void validate(ExtHostConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateServer(config, errors);
        validateAuth(config, errors);
        validateEvents(config, errors);
        validateProject(config, errors);
        validateExtensions(config, errors);

        throwIfErrors(errors);
    }

    private static void validateServer(ExtHostConfig config, List<String> errors) {
        ExtHostConfig.ServerConfig server = config.server;
        if (server == null) {
            return;
        }
        if (!isBlank(server.host) && !LOOPBACK_HOSTS.contains(server.host.trim().toLowerCase(Locale.ROOT))) {
            errors.add("server.host must be a loopback address");
        }
        if (server.port != null && (server.port < 0 || server.port > 65535)) {
            errors.add("server.port must be between 0 and 65535");
        }
        if (server.maxInboundMessageBytes != null) {
            requirePositive(errors, server.maxInboundMessageBytes, "server.maxInboundMessageBytes");
        }
        if (server.shutdownGraceSeconds != null && server.shutdownGraceSeconds < 0) {
            errors.add("server.shutdownGraceSeconds must not be negative");
        }
    }

    private static void validateAuth(ExtHostConfig config, List<String> errors) {
        if (config.auth != null && config.auth.tokenTtlSeconds != null) {
            requirePositive(errors, config.auth.tokenTtlSeconds, "auth.tokenTtlSeconds");
        }
    }

    private static void validateEvents(ExtHostConfig config, List<String> errors) {
        if (config.events != null && config.events.hookTimeoutSeconds != null && config.events.hookTimeoutSeconds < 0) {
            errors.add("events.hookTimeoutSeconds must not be negative");
        }
        if (config.events != null && config.events.readyTimeoutSeconds != null && config.events.readyTimeoutSeconds < 0) {
            errors.add("events.readyTimeoutSeconds must not be negative");
        }
    }

    private static void validateProject(ExtHostConfig config, List<String> errors) {
        ExtHostConfig.ProjectSettings project = config.project;
        if (project == null) {
            return;
        }
        requireNonBlank(errors, project.name, "project.name");
        if (project.services == null) {
            return;
        }
        Set<String> names = new HashSet<>();
        for (ExtHostConfig.ServiceSettings service : project.services) {
            if (service == null) {
                errors.add("project.services must not include empty entries");
                continue;
            }
            if (isBlank(service.name)) {
                errors.add("project.services.name is required");
                continue;
            }
            if (!names.add(service.name)) {
                errors.add("project.services.name must be unique: " + service.name);
            }
            requireNonBlank(errors, service.language, "project.services." + service.name + ".language");
            requireNonBlank(errors, service.host, "project.services." + service.name + ".host");
        }
    }

    private static void validateExtensions(ExtHostConfig config, List<String> errors) {
        if (config.extensions == null) {
            return;
        }
        Set<String> ids = new HashSet<>();
        for (ExtHostConfig.ExtensionConfig extension : config.extensions) {
            if (extension == null) {
                errors.add("extensions must not include empty entries");
                continue;
            }
            if (isBlank(extension.id)) {
                errors.add("extensions.id is required");
                continue;
            }
            if (!ids.add(extension.id.trim().toLowerCase(Locale.ROOT))) {
                errors.add("extensions.id must be unique: " + extension.id);
            }
            if (extension.capabilities != null) {
                for (String capability : extension.capabilities) {
                    if (Capability.find(capability).isEmpty()) {
                        errors.add("extensions." + extension.id + ".capabilities has unknown capability: " + capability);
                    }
                }
            }
        }
    }

    private static void requireNonBlank(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        }
    }

    private static void requirePositive(List<String> errors, Integer value, String field) {
        if (value == null || value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}
