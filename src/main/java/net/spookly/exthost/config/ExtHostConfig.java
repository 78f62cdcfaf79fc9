package net.spookly.exthost.config;

import java.util.List;
import java.util.Map;

public class ExtHostConfig {
    public ServerConfig server;
    public AuthConfig auth;
    public PromptConfig prompt;
    public EventsConfig events;
    public ProjectSettings project;
    public List<ExtensionConfig> extensions;

    public static class ServerConfig {
        /**
         * Listen host. Only loopback addresses are accepted.
         */
        public String host;
        /**
         * Listen port, 0 picks an ephemeral port.
         */
        public Integer port;
        public Integer maxInboundMessageBytes;
        public Integer shutdownGraceSeconds;
    }

    public static class AuthConfig {
        public Integer tokenTtlSeconds;
    }

    public static class PromptConfig {
        public Boolean noPrompt;
    }

    public static class EventsConfig {
        /**
         * Upper bound for one lifecycle hook round trip. Unset or 0 waits until the caller gives up.
         */
        public Integer hookTimeoutSeconds;
        /**
         * How long startup waits for launched lifecycle extensions to report ready. 0 skips the wait.
         */
        public Integer readyTimeoutSeconds;
    }

    public static class ProjectSettings {
        public String name;
        public String path;
        public List<ServiceSettings> services;
    }

    public static class ServiceSettings {
        public String name;
        public String language;
        public String host;
        public String relativePath;
    }

    public static class ExtensionConfig {
        public String id;
        public String namespace;
        public String displayName;
        public String version;
        public List<String> capabilities;
        /**
         * Executable started by the launcher.
         */
        public String path;
        /**
         * Extra environment variables for the launched process.
         */
        public Map<String, String> environment;
    }
}
