package net.spookly.exthost.config;

/**
 * Default configuration template written when no config file exists.
 */
public final class ConfigDefaults {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_MAX_INBOUND_MESSAGE_BYTES = 4 * 1024 * 1024;
    public static final int DEFAULT_SHUTDOWN_GRACE_SECONDS = 5;
    public static final int DEFAULT_TOKEN_TTL_SECONDS = 3600;
    public static final int DEFAULT_READY_TIMEOUT_SECONDS = 30;

    private static final String DEFAULT_YAML = """
            # Generated default extension host config.
            # The signing key is generated on every start and never stored.
            server:
              host: 127.0.0.1
              port: 0
              maxInboundMessageBytes: 4194304
              shutdownGraceSeconds: 5

            auth:
              tokenTtlSeconds: 3600

            prompt:
              noPrompt: false

            events:
              hookTimeoutSeconds: 0
              readyTimeoutSeconds: 30

            project:
              name: my-project
              path: .
              services: []

            extensions: []
            """;

    private ConfigDefaults() {
    }

    /**
     * Render the default configuration template.
     */
    public static String defaultYaml() {
        return DEFAULT_YAML;
    }

    public static String host(ExtHostConfig config) {
        ExtHostConfig.ServerConfig server = config == null ? null : config.server;
        return server == null || server.host == null || server.host.isBlank() ? DEFAULT_HOST : server.host;
    }

    public static int port(ExtHostConfig config) {
        ExtHostConfig.ServerConfig server = config == null ? null : config.server;
        return server == null || server.port == null ? 0 : server.port;
    }

    public static int maxInboundMessageBytes(ExtHostConfig config) {
        ExtHostConfig.ServerConfig server = config == null ? null : config.server;
        return server == null || server.maxInboundMessageBytes == null
                ? DEFAULT_MAX_INBOUND_MESSAGE_BYTES
                : server.maxInboundMessageBytes;
    }

    public static int shutdownGraceSeconds(ExtHostConfig config) {
        ExtHostConfig.ServerConfig server = config == null ? null : config.server;
        return server == null || server.shutdownGraceSeconds == null
                ? DEFAULT_SHUTDOWN_GRACE_SECONDS
                : server.shutdownGraceSeconds;
    }

    public static int tokenTtlSeconds(ExtHostConfig config) {
        ExtHostConfig.AuthConfig auth = config == null ? null : config.auth;
        return auth == null || auth.tokenTtlSeconds == null ? DEFAULT_TOKEN_TTL_SECONDS : auth.tokenTtlSeconds;
    }

    public static boolean noPrompt(ExtHostConfig config) {
        ExtHostConfig.PromptConfig prompt = config == null ? null : config.prompt;
        return prompt != null && prompt.noPrompt != null && prompt.noPrompt;
    }

    /**
     * @return hook timeout in seconds, 0 when hooks wait without a bound
     */
    public static int hookTimeoutSeconds(ExtHostConfig config) {
        ExtHostConfig.EventsConfig events = config == null ? null : config.events;
        return events == null || events.hookTimeoutSeconds == null ? 0 : events.hookTimeoutSeconds;
    }

    public static int readyTimeoutSeconds(ExtHostConfig config) {
        ExtHostConfig.EventsConfig events = config == null ? null : config.events;
        return events == null || events.readyTimeoutSeconds == null ? DEFAULT_READY_TIMEOUT_SECONDS
                : events.readyTimeoutSeconds;
    }
}
