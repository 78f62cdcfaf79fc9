package net.spookly.exthost.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Renders the effective configuration with defaults applied and environment-sourced values hidden.
 */
public final class ConfigPrinter {
    private static final String REDACTED = "<redacted>";
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private ConfigPrinter() {
    }

    public static String toYaml(ExtHostConfig config) {
        @SuppressWarnings("unchecked")
        Map<String, Object> data = MAPPER.convertValue(config, Map.class);
        applyDefaults(data, config);
        redactSensitiveValues(data);
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        return new Yaml(options).dump(data);
    }

    private static void applyDefaults(Map<String, Object> data, ExtHostConfig config) {
        Map<String, Object> server = section(data, "server");
        server.putIfAbsent("host", ConfigDefaults.host(config));
        server.putIfAbsent("port", ConfigDefaults.port(config));
        server.putIfAbsent("maxInboundMessageBytes", ConfigDefaults.maxInboundMessageBytes(config));
        server.putIfAbsent("shutdownGraceSeconds", ConfigDefaults.shutdownGraceSeconds(config));
        section(data, "auth").putIfAbsent("tokenTtlSeconds", ConfigDefaults.tokenTtlSeconds(config));
        section(data, "prompt").putIfAbsent("noPrompt", ConfigDefaults.noPrompt(config));
        Map<String, Object> events = section(data, "events");
        events.putIfAbsent("hookTimeoutSeconds", ConfigDefaults.hookTimeoutSeconds(config));
        events.putIfAbsent("readyTimeoutSeconds", ConfigDefaults.readyTimeoutSeconds(config));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> data, String name) {
        Object existing = data.get(name);
        if (existing instanceof Map) {
            return (Map<String, Object>) existing;
        }
        Map<String, Object> created = new LinkedHashMap<>();
        data.put(name, created);
        return created;
    }

    // Extension environments may carry credentials, only their keys are printed.
    @SuppressWarnings("unchecked")
    private static void redactSensitiveValues(Map<String, Object> data) {
        if (data == null) {
            return;
        }
        Object extensions = data.get("extensions");
        if (!(extensions instanceof List)) {
            return;
        }
        for (Object entry : (List<?>) extensions) {
            if (!(entry instanceof Map)) {
                continue;
            }
            Object environment = ((Map<String, Object>) entry).get("environment");
            if (environment instanceof Map) {
                Map<String, Object> environmentMap = (Map<String, Object>) environment;
                environmentMap.replaceAll((key, value) -> REDACTED);
            }
        }
    }
}
