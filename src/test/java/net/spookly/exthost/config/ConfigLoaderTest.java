package net.spookly.exthost.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;

class ConfigLoaderTest {
    @Test
    void createsDefaultConfigWhenMissing() throws IOException {
        Path tempDir = Files.createTempDirectory("exthost-config");
        Path configPath = tempDir.resolve("exthost.yaml");

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));

        assertTrue(Files.exists(configPath));
        String content = Files.readString(configPath, StandardCharsets.UTF_8);
        assertTrue(content.contains("server:"));
        assertTrue(content.contains("host: 127.0.0.1"));
        assertTrue(exception.getMessage().contains("generated default"));
    }

    @Test
    void loadsGeneratedDefault() throws IOException {
        Path tempDir = Files.createTempDirectory("exthost-config");
        Path configPath = tempDir.resolve("exthost.yaml");
        Files.writeString(configPath, ConfigDefaults.defaultYaml(), StandardCharsets.UTF_8);

        ExtHostConfig config = ConfigLoader.load(configPath);

        assertEquals("127.0.0.1", config.server.host);
        assertEquals(0, config.server.port);
        assertEquals(3600, config.auth.tokenTtlSeconds);
        assertFalse(config.prompt.noPrompt);
        assertEquals("my-project", config.project.name);
        assertEquals(tempDir.toAbsolutePath().normalize().toString(), config.project.path);
        assertTrue(config.extensions.isEmpty());
    }

    @Test
    void resolvesPathsAndSecretsRelativeToConfig() throws IOException {
        Path tempDir = Files.createTempDirectory("exthost-config");
        Path configPath = tempDir.resolve("exthost.yaml");
        Path secretPath = tempDir.resolve("secret").resolve("api_key");
        Files.createDirectories(secretPath.getParent());
        Files.writeString(secretPath, "s3cret\n", StandardCharsets.UTF_8);
        Files.writeString(configPath, """
                server:
                  host: localhost
                  port: 7443
                project:
                  name: shop
                  path: app
                  services:
                    - name: api
                      language: python
                      host: containerapp
                      relativePath: src/api
                extensions:
                  - id: demo.extension
                    capabilities: [lifecycle-events, service-target-provider]
                    path: bin/demo
                    environment:
                      API_KEY: path:secret/api_key
                """, StandardCharsets.UTF_8);

        ExtHostConfig config = ConfigLoader.load(configPath);

        Path base = tempDir.toAbsolutePath();
        assertEquals(base.resolve("app").normalize().toString(), config.project.path);
        assertEquals(base.resolve("bin").resolve("demo").normalize().toString(), config.extensions.get(0).path);
        assertEquals("s3cret", config.extensions.get(0).environment.get("API_KEY"));
        assertEquals("containerapp", config.project.services.get(0).host);
    }

    @Test
    void rejectsUnknownProperties() throws IOException {
        Path tempDir = Files.createTempDirectory("exthost-config");
        Path configPath = tempDir.resolve("exthost.yaml");
        Files.writeString(configPath, """
                server:
                  host: 127.0.0.1
                  listen: 0.0.0.0
                """, StandardCharsets.UTF_8);

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));

        assertTrue(exception.getMessage().contains("Failed to parse config"));
    }

    @Test
    void reportsMissingEnvironmentVariable() throws IOException {
        Path tempDir = Files.createTempDirectory("exthost-config");
        Path configPath = tempDir.resolve("exthost.yaml");
        Files.writeString(configPath, """
                extensions:
                  - id: demo.extension
                    environment:
                      TOKEN: env:EXTHOST_TEST_VARIABLE_THAT_IS_NEVER_SET
                """, StandardCharsets.UTF_8);

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));

        assertTrue(exception.getMessage().contains("EXTHOST_TEST_VARIABLE_THAT_IS_NEVER_SET"));
    }
}
