package net.spookly.exthost.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EnvExpanderTest {
    @TempDir
    Path tempDir;

    private final Map<String, String> environment = Map.of("EXTHOST_PORT", "7443");

    @Test
    void expandsNestedReferences() throws Exception {
        Files.createDirectories(tempDir.resolve("secret"));
        Files.writeString(tempDir.resolve("secret").resolve("api_key"), "  s3cret\n", StandardCharsets.UTF_8);
        Map<String, Object> tree = Map.of(
                "server", Map.of("port", "env:EXTHOST_PORT", "host", "127.0.0.1"),
                "extensions", List.of(Map.of("environment", Map.of("API_KEY", "path:secret/api_key"))));

        @SuppressWarnings("unchecked")
        Map<String, Object> expanded = (Map<String, Object>) expander().expandNode(tree, "");

        assertEquals(Map.of("port", "7443", "host", "127.0.0.1"), expanded.get("server"));
        assertEquals(List.of(Map.of("environment", Map.of("API_KEY", "s3cret"))), expanded.get("extensions"));
    }

    @Test
    void missingVariableNamesTheSetting() {
        Map<String, Object> tree = Map.of("extensions", List.of(Map.of("environment", Map.of("TOKEN", "env:NOPE"))));

        ConfigException failure = assertThrows(ConfigException.class, () -> expander().expandNode(tree, ""));

        assertEquals("extensions[0].environment.TOKEN: missing required environment variable NOPE", failure.getMessage());
    }

    @Test
    void emptySecretFileIsRejected() throws Exception {
        Files.writeString(tempDir.resolve("blank"), "\n", StandardCharsets.UTF_8);

        ConfigException failure = assertThrows(ConfigException.class,
                () -> expander().expandNode(Map.of("auth", Map.of("key", "path:blank")), ""));

        assertEquals("auth.key: " + tempDir.resolve("blank") + " is empty", failure.getMessage());
    }

    @Test
    void emptyReferencesAreRejected() {
        assertThrows(ConfigException.class, () -> expander().expandNode("env:", "server.port"));
        assertThrows(ConfigException.class, () -> expander().expandNode("path: ", "server.port"));
    }

    @Test
    void nonStringScalarsPassThrough() {
        assertEquals(5, expander().expandNode(5, "server.shutdownGraceSeconds"));
        assertEquals("plain", expander().expandNode("plain", "project.name"));
    }

    private EnvExpander expander() {
        return new EnvExpander(tempDir, environment::get);
    }
}
