package net.spookly.exthost.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Replaces {@code env:NAME} and {@code path:file} scalars in the raw YAML tree before it is bound.
 * <p>
 * Failures name the setting they were found under, for example
 * {@code extensions[0].environment.API_KEY}, so a broken secret reference can be traced without
 * printing its value.
 */
final class EnvExpander {
    private static final String ENV_PREFIX = "env:";
    private static final String PATH_PREFIX = "path:";

    private final Path baseDir;
    private final Function<String, String> environment;

    EnvExpander(Path baseDir, Function<String, String> environment) {
        this.baseDir = baseDir;
        this.environment = environment;
    }

    static Object expand(Object tree, Path baseDir) {
        return new EnvExpander(baseDir, System::getenv).expandNode(tree, "");
    }

    Object expandNode(Object node, String setting) {
        if (node instanceof Map<?, ?> section) {
            Map<Object, Object> expanded = new LinkedHashMap<>();
            section.forEach((key, value) -> expanded.put(key, expandNode(value, child(setting, String.valueOf(key)))));
            return expanded;
        }
        if (node instanceof List<?> items) {
            List<Object> expanded = new ArrayList<>(items.size());
            for (int i = 0; i < items.size(); i++) {
                expanded.add(expandNode(items.get(i), setting + "[" + i + "]"));
            }
            return expanded;
        }
        if (node instanceof String scalar) {
            return expandScalar(scalar, setting);
        }
        return node;
    }

    private String expandScalar(String scalar, String setting) {
        if (scalar.startsWith(ENV_PREFIX)) {
            return readEnvironment(scalar.substring(ENV_PREFIX.length()).trim(), setting);
        }
        if (scalar.startsWith(PATH_PREFIX)) {
            return readFile(scalar.substring(PATH_PREFIX.length()).trim(), setting);
        }
        return scalar;
    }

    private String readEnvironment(String name, String setting) {
        if (name.isEmpty()) {
            throw new ConfigException(setting + ": env: reference has no variable name");
        }
        String value = environment.apply(name);
        if (value == null) {
            throw new ConfigException(setting + ": missing required environment variable " + name);
        }
        return value;
    }

    private String readFile(String location, String setting) {
        if (location.isEmpty()) {
            throw new ConfigException(setting + ": path: reference has no file");
        }
        Path file;
        try {
            file = Paths.get(location);
        } catch (InvalidPathException e) {
            throw new ConfigException(setting + ": invalid path " + location, e);
        }
        if (baseDir != null && !file.isAbsolute()) {
            file = baseDir.resolve(file).normalize();
        }
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new ConfigException(setting + ": failed to read " + file, e);
        }
        if (content.isEmpty()) {
            throw new ConfigException(setting + ": " + file + " is empty");
        }
        return content;
    }

    private static String child(String parent, String key) {
        return parent.isEmpty() ? key : parent + "." + key;
    }
}
