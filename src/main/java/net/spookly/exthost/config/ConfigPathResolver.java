package net.spookly.exthost.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves the project path and extension executables against the config directory.
 */
final class ConfigPathResolver {
    private ConfigPathResolver() {
    }

    static void resolve(ExtHostConfig config, Path baseDir) {
        if (config == null || baseDir == null) {
            return;
        }
        if (config.project != null) {
            config.project.path = resolvePath(baseDir, config.project.path);
        }
        if (config.extensions != null) {
            for (ExtHostConfig.ExtensionConfig extension : config.extensions) {
                if (extension != null) {
                    extension.path = resolvePath(baseDir, extension.path);
                }
            }
        }
    }

    private static String resolvePath(Path baseDir, String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return rawValue;
        }
        try {
            Path path = Paths.get(rawValue);
            if (!path.isAbsolute()) {
                path = baseDir.resolve(path).normalize();
            }
            return path.toString();
        } catch (InvalidPathException e) {
            throw new ConfigException("Invalid path value: " + rawValue, e);
        }
    }
}
