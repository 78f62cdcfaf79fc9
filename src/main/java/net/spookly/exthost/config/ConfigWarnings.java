package net.spookly.exthost.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Collects non-fatal configuration warnings (for example, extension binaries others can replace).
 */
public final class ConfigWarnings {
    private ConfigWarnings() {
    }

    public static List<String> collect(ExtHostConfig config, Path configPath) {
        List<String> warnings = new ArrayList<>();
        if (config == null) {
            return warnings;
        }
        Path baseDir = configPath == null ? null : configPath.toAbsolutePath().getParent();
        if (config.extensions != null) {
            for (ExtHostConfig.ExtensionConfig extension : config.extensions) {
                if (extension == null || extension.path == null || extension.path.isBlank()) {
                    continue;
                }
                String label = "extensions." + extension.id + ".path";
                Path resolved = resolvePath(baseDir, extension.path.trim());
                if (resolved == null || !Files.exists(resolved)) {
                    warnings.add(label + " does not exist: " + extension.path);
                    continue;
                }
                warnIfWorldWritable(warnings, label, resolved);
            }
        }
        if (config.events != null && config.events.hookTimeoutSeconds != null && config.events.hookTimeoutSeconds == 0
                && config.project != null) {
            warnings.add("events.hookTimeoutSeconds is 0, a stalled extension blocks lifecycle events until the caller cancels");
        }
        return warnings;
    }

    private static void warnIfWorldWritable(List<String> warnings, String label, Path resolved) {
        PosixFileAttributeView view = Files.getFileAttributeView(resolved, PosixFileAttributeView.class);
        if (view == null) {
            return;
        }
        try {
            Set<PosixFilePermission> permissions = view.readAttributes().permissions();
            if (permissions.contains(PosixFilePermission.OTHERS_WRITE)) {
                warnings.add(label + " is world-writable: " + resolved);
            }
        } catch (IOException ignored) {
            // Permission checks are advisory.
        }
    }

    private static Path resolvePath(Path baseDir, String rawValue) {
        try {
            Path path = Paths.get(rawValue);
            if (baseDir != null && !path.isAbsolute()) {
                return baseDir.resolve(path).normalize();
            }
            return path;
        } catch (Exception ignored) {
            return null;
        }
    }
}
