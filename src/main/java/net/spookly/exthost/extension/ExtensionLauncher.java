package net.spookly.exthost.extension;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import lombok.extern.slf4j.Slf4j;
import net.spookly.exthost.auth.ServerInfo;
import net.spookly.exthost.config.ExtHostConfig;

/**
 * Starts extension executables pointed at a running host, each with its own access token.
 */
@Slf4j
public final class ExtensionLauncher {
    public static final String ENV_SERVER = "EXTHOST_SERVER";
    public static final String ENV_ACCESS_TOKEN = "EXTHOST_ACCESS_TOKEN";

    private final ServerInfo serverInfo;
    private final Function<String, String> tokenIssuer;
    private final Map<String, Map<String, String>> environments = new LinkedHashMap<>();
    private final List<LaunchedExtension> launched = new CopyOnWriteArrayList<>();

    /**
     * @param tokenIssuer mints a token for an extension id against {@code serverInfo}
     */
    public ExtensionLauncher(ServerInfo serverInfo, Function<String, String> tokenIssuer, ExtHostConfig config) {
        this.serverInfo = serverInfo;
        this.tokenIssuer = tokenIssuer;
        if (config != null && config.extensions != null) {
            for (ExtHostConfig.ExtensionConfig extension : config.extensions) {
                if (extension != null && extension.id != null && extension.environment != null) {
                    environments.put(extension.id, Map.copyOf(extension.environment));
                }
            }
        }
    }

    /**
     * Start every installed extension that names an executable.
     */
    public List<LaunchedExtension> launchAll(ExtensionCatalog catalog) {
        List<LaunchedExtension> started = new ArrayList<>();
        for (ExtensionIdentity extension : catalog.listInstalled()) {
            if (extension.path() == null || extension.path().isBlank()) {
                continue;
            }
            try {
                started.add(launch(extension));
            } catch (IOException e) {
                log.error("Failed to start extension {} from {}", extension.id(), extension.path(), e);
            }
        }
        return started;
    }

    public LaunchedExtension launch(ExtensionIdentity extension) throws IOException {
        ProcessBuilder builder = processBuilder(extension);
        Process process = builder.start();
        LaunchedExtension handle = new LaunchedExtension(extension, process);
        launched.add(handle);
        log.info("Started extension {} (pid {})", extension.id(), process.pid());
        return handle;
    }

    ProcessBuilder processBuilder(ExtensionIdentity extension) {
        if (extension.path() == null || extension.path().isBlank()) {
            throw new IllegalArgumentException("extension " + extension.id() + " has no executable path");
        }
        ProcessBuilder builder = new ProcessBuilder(extension.path());
        File workingDirectory = new File(extension.path()).getAbsoluteFile().getParentFile();
        if (workingDirectory != null) {
            builder.directory(workingDirectory);
        }
        builder.environment().putAll(environmentFor(extension));
        builder.inheritIO();
        return builder;
    }

    /**
     * Variables added to the process environment; host variables win over configured ones.
     */
    Map<String, String> environmentFor(ExtensionIdentity extension) {
        Map<String, String> env = new LinkedHashMap<>(environments.getOrDefault(extension.id(), Map.of()));
        env.put(ENV_SERVER, serverInfo.address());
        env.put(ENV_ACCESS_TOKEN, tokenIssuer.apply(extension.id()));
        return env;
    }

    /**
     * Wait for the launched extensions that listen to lifecycle events to send their ready event.
     * Extensions without that capability never announce readiness and are not waited for.
     *
     * @return ids of the extensions that did not report ready in time
     */
    public List<String> awaitReady(ExtensionReadiness readiness, Duration timeout) throws InterruptedException {
        List<String> expected = new ArrayList<>();
        for (LaunchedExtension extension : launched) {
            if (extension.extension().hasCapability(Capability.LIFECYCLE_EVENTS)) {
                expected.add(extension.extensionId());
            }
        }
        if (expected.isEmpty()) {
            return List.of();
        }
        List<String> notReady = readiness.awaitAll(expected, timeout);
        for (String extensionId : notReady) {
            log.warn("Extension {} did not report ready within {}s", extensionId, timeout.toSeconds());
        }
        return notReady;
    }

    /**
     * Ask every launched process to exit, forcing the ones still alive after the grace period.
     */
    public void stopAll(long graceSeconds) {
        for (LaunchedExtension extension : launched) {
            extension.process().destroy();
        }
        for (LaunchedExtension extension : launched) {
            try {
                if (!extension.process().waitFor(graceSeconds, TimeUnit.SECONDS)) {
                    log.warn("Extension {} did not exit, killing it", extension.extensionId());
                    extension.process().destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                extension.process().destroyForcibly();
            }
        }
        launched.clear();
    }

    public record LaunchedExtension(ExtensionIdentity extension, Process process) {
        public String extensionId() {
            return extension.id();
        }
    }
}
