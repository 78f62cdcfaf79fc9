package net.spookly.exthost;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import lombok.extern.slf4j.Slf4j;
import net.spookly.exthost.auth.ServerInfo;
import net.spookly.exthost.config.ConfigDefaults;
import net.spookly.exthost.config.ConfigLoader;
import net.spookly.exthost.config.ConfigPrinter;
import net.spookly.exthost.config.ConfigWarnings;
import net.spookly.exthost.config.ExtHostConfig;
import net.spookly.exthost.extension.ExtensionLauncher;
import net.spookly.exthost.extension.InMemoryExtensionCatalog;
import net.spookly.exthost.prompt.ConsolePrompter;
import net.spookly.exthost.server.ExtensionHostServer;

/**
 * Standalone entry point for the extension host process.
 */
@Slf4j
public final class ExtHostMain {
    private static final String DEFAULT_CONFIG = "config/exthost.yaml";

    private ExtHostMain() {
    }

    /**
     * Start the host, launch the configured extensions and serve until the process is stopped.
     */
    public static void main(String[] args) {
        CliOptions options = parseArgs(args);
        Path configPath = options.configPath;
        ExtHostConfig config = ConfigLoader.load(configPath);
        emitWarnings(config, configPath);
        if (options.printEffectiveConfig) {
            System.out.println(ConfigPrinter.toYaml(config));
            return;
        }
        if (options.dryRun) {
            System.out.println("Config OK (--dry-run).");
            return;
        }

        InMemoryExtensionCatalog catalog = InMemoryExtensionCatalog.fromConfig(config);
        ExtensionHostServer server = new ExtensionHostServer(config, catalog, new ConsolePrompter());
        ServerInfo serverInfo = server.start();
        ExtensionLauncher launcher = new ExtensionLauncher(serverInfo, server::issueToken, config);
        launcher.launchAll(catalog);

        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            launcher.stopAll(ConfigDefaults.shutdownGraceSeconds(config));
            server.stop();
            latch.countDown();
        }));
        awaitReady(launcher, server, config);

        try {
            latch.await();
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }

    static CliOptions parseArgs(String[] args) {
        Path configPath = Paths.get(DEFAULT_CONFIG);
        boolean dryRun = false;
        boolean printEffectiveConfig = false;
        if (args == null) {
            return new CliOptions(configPath, dryRun, printEffectiveConfig);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) || "-c".equals(arg)) {
                if (i + 1 < args.length) {
                    configPath = Paths.get(args[++i]);
                    continue;
                }
            }
            if ("--dry-run".equals(arg)) {
                dryRun = true;
                continue;
            }
            if ("--print-effective-config".equals(arg)) {
                printEffectiveConfig = true;
            }
        }
        return new CliOptions(configPath, dryRun, printEffectiveConfig);
    }

    private static void awaitReady(ExtensionLauncher launcher, ExtensionHostServer server, ExtHostConfig config) {
        int timeoutSeconds = ConfigDefaults.readyTimeoutSeconds(config);
        if (timeoutSeconds == 0) {
            return;
        }
        try {
            List<String> notReady = launcher.awaitReady(server.readiness(), Duration.ofSeconds(timeoutSeconds));
            if (notReady.isEmpty()) {
                log.info("All launched extensions reported ready");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void emitWarnings(ExtHostConfig config, Path configPath) {
        for (String warning : ConfigWarnings.collect(config, configPath)) {
            log.warn("Config warning: {}", warning);
        }
    }

    record CliOptions(Path configPath, boolean dryRun, boolean printEffectiveConfig) {
    }
}
