package net.spookly.exthost.server;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.grpc.Server;
import io.grpc.netty.NettyServerBuilder;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import net.spookly.exthost.auth.ServerInfo;
import net.spookly.exthost.auth.TokenCodec;
import net.spookly.exthost.config.ConfigDefaults;
import net.spookly.exthost.config.ExtHostConfig;
import net.spookly.exthost.error.ExtensionNotFoundException;
import net.spookly.exthost.event.EventBridge;
import net.spookly.exthost.event.EventStreamService;
import net.spookly.exthost.extension.ExtensionCatalog;
import net.spookly.exthost.extension.ExtensionIdentity;
import net.spookly.exthost.extension.ExtensionReadiness;
import net.spookly.exthost.project.ProjectConfig;
import net.spookly.exthost.prompt.PromptLock;
import net.spookly.exthost.prompt.PromptService;
import net.spookly.exthost.prompt.Prompter;
import net.spookly.exthost.provider.FrameworkServiceStreamService;
import net.spookly.exthost.provider.ProviderFactories;
import net.spookly.exthost.provider.ProviderRegistries;
import net.spookly.exthost.provider.ProvisioningStreamService;
import net.spookly.exthost.provider.ServiceTargetStreamService;

/**
 * Loopback gRPC server hosting the provider, event and prompt services for one process lifetime.
 */
@Slf4j
@Accessors(fluent = true)
public final class ExtensionHostServer {
    private final ExtHostConfig config;
    @Getter
    private final ExtensionCatalog catalog;
    @Getter
    private final ProviderRegistries registries;
    @Getter
    private final EventBridge bridge;
    @Getter
    private final ExtensionReadiness readiness;
    @Getter
    private final TokenCodec tokenCodec;
    @Getter
    private final ProjectConfig project;
    private final ProviderFactories factories;
    private final Prompter prompter;
    private final PromptLock promptLock = new PromptLock();
    private final Object lifecycleLock = new Object();

    private volatile ServerInfo serverInfo;
    private Server server;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private ExecutorService streamWorkers;

    public ExtensionHostServer(ExtHostConfig config, ExtensionCatalog catalog, Prompter prompter) {
        this(config, catalog, prompter, new ProviderRegistries(), ProviderFactories.defaults());
    }

    public ExtensionHostServer(ExtHostConfig config,
                               ExtensionCatalog catalog,
                               Prompter prompter,
                               ProviderRegistries registries,
                               ProviderFactories factories) {
        this.config = config;
        this.catalog = catalog;
        this.prompter = prompter;
        this.registries = registries;
        this.factories = factories;
        this.readiness = new ExtensionReadiness();
        this.tokenCodec = new TokenCodec(Clock.systemUTC(),
                Duration.ofSeconds(ConfigDefaults.tokenTtlSeconds(config)));
        this.project = ProjectConfig.fromConfig(config);
        int hookTimeout = ConfigDefaults.hookTimeoutSeconds(config);
        this.bridge = new EventBridge(this::project, hookTimeout > 0 ? Duration.ofSeconds(hookTimeout) : null);
    }

    /**
     * Bind the listener and start serving.
     *
     * @return address and signing key of this instance, with the port actually bound
     */
    public ServerInfo start() {
        synchronized (lifecycleLock) {
            if (server != null) {
                return serverInfo;
            }
            String host = ConfigDefaults.host(config);
            int port = ConfigDefaults.port(config);
            ServerInfo pending = ServerInfo.generate(host, port);

            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();
            streamWorkers = Executors.newCachedThreadPool(new StreamThreadFactory());

            Server built = NettyServerBuilder.forAddress(new InetSocketAddress(host, port))
                    .bossEventLoopGroup(bossGroup)
                    .workerEventLoopGroup(workerGroup)
                    .channelType(NioServerSocketChannel.class)
                    .maxInboundMessageSize(ConfigDefaults.maxInboundMessageBytes(config))
                    .intercept(new AuthInterceptor(tokenCodec, () -> serverInfo))
                    .addService(new ServiceTargetStreamService(
                            registries.serviceTargets(), factories, catalog, streamWorkers).bindService())
                    .addService(new FrameworkServiceStreamService(
                            registries.frameworkServices(), factories, catalog, streamWorkers).bindService())
                    .addService(new ProvisioningStreamService(
                            registries.provisioningProviders(), factories, catalog, streamWorkers).bindService())
                    .addService(new EventStreamService(bridge, catalog, readiness, streamWorkers).bindService())
                    .addService(new PromptService(prompter, promptLock, ConfigDefaults.noPrompt(config)).bindService())
                    .build();
            // Published before start so that no accepted call sees a missing key.
            serverInfo = pending;
            try {
                built.start();
            } catch (IOException e) {
                serverInfo = null;
                shutdownResources();
                throw new IllegalStateException("Failed to bind extension host on " + host + ":" + port, e);
            }
            server = built;
            serverInfo = pending.withPort(built.getPort());
            log.info("Extension host listening on {}", serverInfo.address());
            return serverInfo;
        }
    }

    public ServerInfo serverInfo() {
        return serverInfo;
    }

    /**
     * Mint an access token for an installed extension against the running instance.
     */
    public String issueToken(String extensionId) {
        ServerInfo info = serverInfo;
        if (info == null) {
            throw new IllegalStateException("extension host is not running");
        }
        ExtensionIdentity extension = catalog.findInstalled(extensionId)
                .orElseThrow(() -> new ExtensionNotFoundException(extensionId));
        return tokenCodec.generate(extension, info);
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return server != null && !server.isShutdown();
        }
    }

    /**
     * Stop accepting calls, give open calls the configured grace period, then cancel the rest.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (server == null) {
                return;
            }
            server.shutdown();
            try {
                if (!server.awaitTermination(ConfigDefaults.shutdownGraceSeconds(config), TimeUnit.SECONDS)) {
                    log.warn("Open calls did not finish within the shutdown grace period, cancelling them");
                    server.shutdownNow();
                    server.awaitTermination(ConfigDefaults.shutdownGraceSeconds(config), TimeUnit.SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                server.shutdownNow();
            }
            server = null;
            serverInfo = null;
            shutdownResources();
            log.info("Extension host stopped");
        }
    }

    // Caller holds the lifecycle lock.
    private void shutdownResources() {
        if (streamWorkers != null) {
            streamWorkers.shutdownNow();
            streamWorkers = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
    }

    private static final class StreamThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "exthost-stream-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
