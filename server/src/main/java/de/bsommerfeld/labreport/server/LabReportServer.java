package de.bsommerfeld.labreport.server;

import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import com.google.inject.Singleton;
import de.bsommerfeld.labreport.core.config.ApplicationMode;
import de.bsommerfeld.labreport.core.config.ConfigLoader;
import de.bsommerfeld.labreport.core.config.ServerConfig;
import de.bsommerfeld.labreport.core.util.StoragePaths;
import de.bsommerfeld.labreport.server.http.HttpServerInitializer;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Process entry point. Builds the injector, binds the Netty server and
 * blocks until the server channel closes.
 */
@Singleton
public class LabReportServer {

    static {
        // Initialize Logging Directory via StoragePaths
        Path logDir = StoragePaths.getLogsDir(ConfigLoader.APP_NAME);
        try {
            if (!Files.exists(logDir)) {
                Files.createDirectories(logDir);
            }
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (Exception e) {
            System.err.println("Failed to create log directory: " + logDir);
            e.printStackTrace();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(LabReportServer.class);

    private final ServerConfig config;
    private final HttpServerInitializer initializer;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    @Inject
    public LabReportServer(ServerConfig config, HttpServerInitializer initializer) {
        this.config = config;
        this.initializer = initializer;
    }

    public static void main(String[] args) throws InterruptedException {
        LOG.info("Initializing...");
        Injector injector = Guice.createInjector(new ServerModule(ConfigLoader.load(), ApplicationMode.fromArgs(args)));
        LabReportServer server = injector.getInstance(LabReportServer.class);
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "labreport-shutdown"));
        server.start();
        server.awaitTermination();
    }

    /**
     * Binds the configured host and port.
     *
     * @throws InterruptedException if interrupted while binding
     */
    public synchronized void start() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(config.getBossThreads());
        workerGroup = new NioEventLoopGroup(config.getWorkerThreads());

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(initializer)
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.SO_KEEPALIVE, true);
        try {
            serverChannel = bootstrap.bind(config.getHost(), config.getPort()).sync().channel();
        } catch (Exception e) {
            LOG.error("Failed to bind {}:{}", config.getHost(), config.getPort(), e);
            stop();
            throw e;
        }
        LOG.info("Listening on http://{}:{} (realtime at ws://{}:{}{})", config.getHost(), config.getPort(),
                config.getHost(), config.getPort(), HttpServerInitializer.WEBSOCKET_PATH);
    }

    public void awaitTermination() throws InterruptedException {
        Channel channel;
        synchronized (this) {
            channel = serverChannel;
        }
        if (channel != null) {
            channel.closeFuture().sync();
        }
    }

    public synchronized void stop() {
        if (serverChannel != null) {
            serverChannel.close();
            serverChannel = null;
        }
        shutdown(bossGroup);
        shutdown(workerGroup);
        if (!initializer.handlerGroup().isShuttingDown()) {
            initializer.handlerGroup().shutdownGracefully();
        }
        LOG.info("Server stopped.");
    }

    private static void shutdown(EventLoopGroup group) {
        if (group != null && !group.isShuttingDown() && !group.isShutdown()) {
            group.shutdownGracefully();
        }
    }
}
