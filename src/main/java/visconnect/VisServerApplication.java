package visconnect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visconnect.config.ConfigLoader;
import visconnect.config.ServerConfig;
import visconnect.core.SessionCoordinator;
import visconnect.processor.CycleReducer;
import visconnect.protocol.ServerType;
import visconnect.server.SessionServer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Serves archive files to viewers until interrupted.
 */
public class VisServerApplication {
    private static final Logger logger = LoggerFactory.getLogger(VisServerApplication.class);

    private final SessionServer server;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public VisServerApplication(ServerConfig config) {
        SessionCoordinator coordinator = new SessionCoordinator(config.serverType(), config.archivePaths(),
                new CycleReducer(), config.requireUsernameForOptions());
        this.server = new SessionServer(config, coordinator);
    }

    /**
     * Start serving and block until {@link #shutdown()} is called.
     */
    public void start() {
        try {
            logger.info("Starting vis-connect session server...");
            server.start();
            logger.info("Waiting for viewers on port {}. Press Ctrl+C to stop the server", server.getPort());
            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Server interrupted");
            shutdown();
        }
    }

    /**
     * Tell every viewer to quit and stop listening.
     */
    public void shutdown() {
        logger.info("Shutting down vis-connect session server...");
        try {
            server.stop();
            SessionCoordinator.CoordinatorStatistics stats = server.getCoordinator().getStatistics();
            logger.info("Final statistics: {} requests, {} recomputations, {} broadcasts, uptime {} seconds",
                    stats.getRequestsServed(), stats.getRecomputations(), stats.getBroadcasts(),
                    stats.getUptime() / 1000);
        } catch (RuntimeException e) {
            logger.error("Error during shutdown", e);
        } finally {
            shutdownLatch.countDown();
        }
    }

    /**
     * Apply command line overrides to a configuration.
     * <p>
     * {@code -c file} names a JSON configuration file and is read first;
     * {@code -p port}, {@code -t correlator|simulator} and
     * {@code --no-username} override it, and any remaining arguments are
     * archive files.
     */
    static ServerConfig parseArguments(String[] args, ConfigLoader loader) throws IOException {
        Path configFile = null;
        for (int i = 0; i < args.length - 1; i++) {
            if (args[i].equals("-c")) {
                configFile = Path.of(args[i + 1]);
            }
        }
        ServerConfig config = loader.loadServer(configFile);
        List<String> files = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "-c" -> i++;
                case "-p" -> config = config.withPort(Integer.parseInt(args[++i]));
                case "-t" -> config = config.withServerType(ServerType.valueOf(args[++i].toUpperCase()));
                case "--no-username" -> config = config.withRequireUsername(false);
                default -> files.add(args[i]);
            }
        }
        if (!files.isEmpty()) {
            config = config.withArchiveFiles(files);
        }
        return config;
    }

    public static void main(String[] args) {
        ServerConfig config;
        try {
            config = parseArguments(args, new ConfigLoader());
        } catch (Exception e) {
            logger.error("Invalid configuration", e);
            System.exit(1);
            return;
        }
        logger.info("Configuration:");
        logger.info("  Port: {}", config.port());
        logger.info("  Server type: {}", config.serverType());
        logger.info("  Archive files: {}", config.archiveFiles());

        VisServerApplication app = new VisServerApplication(config);
        Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown));
        app.start();
    }
}
