package visconnect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visconnect.codec.DumpFiles;
import visconnect.config.ConfigLoader;
import visconnect.config.DumpFormat;
import visconnect.config.ServerConfig;
import visconnect.config.ViewerConfig;
import visconnect.output.ConsoleRenderer;
import visconnect.output.DumpRenderer;
import visconnect.output.Renderer;
import visconnect.protocol.ClientIds;
import visconnect.viewer.RequestSink;
import visconnect.viewer.ViewerConnection;
import visconnect.viewer.ViewerEventLoop;
import visconnect.viewer.ViewerSession;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Interactive viewer: reads commands from standard input and shows the data
 * served by a session server, or the contents of a dump file.
 */
public class VisViewerApplication {
    private static final Logger logger = LoggerFactory.getLogger(VisViewerApplication.class);

    private final ViewerConfig config;
    private final CountDownLatch stopped = new CountDownLatch(1);

    public VisViewerApplication(ViewerConfig config) {
        this.config = config;
    }

    public void run() throws IOException, InterruptedException {
        Renderer renderer = createRenderer(config);
        String clientId = ClientIds.generate();
        ViewerConnection connection = null;
        RequestSink sink;
        if (config.isReplay()) {
            sink = request -> logger.debug("Replaying, not sending {}", request.type());
        } else {
            connection = new ViewerConnection(config.serverHost(), config.port(), ServerConfig.DEFAULT_MAX_FRAME_BYTES);
            sink = connection;
        }

        ViewerSession session = new ViewerSession(clientId, sink, renderer, config.username(),
                config.dumpFormat(), DumpRenderer::new);
        ViewerEventLoop loop = new ViewerEventLoop(session, System.out);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            loop.requestInterrupt();
            try {
                stopped.await(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));

        try {
            if (config.isReplay()) {
                session.replay(DumpFiles.read(config.inputPath()));
            } else {
                connection.connect(loop);
                session.start();
            }
            startInputThread(loop);
            loop.run();
        } finally {
            sink.close();
            renderer.close();
            stopped.countDown();
        }
    }

    private static Renderer createRenderer(ViewerConfig config) {
        if (!config.device().equalsIgnoreCase("console")) {
            logger.warn("Unknown device {}, using the console", config.device());
        }
        return new ConsoleRenderer(config.colorized());
    }

    /**
     * Feed typed lines to the loop; the end of input quits.
     */
    private static void startInputThread(ViewerEventLoop loop) {
        Thread input = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    loop.submitCommand(line);
                }
            } catch (IOException e) {
                logger.warn("Error reading commands: {}", e.getMessage());
            }
            loop.submitCommand("quit");
        }, "viewer-input");
        input.setDaemon(true);
        input.start();
    }

    /**
     * Apply command line overrides to a configuration.
     * <p>
     * {@code -c file} names a JSON configuration file and is read first;
     * {@code -s host}, {@code -p port}, {@code -u username},
     * {@code -f dumpfile}, {@code -d device}, {@code -o json|txt} and
     * {@code --no-color} override it.
     */
    static ViewerConfig parseArguments(String[] args, ConfigLoader loader) throws IOException {
        Path configFile = null;
        for (int i = 0; i < args.length - 1; i++) {
            if (args[i].equals("-c")) {
                configFile = Path.of(args[i + 1]);
            }
        }
        ViewerConfig config = loader.loadViewer(configFile);
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "-c" -> i++;
                case "-s" -> config = config.withServer(args[++i], config.port());
                case "-p" -> config = config.withServer(config.serverHost(), Integer.parseInt(args[++i]));
                case "-u" -> config = config.withUsername(args[++i]);
                case "-f" -> config = config.withInputFile(args[++i]);
                case "-d" -> config = config.withDevice(args[++i]);
                case "-o" -> config = config.withDumpFormat(parseDumpFormat(args[++i]));
                case "--no-color" -> config = config.withColorized(false);
                default -> throw new IllegalArgumentException("Unknown argument " + args[i]);
            }
        }
        return config;
    }

    private static DumpFormat parseDumpFormat(String word) {
        for (DumpFormat format : DumpFormat.values()) {
            if (format.name().equalsIgnoreCase(word) || format.extension().equalsIgnoreCase(word)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown dump format " + word);
    }

    public static void main(String[] args) {
        ViewerConfig config;
        try {
            config = parseArguments(args, new ConfigLoader());
        } catch (Exception e) {
            logger.error("Invalid configuration", e);
            System.exit(1);
            return;
        }
        try {
            new VisViewerApplication(config).run();
        } catch (IOException e) {
            logger.error("Viewer failed", e);
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
