package visconnect.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads configuration records from JSON files. Unknown properties are
 * ignored and missing ones take their defaults.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    private final ObjectMapper objectMapper;

    public ConfigLoader() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ServerConfig loadServer(Path file) throws IOException {
        if (file == null || !Files.exists(file)) {
            logger.debug("No server configuration file, using defaults");
            return ServerConfig.defaults();
        }
        ServerConfig config = objectMapper.readValue(file.toFile(), ServerConfig.class);
        logger.info("Loaded server configuration from {}", file);
        return config;
    }

    public ViewerConfig loadViewer(Path file) throws IOException {
        if (file == null || !Files.exists(file)) {
            logger.debug("No viewer configuration file, using defaults");
            return ViewerConfig.defaults();
        }
        ViewerConfig config = objectMapper.readValue(file.toFile(), ViewerConfig.class);
        logger.info("Loaded viewer configuration from {}", file);
        return config;
    }

    public ServerConfig parseServer(String json) throws IOException {
        return objectMapper.readValue(json, ServerConfig.class);
    }

    public ViewerConfig parseViewer(String json) throws IOException {
        return objectMapper.readValue(json, ViewerConfig.class);
    }
}
