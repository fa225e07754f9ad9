package visconnect.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.nio.file.Path;

/**
 * Settings of a viewer. Missing values take the defaults.
 *
 * @param serverHost host of the session server
 * @param port port of the session server
 * @param username name sent when the server asks for one; null to prompt
 * @param inputFile a dump file to replay instead of connecting, or null
 * @param device output device name
 * @param dumpFormat format written by the {@code dump} command
 * @param colorized whether console output uses ANSI colours
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ViewerConfig(
        String serverHost,
        Integer port,
        String username,
        String inputFile,
        String device,
        DumpFormat dumpFormat,
        Boolean colorized
) {
    public ViewerConfig {
        serverHost = serverHost == null ? "localhost" : serverHost;
        port = port == null ? ServerConfig.DEFAULT_PORT : port;
        device = device == null ? "console" : device;
        dumpFormat = dumpFormat == null ? DumpFormat.JSON : dumpFormat;
        colorized = colorized == null || colorized;
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
    }

    public static ViewerConfig defaults() {
        return new ViewerConfig(null, null, null, null, null, null, null);
    }

    public boolean isReplay() {
        return inputFile != null;
    }

    public Path inputPath() {
        return inputFile == null ? null : Path.of(inputFile);
    }

    public ViewerConfig withServer(String host, int newPort) {
        return new ViewerConfig(host, newPort, username, inputFile, device, dumpFormat, colorized);
    }

    public ViewerConfig withUsername(String name) {
        return new ViewerConfig(serverHost, port, name, inputFile, device, dumpFormat, colorized);
    }

    public ViewerConfig withInputFile(String file) {
        return new ViewerConfig(serverHost, port, username, file, device, dumpFormat, colorized);
    }

    public ViewerConfig withDevice(String name) {
        return new ViewerConfig(serverHost, port, username, inputFile, name, dumpFormat, colorized);
    }

    public ViewerConfig withDumpFormat(DumpFormat format) {
        return new ViewerConfig(serverHost, port, username, inputFile, device, format, colorized);
    }

    public ViewerConfig withColorized(boolean colour) {
        return new ViewerConfig(serverHost, port, username, inputFile, device, dumpFormat, colour);
    }
}
