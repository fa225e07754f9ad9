package visconnect.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import visconnect.protocol.ServerType;

import java.nio.file.Path;
import java.util.List;

/**
 * Settings of the session server. Missing values take the defaults.
 *
 * @param port listening port, 0 for any free port
 * @param bindAddress address to listen on
 * @param serverType the type announced to viewers
 * @param archiveFiles archive files to serve, in time order
 * @param maxFrameBytes largest accepted message frame
 * @param requireUsernameForOptions whether a client must name itself before changing options
 * @param shutdownGraceMillis how long to wait for shutdown notices to be written
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ServerConfig(
        Integer port,
        String bindAddress,
        ServerType serverType,
        List<String> archiveFiles,
        Integer maxFrameBytes,
        Boolean requireUsernameForOptions,
        Long shutdownGraceMillis
) {
    public static final int DEFAULT_PORT = 8880;
    public static final int DEFAULT_MAX_FRAME_BYTES = 64 * 1024 * 1024;

    public ServerConfig {
        port = port == null ? DEFAULT_PORT : port;
        bindAddress = bindAddress == null ? "0.0.0.0" : bindAddress;
        serverType = serverType == null ? ServerType.SIMULATOR : serverType;
        archiveFiles = archiveFiles == null ? List.of() : List.copyOf(archiveFiles);
        maxFrameBytes = maxFrameBytes == null ? DEFAULT_MAX_FRAME_BYTES : maxFrameBytes;
        requireUsernameForOptions = requireUsernameForOptions == null || requireUsernameForOptions;
        shutdownGraceMillis = shutdownGraceMillis == null ? 2000L : shutdownGraceMillis;
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be positive");
        }
    }

    public static ServerConfig defaults() {
        return new ServerConfig(null, null, null, null, null, null, null);
    }

    public List<Path> archivePaths() {
        return archiveFiles.stream().map(Path::of).toList();
    }

    public ServerConfig withPort(int newPort) {
        return new ServerConfig(newPort, bindAddress, serverType, archiveFiles, maxFrameBytes,
                requireUsernameForOptions, shutdownGraceMillis);
    }

    public ServerConfig withArchiveFiles(List<String> files) {
        return new ServerConfig(port, bindAddress, serverType, files, maxFrameBytes,
                requireUsernameForOptions, shutdownGraceMillis);
    }

    public ServerConfig withServerType(ServerType type) {
        return new ServerConfig(port, bindAddress, type, archiveFiles, maxFrameBytes,
                requireUsernameForOptions, shutdownGraceMillis);
    }

    public ServerConfig withRequireUsername(boolean require) {
        return new ServerConfig(port, bindAddress, serverType, archiveFiles, maxFrameBytes,
                require, shutdownGraceMillis);
    }
}
