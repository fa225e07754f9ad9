package visconnect.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visconnect.config.ServerConfig;
import visconnect.core.Delivery;
import visconnect.core.SessionCoordinator;
import visconnect.protocol.MessageFrames;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Listens for viewer connections and serves them from a single I/O thread.
 * <p>
 * Every connection shares one event loop, so requests are handled one at a
 * time in arrival order and a long reduction holds up every client until it
 * finishes.
 */
public class SessionServer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SessionServer.class);

    private final ServerConfig config;
    private final SessionCoordinator coordinator;
    private final Map<String, Channel> channels = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private NioEventLoopGroup bossGroup;
    private NioEventLoopGroup workerGroup;
    private Channel serverChannel;

    public SessionServer(ServerConfig config, SessionCoordinator coordinator) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator cannot be null");
    }

    /**
     * Start the coordinator and begin listening.
     *
     * @throws InterruptedException if interrupted while binding
     */
    public void start() throws InterruptedException {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        coordinator.start();
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(1);
        try {
            ServerBootstrap bootstrap = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .option(ChannelOption.SO_REUSEADDR, true)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            MessageFrames.configureServer(ch.pipeline(), config.maxFrameBytes());
                            ch.pipeline().addLast("session", new ServerChannelHandler(coordinator, SessionServer.this));
                        }
                    });
            serverChannel = bootstrap.bind(config.bindAddress(), config.port()).sync().channel();
            logger.info("Session server listening on {}:{}", config.bindAddress(), getPort());
        } catch (InterruptedException | RuntimeException e) {
            running.set(false);
            shutdownGroups();
            throw e;
        }
    }

    /**
     * The port actually bound, which differs from the configured one when that was 0.
     */
    public int getPort() {
        if (serverChannel == null) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Tell every viewer to quit, give the notices time to be written, then
     * close all connections and the listening socket.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        List<ChannelFuture> writes = deliver(coordinator.shutdown());
        long deadline = System.currentTimeMillis() + config.shutdownGraceMillis();
        for (ChannelFuture write : writes) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0 || !write.awaitUninterruptibly(remaining, TimeUnit.MILLISECONDS)) {
                logger.warn("Timed out writing shutdown notices");
                break;
            }
        }
        for (Channel channel : channels.values()) {
            channel.close().awaitUninterruptibly(config.shutdownGraceMillis());
        }
        if (serverChannel != null) {
            serverChannel.close().awaitUninterruptibly();
        }
        shutdownGroups();
        logger.info("Session server stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public SessionCoordinator getCoordinator() {
        return coordinator;
    }

    List<ChannelFuture> deliver(List<Delivery> deliveries) {
        List<ChannelFuture> writes = new ArrayList<>(deliveries.size());
        for (Delivery delivery : deliveries) {
            Channel channel = channels.get(delivery.connection());
            if (channel == null || !channel.isActive()) {
                logger.debug("Dropping {} for closed connection {}",
                        delivery.response().type(), delivery.connection());
                continue;
            }
            writes.add(channel.writeAndFlush(delivery.response()));
        }
        return writes;
    }

    void register(String connection, Channel channel) {
        channels.put(connection, channel);
    }

    void unregister(String connection) {
        channels.remove(connection);
    }

    static String connectionKey(Channel channel) {
        return channel.id().asLongText();
    }

    private void shutdownGroups() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, config.shutdownGraceMillis(), TimeUnit.MILLISECONDS).awaitUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, config.shutdownGraceMillis(), TimeUnit.MILLISECONDS).awaitUninterruptibly();
        }
    }
}
