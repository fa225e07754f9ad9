package visconnect.viewer;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visconnect.protocol.MessageFrames;
import visconnect.protocol.Request;
import visconnect.protocol.Response;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The viewer's connection to a session server. Incoming responses and the
 * closing of the connection are handed to an event loop.
 */
public class ViewerConnection implements RequestSink {
    private static final Logger logger = LoggerFactory.getLogger(ViewerConnection.class);

    private final String host;
    private final int port;
    private final int maxFrameBytes;
    private final AtomicBoolean connected = new AtomicBoolean(false);

    private NioEventLoopGroup group;
    private Channel channel;

    public ViewerConnection(String host, int port, int maxFrameBytes) {
        this.host = Objects.requireNonNull(host, "host cannot be null");
        this.port = port;
        this.maxFrameBytes = maxFrameBytes;
    }

    /**
     * Connect and start passing responses to {@code loop}.
     *
     * @throws InterruptedException if interrupted while connecting
     */
    public void connect(ViewerEventLoop loop) throws InterruptedException {
        if (!connected.compareAndSet(false, true)) {
            return;
        }
        group = new NioEventLoopGroup(1);
        try {
            Bootstrap bootstrap = new Bootstrap()
                    .group(group)
                    .channel(NioSocketChannel.class)
                    .option(ChannelOption.TCP_NODELAY, true)
                    .handler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            MessageFrames.configureClient(ch.pipeline(), maxFrameBytes);
                            ch.pipeline().addLast("viewer", new ResponseHandler(loop));
                        }
                    });
            channel = bootstrap.connect(host, port).sync().channel();
            logger.info("Connected to session server {}:{}", host, port);
        } catch (InterruptedException | RuntimeException e) {
            connected.set(false);
            group.shutdownGracefully(0, 0, TimeUnit.MILLISECONDS);
            throw e;
        }
    }

    public boolean isConnected() {
        return connected.get() && channel != null && channel.isActive();
    }

    @Override
    public void send(Request request) {
        if (channel == null || !channel.isActive()) {
            logger.warn("Not connected, dropping {}", request.type());
            return;
        }
        logger.debug("Sending {}", request.type());
        channel.writeAndFlush(request);
    }

    @Override
    public void close() {
        if (!connected.compareAndSet(true, false)) {
            return;
        }
        if (channel != null) {
            channel.close().awaitUninterruptibly();
        }
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
        logger.info("Disconnected from session server");
    }

    private static final class ResponseHandler extends SimpleChannelInboundHandler<Response> {
        private final ViewerEventLoop loop;

        ResponseHandler(ViewerEventLoop loop) {
            this.loop = loop;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Response response) {
            loop.submitResponse(response);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            loop.submitDisconnect();
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            logger.error("Closing server connection after error", cause);
            ctx.close();
        }
    }
}
