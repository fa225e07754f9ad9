package visconnect.server;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visconnect.core.Delivery;
import visconnect.core.SessionCoordinator;
import visconnect.protocol.Request;

import java.util.List;

/**
 * Passes decoded requests of one connection to the coordinator and writes
 * the resulting responses. Any codec or transport error closes the connection.
 */
class ServerChannelHandler extends SimpleChannelInboundHandler<Request> {
    private static final Logger logger = LoggerFactory.getLogger(ServerChannelHandler.class);

    private final SessionCoordinator coordinator;
    private final SessionServer server;

    ServerChannelHandler(SessionCoordinator coordinator, SessionServer server) {
        this.coordinator = coordinator;
        this.server = server;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        String connection = SessionServer.connectionKey(ctx.channel());
        server.register(connection, ctx.channel());
        coordinator.connect(connection);
        ctx.fireChannelActive();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Request request) {
        List<Delivery> deliveries = coordinator.handle(SessionServer.connectionKey(ctx.channel()), request);
        server.deliver(deliveries);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        String connection = SessionServer.connectionKey(ctx.channel());
        server.unregister(connection);
        coordinator.disconnect(connection);
        ctx.fireChannelInactive();
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.error("Closing connection {} after error", SessionServer.connectionKey(ctx.channel()), cause);
        ctx.close();
    }
}
