package visconnect.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.handler.codec.MessageToByteEncoder;
import io.netty.handler.codec.MessageToMessageDecoder;

import java.util.List;
import java.util.function.Function;

/**
 * Netty handlers for the framed message stream: every frame is a 4-byte
 * big-endian length followed by that many bytes of message tokens.
 */
public final class MessageFrames {

    public static final int LENGTH_FIELD_BYTES = 4;

    private MessageFrames() {
    }

    public static LengthFieldBasedFrameDecoder newFrameDecoder(int maxFrameBytes) {
        return new LengthFieldBasedFrameDecoder(maxFrameBytes, 0, LENGTH_FIELD_BYTES, 0, LENGTH_FIELD_BYTES);
    }

    public static LengthFieldPrepender newFramePrepender() {
        return new LengthFieldPrepender(LENGTH_FIELD_BYTES);
    }

    /**
     * Install the server side codec: requests in, responses out.
     */
    public static void configureServer(ChannelPipeline pipeline, int maxFrameBytes) {
        pipeline.addLast("frameDecoder", newFrameDecoder(maxFrameBytes));
        pipeline.addLast("framePrepender", newFramePrepender());
        pipeline.addLast("requestDecoder", new PayloadDecoder<Request>(MessageCodec::decodeRequest));
        pipeline.addLast("responseEncoder", new PayloadEncoder<Response>(Response.class, MessageCodec::encode));
    }

    /**
     * Install the viewer side codec: responses in, requests out.
     */
    public static void configureClient(ChannelPipeline pipeline, int maxFrameBytes) {
        pipeline.addLast("frameDecoder", newFrameDecoder(maxFrameBytes));
        pipeline.addLast("framePrepender", newFramePrepender());
        pipeline.addLast("responseDecoder", new PayloadDecoder<Response>(MessageCodec::decodeResponse));
        pipeline.addLast("requestEncoder", new PayloadEncoder<Request>(Request.class, MessageCodec::encode));
    }

    static final class PayloadDecoder<T> extends MessageToMessageDecoder<ByteBuf> {
        private final Function<byte[], T> decoder;

        PayloadDecoder(Function<byte[], T> decoder) {
            this.decoder = decoder;
        }

        @Override
        protected void decode(ChannelHandlerContext ctx, ByteBuf frame, List<Object> out) {
            out.add(decoder.apply(ByteBufUtil.getBytes(frame)));
        }
    }

    static final class PayloadEncoder<T> extends MessageToByteEncoder<T> {
        private final Function<T, byte[]> encoder;

        PayloadEncoder(Class<T> type, Function<T, byte[]> encoder) {
            super(type);
            this.encoder = encoder;
        }

        @Override
        protected void encode(ChannelHandlerContext ctx, T message, ByteBuf out) {
            out.writeBytes(encoder.apply(message));
        }
    }
}
