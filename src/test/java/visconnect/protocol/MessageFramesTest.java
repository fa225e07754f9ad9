package visconnect.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.TooLongFrameException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class MessageFramesTest {

    private static final String CLIENT = "01234567890123456789";

    private static ByteBuf framed(byte[] payload) {
        ByteBuf buf = Unpooled.buffer();
        buf.writeInt(payload.length);
        buf.writeBytes(payload);
        return buf;
    }

    private static ByteBuf drainOutbound(EmbeddedChannel channel) {
        ByteBuf all = Unpooled.buffer();
        ByteBuf next;
        while ((next = channel.readOutbound()) != null) {
            all.writeBytes(next);
            next.release();
        }
        return all;
    }

    @Test
    @DisplayName("Should decode requests split across reads on the server side")
    void testServerDecodesSplitFrames() {
        EmbeddedChannel channel = new EmbeddedChannel();
        MessageFrames.configureServer(channel.pipeline(), 1024);
        Request request = Request.spectrumAt(CLIENT, 60431.5);
        ByteBuf frame = framed(MessageCodec.encode(request));

        channel.writeInbound(frame.readRetainedSlice(6));
        assertThat((Object) channel.readInbound()).isNull();
        channel.writeInbound(frame);

        assertThat((Object) channel.readInbound()).isEqualTo(request);
        channel.finishAndReleaseAll();
    }

    @Test
    @DisplayName("Should prefix encoded responses with their length")
    void testServerEncodesResponses() {
        EmbeddedChannel channel = new EmbeddedChannel();
        MessageFrames.configureServer(channel.pipeline(), 1024);
        Response response = Response.serverType(CLIENT, ServerType.SIMULATOR);

        channel.writeOutbound(response);

        ByteBuf out = drainOutbound(channel);
        byte[] payload = MessageCodec.encode(response);
        assertThat(out.readInt()).isEqualTo(payload.length);
        byte[] body = new byte[out.readableBytes()];
        out.readBytes(body);
        assertThat(MessageCodec.decodeResponse(body)).isEqualTo(response);
        out.release();
        channel.finishAndReleaseAll();
    }

    @Test
    @DisplayName("Should decode responses and encode requests on the viewer side")
    void testClientPipeline() {
        EmbeddedChannel channel = new EmbeddedChannel();
        MessageFrames.configureClient(channel.pipeline(), 1024);
        Response response = Response.notice(ResponseType.OPTIONS_CHANGED, CLIENT);

        channel.writeInbound(framed(MessageCodec.encode(response)));
        assertThat((Object) channel.readInbound()).isEqualTo(response);

        channel.writeOutbound(Request.of(RequestType.SERVERTYPE, CLIENT));
        ByteBuf out = drainOutbound(channel);
        assertThat(out.readInt()).isEqualTo(out.readableBytes());
        out.release();
        channel.finishAndReleaseAll();
    }

    @Test
    @DisplayName("Should refuse frames longer than the configured maximum")
    void testOversizedFrame() {
        EmbeddedChannel channel = new EmbeddedChannel();
        MessageFrames.configureServer(channel.pipeline(), 64);
        ByteBuf frame = Unpooled.buffer();
        frame.writeInt(1000);
        frame.writeZero(100);

        assertThatThrownBy(() -> channel.writeInbound(frame)).isInstanceOf(TooLongFrameException.class);
        channel.finishAndReleaseAll();
    }
}
