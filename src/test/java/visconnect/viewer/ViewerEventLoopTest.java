package visconnect.viewer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import visconnect.config.DumpFormat;
import visconnect.domain.AmpPhaseOptions;
import visconnect.domain.VisData;
import visconnect.output.PlotModel;
import visconnect.output.Renderer;
import visconnect.protocol.Response;
import visconnect.protocol.ResponseType;
import visconnect.protocol.ServerType;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ViewerEventLoopTest {

    private static final String CLIENT = "loopAAAAAAAAAAAAAAAA";

    private Renderer renderer;
    private ViewerSession session;
    private ByteArrayOutputStream output;
    private ViewerEventLoop loop;

    @BeforeEach
    void setUp() {
        renderer = mock(Renderer.class);
        session = new ViewerSession(CLIENT, request -> { }, renderer, null, DumpFormat.JSON,
                (file, format) -> mock(Renderer.class));
        output = new ByteArrayOutputStream();
        loop = new ViewerEventLoop(session, new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should handle queued events and print status lines")
    void testRunOnce() throws InterruptedException {
        loop.submitResponse(Response.serverType(CLIENT, ServerType.CORRELATOR));
        loop.submitCommand("wibble");

        assertThat(loop.runOnce(10)).isTrue();

        assertThat(printed()).contains("Connected to correlator server").contains("unknown command");
        assertThat(session.getServerType()).isEqualTo(ServerType.CORRELATOR);
    }

    @Test
    @DisplayName("Should return after the timeout when nothing is queued")
    void testIdle() throws InterruptedException {
        assertThat(loop.runOnce(10)).isTrue();

        assertThat(printed()).isEmpty();
        verifyNoInteractions(renderer);
    }

    @Test
    @DisplayName("Should redraw once for a resize request")
    void testResize() throws InterruptedException {
        loop.submitResponse(Response.visData(ResponseType.CURRENT_VISDATA, CLIENT, new AmpPhaseOptions(), VisData.empty()));
        loop.requestResize();

        loop.runOnce(10);
        loop.runOnce(10);

        verify(renderer, times(1)).render(any(PlotModel.class));
    }

    @Test
    @DisplayName("Should stop after an interrupt request")
    void testInterrupt() throws InterruptedException {
        loop.requestInterrupt();

        assertThat(loop.runOnce(10)).isFalse();
        assertThat(session.isQuitRequested()).isTrue();
    }

    @Test
    @DisplayName("Should report a lost connection and stop")
    void testDisconnect() throws InterruptedException {
        loop.submitDisconnect();

        assertThat(loop.runOnce(10)).isFalse();
        assertThat(printed()).contains("Connection to server lost");
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    @DisplayName("Should run on its own thread until told to quit")
    void testRun() throws InterruptedException {
        Thread thread = new Thread(loop::run, "viewer-loop-test");
        thread.start();

        loop.submitCommand("describe");
        loop.submitCommand("quit");
        thread.join();

        assertThat(session.isQuitRequested()).isTrue();
        assertThat(printed()).contains("No data");
    }
}
