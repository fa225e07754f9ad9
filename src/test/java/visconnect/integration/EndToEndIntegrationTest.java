package visconnect.integration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;
import visconnect.archive.ArchiveFixtures;
import visconnect.config.DumpFormat;
import visconnect.config.ServerConfig;
import visconnect.core.SessionCoordinator;
import visconnect.output.PlotModel;
import visconnect.output.Renderer;
import visconnect.processor.CycleReducer;
import visconnect.protocol.ClientIds;
import visconnect.protocol.ServerType;
import visconnect.server.SessionServer;
import visconnect.viewer.ViewerConnection;
import visconnect.viewer.ViewerEventLoop;
import visconnect.viewer.ViewerSession;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * A server and two viewers talking over loopback TCP.
 */
@Timeout(value = 30, unit = TimeUnit.SECONDS)
class EndToEndIntegrationTest {

    private static final int MAX_FRAME = 1 << 22;

    @TempDir
    Path tempDir;

    private SessionServer server;
    private final List<Viewer> viewers = new ArrayList<>();

    private final class Viewer {
        final Renderer renderer = mock(Renderer.class);
        final ByteArrayOutputStream console = new ByteArrayOutputStream();
        final ViewerConnection connection = new ViewerConnection("127.0.0.1", server.getPort(), MAX_FRAME);
        final ViewerSession session = new ViewerSession(ClientIds.generate(), connection, renderer, null,
                DumpFormat.JSON, (file, format) -> mock(Renderer.class));
        final ViewerEventLoop loop = new ViewerEventLoop(session,
                new PrintStream(console, true, StandardCharsets.UTF_8));
        final Thread thread = new Thread(loop::run, "viewer-" + session.getClientId());

        Viewer() throws InterruptedException {
            connection.connect(loop);
            thread.start();
            session.start();
        }

        void stop() throws InterruptedException {
            loop.submitCommand("quit");
            thread.join(5000);
            connection.close();
        }
    }

    @BeforeEach
    void setUp() throws Exception {
        Path archive = ArchiveFixtures.writeArchive(tempDir.resolve("e2e.vcar"), 5, 4, 60);
        ServerConfig config = new ServerConfig(0, "127.0.0.1", ServerType.SIMULATOR,
                List.of(archive.toString()), MAX_FRAME, false, 500L);
        server = new SessionServer(config, new SessionCoordinator(config.serverType(), List.of(archive),
                new CycleReducer(), config.requireUsernameForOptions()));
        server.start();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        for (Viewer viewer : viewers) {
            viewer.stop();
        }
        server.stop();
    }

    private Viewer viewer() throws InterruptedException {
        Viewer viewer = new Viewer();
        viewers.add(viewer);
        return viewer;
    }

    @Test
    @DisplayName("Should keep display choices local to the viewer that made them")
    void testLocalDisplayChanges() throws InterruptedException {
        Viewer first = viewer();
        Viewer second = viewer();
        verify(first.renderer, timeout(5000)).render(any(PlotModel.class));
        verify(second.renderer, timeout(5000)).render(any(PlotModel.class));

        first.loop.submitCommand("select aa");
        first.loop.submitCommand("array 1,2,3");
        verify(first.renderer, timeout(5000).atLeast(2)).render(any(PlotModel.class));
        verify(second.renderer, after(300).times(1)).render(any(PlotModel.class));

        first.stop();
        second.stop();
        assertThat(first.session.getDisplay().getProducts()).containsExactly("aa");
        assertThat(first.session.getDisplay().getAntennas()).containsExactlyInAnyOrder(1, 2, 3);
        assertThat(second.session.getDisplay().getProducts()).containsExactly("aa", "bb");
        assertThat(server.getCoordinator().getStatistics().getRecomputations()).isZero();
    }

    @Test
    @DisplayName("Should bring every viewer onto options changed by one of them")
    void testOptionChangePropagates() throws InterruptedException {
        Viewer first = viewer();
        Viewer second = viewer();
        verify(first.renderer, timeout(5000)).render(any(PlotModel.class));
        verify(second.renderer, timeout(5000)).render(any(PlotModel.class));
        assertThat(second.session.getServerType()).isEqualTo(ServerType.SIMULATOR);

        first.loop.submitCommand("phase rad");

        verify(first.renderer, timeout(10000).times(2)).render(any(PlotModel.class));
        verify(second.renderer, timeout(10000).times(2)).render(any(PlotModel.class));
        first.stop();
        second.stop();
        assertThat(first.session.getOptions().isPhaseInDegrees()).isFalse();
        assertThat(second.session.getOptions().isPhaseInDegrees()).isFalse();
        assertThat(second.console.toString(StandardCharsets.UTF_8)).contains("Options changed by another viewer");
        assertThat(server.getCoordinator().getSnapshot().author()).isEqualTo(first.session.getClientId());
        assertThat(server.getCoordinator().getStatistics().getBroadcasts()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should stop viewers when the server shuts down")
    void testServerShutdown() throws InterruptedException {
        Viewer viewer = viewer();
        verify(viewer.renderer, timeout(5000)).render(any(PlotModel.class));

        server.stop();
        viewer.thread.join(5000);

        assertThat(viewer.thread.isAlive()).isFalse();
        assertThat(viewer.session.isQuitRequested()).isTrue();
        assertThat(viewer.console.toString(StandardCharsets.UTF_8)).contains("Server is shutting down");
    }
}
