package visconnect.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import visconnect.archive.ArchiveFixtures;
import visconnect.domain.AmpPhaseOptions;
import visconnect.processor.CycleReducer;
import visconnect.protocol.OptionsSelection;
import visconnect.protocol.Request;
import visconnect.protocol.RequestType;
import visconnect.protocol.Response;
import visconnect.protocol.ResponseType;
import visconnect.protocol.ServerType;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SessionCoordinatorTest {

    @TempDir
    Path tempDir;

    private Path archive;

    @BeforeEach
    void setUp() throws IOException {
        archive = ArchiveFixtures.writeArchive(tempDir.resolve("session.vcar"), 3, 4, 60);
    }

    private SessionCoordinator started(boolean requireUsername) {
        SessionCoordinator coordinator = new SessionCoordinator(ServerType.SIMULATOR, List.of(archive),
                new CycleReducer(), requireUsername);
        coordinator.start();
        for (int i = 1; i <= 3; i++) {
            coordinator.connect("conn" + i);
        }
        return coordinator;
    }

    private static AmpPhaseOptions radians() {
        AmpPhaseOptions options = new AmpPhaseOptions();
        options.ensureWindows(ArchiveFixtures.header("src", 0).windows());
        options.setPhaseInDegrees(false);
        return options;
    }

    @Test
    @DisplayName("Should index the archive and compute default data on start")
    void testStart() {
        SessionCoordinator coordinator = started(false);

        assertThat(coordinator.isRunning()).isTrue();
        assertThat(coordinator.getIndex().numScans()).isEqualTo(3);
        assertThat(coordinator.getSnapshot().visData().numCycles()).isEqualTo(12);
        assertThat(coordinator.getSnapshot().author()).isEmpty();
        assertThat(coordinator.getSnapshot().options().isPhaseInDegrees()).isTrue();
        assertThat(coordinator.getSnapshot().options().numWindows()).isEqualTo(2);
        assertThat(coordinator.getSessions()).extracting(ClientSession::connection)
                .containsExactly("conn1", "conn2", "conn3");
    }

    @Test
    @DisplayName("Should answer server type and current data requests to the sender only")
    void testReplies() {
        SessionCoordinator coordinator = started(false);

        List<Delivery> type = coordinator.handle("conn2", Request.of(RequestType.SERVERTYPE, "client2"));
        assertThat(type).singleElement().satisfies(d -> {
            assertThat(d.connection()).isEqualTo("conn2");
            assertThat(d.response().serverType()).isEqualTo(ServerType.SIMULATOR);
            assertThat(d.response().clientId()).isEqualTo("client2");
        });

        List<Delivery> data = coordinator.handle("conn1", Request.of(RequestType.CURRENT_VISDATA, "client1"));
        assertThat(data).singleElement().satisfies(d -> {
            assertThat(d.response().type()).isEqualTo(ResponseType.CURRENT_VISDATA);
            assertThat(d.response().visData()).isEqualTo(coordinator.getSnapshot().visData());
        });
        assertThat(coordinator.getSessions().get(0).clientId()).isEqualTo("client1");
    }

    @Test
    @DisplayName("Should make the sender of new options their author and tell everyone else")
    void testOptionsOwnership() {
        SessionCoordinator coordinator = started(false);

        List<Delivery> out = coordinator.handle("conn1",
                Request.compute("client1", OptionsSelection.provided(radians())));

        assertThat(out).extracting(Delivery::connection, d -> d.response().type(), d -> d.response().clientId())
                .containsExactly(
                        tuple("conn1", ResponseType.VISDATA_COMPUTED, "client1"),
                        tuple("conn2", ResponseType.OPTIONS_CHANGED, "client1"),
                        tuple("conn3", ResponseType.OPTIONS_CHANGED, "client1"));
        Snapshot snapshot = coordinator.getSnapshot();
        assertThat(snapshot.author()).isEqualTo("client1");
        assertThat(snapshot.options().isPhaseInDegrees()).isFalse();
        assertThat(snapshot.options().numWindows()).isEqualTo(2);
        assertThat(snapshot.visData().numCycles()).isEqualTo(12);

        List<Delivery> follow = coordinator.handle("conn2",
                Request.compute("client2", OptionsSelection.authoritative()));
        assertThat(follow).singleElement().satisfies(d -> {
            assertThat(d.connection()).isEqualTo("conn2");
            assertThat(d.response().type()).isEqualTo(ResponseType.VISDATA_COMPUTED);
        });
        assertThat(coordinator.getSnapshot()).isSameAs(snapshot);

        Response fetched = coordinator.handle("conn2",
                Request.of(RequestType.COMPUTED_VISDATA, "client2")).get(0).response();
        assertThat(fetched.options()).isEqualTo(snapshot.options());
        assertThat(fetched.visData()).isEqualTo(snapshot.visData());

        assertThat(coordinator.getStatistics().getRecomputations()).isEqualTo(2);
        assertThat(coordinator.getStatistics().getBroadcasts()).isEqualTo(2);
        assertThat(coordinator.getStatistics().getRequests(RequestType.COMPUTE_VISDATA)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should hold back new options until the sender gives a username")
    void testUsernameRequired() {
        SessionCoordinator coordinator = started(true);
        Snapshot before = coordinator.getSnapshot();

        List<Delivery> asked = coordinator.handle("conn1",
                Request.compute("client1", OptionsSelection.provided(radians())));
        assertThat(asked).singleElement().satisfies(d -> {
            assertThat(d.connection()).isEqualTo("conn1");
            assertThat(d.response().type()).isEqualTo(ResponseType.USERNAME_REQUESTED);
        });
        assertThat(coordinator.getSnapshot()).isSameAs(before);

        List<Delivery> applied = coordinator.handle("conn1", Request.username("client1", "observer"));
        assertThat(applied).extracting(d -> d.response().type())
                .containsExactly(ResponseType.VISDATA_COMPUTED, ResponseType.OPTIONS_CHANGED,
                        ResponseType.OPTIONS_CHANGED);
        assertThat(coordinator.getSnapshot().author()).isEqualTo("client1");
        assertThat(coordinator.getSessions().get(0).username()).isEqualTo("observer");

        List<Delivery> again = coordinator.handle("conn1",
                Request.compute("client1", OptionsSelection.provided(new AmpPhaseOptions())));
        assertThat(again.get(0).response().type()).isEqualTo(ResponseType.VISDATA_COMPUTED);
    }

    @Test
    @DisplayName("Should serve the latest spectrum and an empty one for times outside the data")
    void testSpectra() {
        SessionCoordinator coordinator = started(false);

        Response latest = coordinator.handle("conn1",
                Request.of(RequestType.CURRENT_SPECTRUM, "client1")).get(0).response();
        assertThat(latest.type()).isEqualTo(ResponseType.CURRENT_SPECTRUM);
        assertThat(latest.spectrum().isEmpty()).isFalse();
        assertThat(latest.spectrum().header().sourceName()).isEqualTo("source2");

        double first = ArchiveFixtures.mjd(ArchiveFixtures.cycleTime(0, 1, 4, 60));
        Response atTime = coordinator.handle("conn1", Request.spectrumAt("client1", first)).get(0).response();
        assertThat(atTime.spectrum().mjd()).isCloseTo(first, within(1e-9));

        Response missing = coordinator.handle("conn1", Request.spectrumAt("client1", first + 2)).get(0).response();
        assertThat(missing.spectrum().isEmpty()).isTrue();
        assertThat(missing.options()).isEqualTo(coordinator.getSnapshot().options());
    }

    @Test
    @DisplayName("Should tell every connection to quit once on shutdown")
    void testShutdown() {
        SessionCoordinator coordinator = started(false);
        coordinator.disconnect("conn3");

        List<Delivery> out = coordinator.shutdown();

        assertThat(out).extracting(Delivery::connection).containsExactly("conn1", "conn2");
        assertThat(out).allSatisfy(d -> assertThat(d.response().type()).isEqualTo(ResponseType.SHUTDOWN));
        assertThat(coordinator.isRunning()).isFalse();
        assertThat(coordinator.shutdown()).isEmpty();
    }
}
