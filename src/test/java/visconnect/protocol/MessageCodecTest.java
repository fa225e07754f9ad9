package visconnect.protocol;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import visconnect.archive.ArchiveFixtures;
import visconnect.codec.CodecException;
import visconnect.codec.WireWriter;
import visconnect.domain.AmpPhaseOptions;
import visconnect.domain.SpectrumData;
import visconnect.domain.VisData;
import visconnect.processor.CycleReducer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class MessageCodecTest {

    private static final String CLIENT = "AbCdEfGhIjKlMnOpQrSt";

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should round trip every kind of request")
    void testRequests() {
        AmpPhaseOptions options = new AmpPhaseOptions();
        options.ensureWindows(ArchiveFixtures.header("src", 0).windows());
        options.setPhaseInDegrees(false);

        List<Request> requests = List.of(
                Request.of(RequestType.SERVERTYPE, CLIENT),
                Request.of(RequestType.CURRENT_VISDATA, CLIENT),
                Request.of(RequestType.COMPUTED_VISDATA, CLIENT),
                Request.of(RequestType.CURRENT_SPECTRUM, CLIENT),
                Request.spectrumAt(CLIENT, 60431.0417),
                Request.username(CLIENT, "observer"),
                Request.compute(CLIENT, OptionsSelection.provided(options)),
                Request.compute(CLIENT, OptionsSelection.authoritative()));

        for (Request request : requests) {
            assertThat(MessageCodec.decodeRequest(MessageCodec.encode(request)))
                    .as(request.type().name())
                    .isEqualTo(request);
        }
    }

    @Test
    @DisplayName("Should round trip notices and data responses")
    void testResponses() throws IOException {
        Path archive = ArchiveFixtures.writeArchive(tempDir.resolve("r.vcar"), 1, 2, 0);
        AmpPhaseOptions options = new AmpPhaseOptions();
        CycleReducer reducer = new CycleReducer();
        VisData data = reducer.computeVisData(List.of(archive), options);
        SpectrumData spectrum = reducer.grabSpectrum(List.of(archive), null,
                ArchiveFixtures.mjd(ArchiveFixtures.cycleTime(0, 1, 2, 0)), options);

        List<Response> responses = List.of(
                Response.serverType(CLIENT, ServerType.SIMULATOR),
                Response.notice(ResponseType.VISDATA_COMPUTED, CLIENT),
                Response.notice(ResponseType.USERNAME_REQUESTED, CLIENT),
                Response.notice(ResponseType.OPTIONS_CHANGED, CLIENT),
                Response.notice(ResponseType.SHUTDOWN, ""),
                Response.visData(ResponseType.CURRENT_VISDATA, CLIENT, options, data),
                Response.visData(ResponseType.COMPUTED_VISDATA, CLIENT, options, VisData.empty()),
                Response.spectrum(CLIENT, options, spectrum),
                Response.spectrum(CLIENT, options, SpectrumData.empty()));

        for (Response response : responses) {
            assertThat(MessageCodec.decodeResponse(MessageCodec.encode(response)))
                    .as(response.type().name())
                    .isEqualTo(response);
        }
    }

    @Test
    @DisplayName("Should reject unknown message codes and selection tags")
    void testUnknownCodes() {
        byte[] unknownRequest = new WireWriter().writeInt(99).writeString(CLIENT, ClientIds.LENGTH).toByteArray();
        assertThatThrownBy(() -> MessageCodec.decodeRequest(unknownRequest))
                .isInstanceOf(CodecException.class)
                .hasMessageContaining("Unknown request type 99");

        byte[] unknownResponse = new WireWriter().writeInt(7).writeString(CLIENT, ClientIds.LENGTH).toByteArray();
        assertThatThrownBy(() -> MessageCodec.decodeResponse(unknownResponse))
                .isInstanceOf(CodecException.class)
                .hasMessageContaining("Unknown response type 7");

        byte[] badTag = new WireWriter()
                .writeInt(RequestType.COMPUTE_VISDATA.code())
                .writeString(CLIENT, ClientIds.LENGTH)
                .writeInt(5)
                .toByteArray();
        assertThatThrownBy(() -> MessageCodec.decodeRequest(badTag))
                .isInstanceOf(CodecException.class)
                .hasMessageContaining("selection tag 5");
    }

    @Test
    @DisplayName("Should reject a username request without a username")
    void testBlankUsername() {
        byte[] blank = new WireWriter()
                .writeInt(RequestType.SUPPLY_USERNAME.code())
                .writeString(CLIENT, ClientIds.LENGTH)
                .writeString("", MessageCodec.USERNAME_LENGTH)
                .toByteArray();

        assertThatThrownBy(() -> MessageCodec.decodeRequest(blank))
                .isInstanceOf(CodecException.class)
                .hasMessageContaining("SUPPLY_USERNAME");
    }

    @Test
    @DisplayName("Should deliver broadcasts to everyone and replies only to their addressee")
    void testAddressing() {
        assertThat(Response.notice(ResponseType.OPTIONS_CHANGED, "other").isFor(CLIENT)).isTrue();
        assertThat(Response.notice(ResponseType.SHUTDOWN, "").isFor(CLIENT)).isTrue();
        assertThat(Response.notice(ResponseType.VISDATA_COMPUTED, "other").isFor(CLIENT)).isFalse();
        assertThat(Response.notice(ResponseType.VISDATA_COMPUTED, CLIENT).isFor(CLIENT)).isTrue();
    }

    @Test
    @DisplayName("Should generate distinct printable client ids of fixed length")
    void testClientIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            String id = ClientIds.generate();
            assertThat(id).hasSize(ClientIds.LENGTH).matches("[A-Za-z0-9]+");
            ids.add(id);
        }
        assertThat(ids).hasSize(100);
    }
}
