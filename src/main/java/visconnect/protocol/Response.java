package visconnect.protocol;

import visconnect.domain.AmpPhaseOptions;
import visconnect.domain.SpectrumData;
import visconnect.domain.VisData;

import java.util.Objects;

/**
 * A message from the server to one or all viewers.
 * <p>
 * {@code clientId} names the addressee. For broadcasts it names the client
 * that caused the broadcast, or is empty when the server itself did.
 */
public record Response(ResponseType type, String clientId, ServerType serverType, AmpPhaseOptions options,
                       VisData visData, SpectrumData spectrum) {

    public Response {
        Objects.requireNonNull(type, "type cannot be null");
        clientId = clientId == null ? "" : clientId;
        switch (type) {
            case SERVERTYPE -> Objects.requireNonNull(serverType, "serverType cannot be null");
            case CURRENT_VISDATA, COMPUTED_VISDATA -> {
                Objects.requireNonNull(options, "options cannot be null");
                Objects.requireNonNull(visData, "visData cannot be null");
            }
            case CURRENT_SPECTRUM -> {
                Objects.requireNonNull(options, "options cannot be null");
                Objects.requireNonNull(spectrum, "spectrum cannot be null");
            }
            default -> {
            }
        }
    }

    public static Response notice(ResponseType type, String clientId) {
        return new Response(type, clientId, null, null, null, null);
    }

    public static Response serverType(String clientId, ServerType serverType) {
        return new Response(ResponseType.SERVERTYPE, clientId, serverType, null, null, null);
    }

    public static Response visData(ResponseType type, String clientId, AmpPhaseOptions options, VisData data) {
        return new Response(type, clientId, null, options, data, null);
    }

    public static Response spectrum(String clientId, AmpPhaseOptions options, SpectrumData spectrum) {
        return new Response(ResponseType.CURRENT_SPECTRUM, clientId, null, options, null, spectrum);
    }

    /**
     * Whether a client with the given id should act on this response.
     */
    public boolean isFor(String id) {
        return type.isBroadcast() || clientId.equals(id);
    }
}
