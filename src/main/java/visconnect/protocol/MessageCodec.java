package visconnect.protocol;

import visconnect.codec.CodecException;
import visconnect.codec.DomainCodec;
import visconnect.codec.WireReader;
import visconnect.codec.WireWriter;
import visconnect.domain.AmpPhaseOptions;

/**
 * Turns requests and responses into frame payloads and back.
 * <p>
 * Every message starts with its type code and the client id; the remaining
 * fields depend on the type.
 */
public final class MessageCodec {

    public static final int USERNAME_LENGTH = 64;

    private MessageCodec() {
    }

    public static byte[] encode(Request request) {
        WireWriter w = new WireWriter(64);
        w.writeInt(request.type().code());
        w.writeString(request.clientId(), ClientIds.LENGTH);
        switch (request.type()) {
            case COMPUTE_VISDATA -> {
                OptionsSelection selection = request.selection();
                w.writeInt(selection.tag());
                if (selection instanceof OptionsSelection.UseProvided provided) {
                    DomainCodec.writeOptions(w, provided.options());
                }
            }
            case SPECTRUM_MJD -> w.writeDouble(request.mjd());
            case SUPPLY_USERNAME -> w.writeString(request.username(), USERNAME_LENGTH);
            default -> {
            }
        }
        return w.toByteArray();
    }

    public static Request decodeRequest(byte[] bytes) {
        WireReader r = new WireReader(bytes);
        RequestType type = RequestType.fromCode(r.readInt());
        String clientId = r.readString(ClientIds.LENGTH);
        Request request;
        try {
            request = switch (type) {
                case COMPUTE_VISDATA -> Request.compute(clientId, readSelection(r));
                case SPECTRUM_MJD -> Request.spectrumAt(clientId, r.readDouble());
                case SUPPLY_USERNAME -> Request.username(clientId, r.readString(USERNAME_LENGTH));
                default -> Request.of(type, clientId);
            };
        } catch (CodecException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new CodecException("Invalid " + type + " request: " + e.getMessage(), e);
        }
        r.expectEnd();
        return request;
    }

    private static OptionsSelection readSelection(WireReader r) {
        int tag = r.readInt();
        if (tag == OptionsSelection.TAG_PROVIDED) {
            return OptionsSelection.provided(DomainCodec.readOptions(r));
        }
        if (tag == OptionsSelection.TAG_AUTHORITATIVE) {
            return OptionsSelection.authoritative();
        }
        throw new CodecException("Unknown options selection tag " + tag);
    }

    public static byte[] encode(Response response) {
        WireWriter w = new WireWriter();
        w.writeInt(response.type().code());
        w.writeString(response.clientId(), ClientIds.LENGTH);
        switch (response.type()) {
            case SERVERTYPE -> w.writeInt(response.serverType().code());
            case CURRENT_VISDATA, COMPUTED_VISDATA -> {
                DomainCodec.writeOptions(w, response.options());
                DomainCodec.writeVisData(w, response.visData());
            }
            case CURRENT_SPECTRUM -> {
                DomainCodec.writeOptions(w, response.options());
                DomainCodec.writeSpectrumData(w, response.spectrum());
            }
            default -> {
            }
        }
        return w.toByteArray();
    }

    public static Response decodeResponse(byte[] bytes) {
        WireReader r = new WireReader(bytes);
        ResponseType type = ResponseType.fromCode(r.readInt());
        String clientId = r.readString(ClientIds.LENGTH);
        Response response = switch (type) {
            case SERVERTYPE -> Response.serverType(clientId, ServerType.fromCode(r.readInt()));
            case CURRENT_VISDATA, COMPUTED_VISDATA -> {
                AmpPhaseOptions options = DomainCodec.readOptions(r);
                yield Response.visData(type, clientId, options, DomainCodec.readVisData(r));
            }
            case CURRENT_SPECTRUM -> {
                AmpPhaseOptions options = DomainCodec.readOptions(r);
                yield Response.spectrum(clientId, options, DomainCodec.readSpectrumData(r));
            }
            default -> Response.notice(type, clientId);
        };
        r.expectEnd();
        return response;
    }
}
