package visconnect.protocol;

import visconnect.codec.CodecException;

/**
 * Requests a viewer can send to the server.
 */
public enum RequestType {
    CURRENT_SPECTRUM(1),
    CURRENT_VISDATA(2),
    COMPUTE_VISDATA(3),
    COMPUTED_VISDATA(4),
    SERVERTYPE(5),
    SPECTRUM_MJD(6),
    SUPPLY_USERNAME(7);

    private final int code;

    RequestType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static RequestType fromCode(int code) {
        for (RequestType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new CodecException("Unknown request type " + code);
    }
}
