package visconnect.protocol;

import visconnect.codec.CodecException;

/**
 * Responses and notifications sent by the server.
 */
public enum ResponseType {
    CURRENT_SPECTRUM(183, false),
    CURRENT_VISDATA(184, false),
    SERVERTYPE(185, false),
    VISDATA_COMPUTED(186, false),
    COMPUTED_VISDATA(187, false),
    SHUTDOWN(188, true),
    USERNAME_REQUESTED(189, false),
    OPTIONS_CHANGED(190, true);

    private final int code;
    private final boolean broadcast;

    ResponseType(int code, boolean broadcast) {
        this.code = code;
        this.broadcast = broadcast;
    }

    public int code() {
        return code;
    }

    /**
     * Whether this response goes to every client rather than one addressee.
     */
    public boolean isBroadcast() {
        return broadcast;
    }

    public static ResponseType fromCode(int code) {
        for (ResponseType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new CodecException("Unknown response type " + code);
    }
}
