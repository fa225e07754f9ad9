package visconnect.protocol;

import visconnect.codec.CodecException;

/**
 * What kind of data source a server is attached to.
 */
public enum ServerType {
    /** A live correlator. */
    CORRELATOR(1),
    /** Archive files replayed as if live. */
    SIMULATOR(2);

    private final int code;

    ServerType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ServerType fromCode(int code) {
        for (ServerType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new CodecException("Unknown server type " + code);
    }
}
