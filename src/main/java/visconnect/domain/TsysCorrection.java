package visconnect.domain;

/**
 * System temperature scaling applied to correlated amplitudes.
 */
public enum TsysCorrection {
    /** Leave the data as recorded, with the online scaling applied. */
    ONLINE,
    /** Remove the online scaling, giving raw correlation coefficients. */
    REVERSE_ONLINE,
    /** Replace the online scaling with the computed system temperatures. */
    COMPUTED;

    public static TsysCorrection fromCode(int code) {
        TsysCorrection[] values = values();
        if (code < 0 || code >= values.length) {
            throw new IllegalArgumentException("Unknown tsys correction code: " + code);
        }
        return values[code];
    }
}
