package visconnect.domain;

/**
 * Correlation products recorded by the correlator, with the numeric codes
 * used on the wire.
 */
public enum Polarisation {
    X(1, "X "),
    Y(2, "Y "),
    XX(3, "XX"),
    YY(4, "YY"),
    XY(5, "XY"),
    YX(6, "YX");

    private final int code;
    private final String label;

    Polarisation(int code, String label) {
        this.code = code;
        this.label = label;
    }

    public int code() {
        return code;
    }

    public String label() {
        return label;
    }

    /**
     * Polarisation of the first antenna of a baseline for this product.
     */
    public Polarisation firstFeed() {
        return switch (this) {
            case XX, XY, X -> X;
            case YY, YX, Y -> Y;
        };
    }

    /**
     * Polarisation of the second antenna of a baseline for this product.
     */
    public Polarisation secondFeed() {
        return switch (this) {
            case XX, YX, X -> X;
            case YY, XY, Y -> Y;
        };
    }

    public static Polarisation fromCode(int code) {
        for (Polarisation p : values()) {
            if (p.code == code) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown polarisation code: " + code);
    }

    /**
     * Match a two character stokes label as stored in the archive ("XX", "X ").
     *
     * @return the polarisation or null if the label is not recognised
     */
    public static Polarisation fromLabel(String label) {
        if (label == null || label.isEmpty()) {
            return null;
        }
        String padded = label.length() == 1 ? label + " " : label.substring(0, 2);
        for (Polarisation p : values()) {
            if (p.label.equalsIgnoreCase(padded)) {
                return p;
            }
        }
        return null;
    }
}
