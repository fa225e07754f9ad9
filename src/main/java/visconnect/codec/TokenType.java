package visconnect.codec;

/**
 * Kinds of value in the wire format, with the fewest bytes MessagePack can
 * encode one in. Used to reject array counts that the remaining input could
 * not possibly hold.
 */
public enum TokenType {
    BOOLEAN(1),
    INT(1),
    FLOAT(5),
    DOUBLE(9),
    STRING(1),
    ARRAY(1);

    private final int minSize;

    TokenType(int minSize) {
        this.minSize = minSize;
    }

    int minSize() {
        return minSize;
    }
}
