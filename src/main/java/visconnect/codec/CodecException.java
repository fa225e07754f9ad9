package visconnect.codec;

/**
 * Thrown when a byte stream does not hold the structure being decoded, or a
 * value cannot be encoded. There is no resynchronisation: the connection or
 * file that produced the bytes must be abandoned.
 */
public class CodecException extends IllegalArgumentException {

    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
