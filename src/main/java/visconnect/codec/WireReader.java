package visconnect.codec;

import org.msgpack.core.MessageFormat;
import org.msgpack.core.MessageInsufficientBufferException;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePackException;
import org.msgpack.core.MessageUnpacker;
import org.msgpack.value.ValueType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Reads MessagePack values written by {@link WireWriter}.
 * <p>
 * Every read checks the type of the next value before consuming it, and
 * array counts are checked against the bytes left before any storage is
 * allocated. Unpacker failures surface as {@link CodecException}. Decoded
 * values never share storage with the input.
 */
public class WireReader {

    private final byte[] data;
    private final int offset;
    private final int length;
    private final MessageUnpacker unpacker;

    public WireReader(byte[] data) {
        this(data, 0, data.length);
    }

    public WireReader(byte[] data, int offset, int length) {
        this.data = data;
        this.offset = offset;
        this.length = length;
        this.unpacker = MessagePack.newDefaultUnpacker(data, offset, length);
    }

    public boolean readBool() {
        return unpack("boolean", ValueType.BOOLEAN, unpacker::unpackBoolean);
    }

    public int readInt() {
        return unpack("int", ValueType.INTEGER, unpacker::unpackInt);
    }

    public float readFloat() {
        return unpack("float", ValueType.FLOAT, unpacker::unpackFloat);
    }

    public double readDouble() {
        return unpack("double", ValueType.FLOAT, unpacker::unpackDouble);
    }

    /**
     * Read a fixed-capacity string, cutting it at the first NUL and removing
     * the trailing space padding.
     */
    public String readString(int capacity) {
        int size = unpack("string", ValueType.STRING, unpacker::unpackRawStringHeader);
        if (size > capacity) {
            throw new CodecException("String length " + size + " exceeds capacity " + capacity);
        }
        require(size, "string body");
        byte[] bytes = unpack("string body", null, () -> unpacker.readPayload(size));
        int end = 0;
        while (end < size && bytes[end] != 0) {
            end++;
        }
        while (end > 0 && bytes[end - 1] == ' ') {
            end--;
        }
        return new String(bytes, 0, end, StandardCharsets.US_ASCII);
    }

    /**
     * Read an array header, checking that enough bytes remain for that many
     * values of the expected element type.
     */
    public int readArrayHeader(TokenType elementType) {
        int count = unpack("array", ValueType.ARRAY, unpacker::unpackArrayHeader);
        long needed = (long) count * elementType.minSize();
        if (needed > remaining()) {
            throw new CodecException("Array declares " + count + " elements but only "
                    + remaining() + " bytes remain");
        }
        return count;
    }

    public int[] readIntArray() {
        int[] values = new int[readArrayHeader(TokenType.INT)];
        for (int i = 0; i < values.length; i++) {
            values[i] = readInt();
        }
        return values;
    }

    public int[] readIntArray(int expectedLength) {
        int[] values = readIntArray();
        checkLength(values.length, expectedLength);
        return values;
    }

    public float[] readFloatArray() {
        float[] values = new float[readArrayHeader(TokenType.FLOAT)];
        for (int i = 0; i < values.length; i++) {
            values[i] = readFloat();
        }
        return values;
    }

    public float[] readFloatArray(int expectedLength) {
        float[] values = readFloatArray();
        checkLength(values.length, expectedLength);
        return values;
    }

    /**
     * Read interleaved complex values for a known number of channels.
     */
    public float[] readComplexArray(int expectedComplexValues) {
        return readFloatArray(2 * expectedComplexValues);
    }

    public double[] readDoubleArray() {
        double[] values = new double[readArrayHeader(TokenType.DOUBLE)];
        for (int i = 0; i < values.length; i++) {
            values[i] = readDouble();
        }
        return values;
    }

    public double[] readDoubleArray(int expectedLength) {
        double[] values = readDoubleArray();
        checkLength(values.length, expectedLength);
        return values;
    }

    public boolean[] readBoolArray(int expectedLength) {
        boolean[] values = new boolean[readArrayHeader(TokenType.BOOLEAN)];
        checkLength(values.length, expectedLength);
        for (int i = 0; i < values.length; i++) {
            values[i] = readBool();
        }
        return values;
    }

    public int remaining() {
        return length - position();
    }

    /**
     * Fail if any bytes are left after a complete structure.
     */
    public void expectEnd() {
        if (remaining() > 0) {
            throw new CodecException(remaining() + " unexpected trailing bytes");
        }
    }

    private int position() {
        return (int) unpacker.getTotalReadBytes();
    }

    private void checkLength(int actual, int expected) {
        if (actual != expected) {
            throw new CodecException("Array length " + actual + " does not match expected " + expected);
        }
    }

    private void require(int bytes, String what) {
        if (remaining() < bytes) {
            throw new CodecException("Truncated " + what + " at offset " + position()
                    + ": need " + bytes + " bytes, " + remaining() + " available");
        }
    }

    /**
     * Check the next value is of the expected type, if one is given, then unpack it.
     */
    private <T> T unpack(String what, ValueType expected, UnpackOperation<T> operation) {
        int start = position();
        try {
            if (expected != null) {
                require(1, what);
                MessageFormat format = unpacker.getNextFormat();
                if (format.getValueType() != expected) {
                    throw new CodecException(String.format("Expected %s value at offset %d, found marker 0x%02X",
                            what, start, data[offset + start] & 0xFF));
                }
            }
            return operation.run();
        } catch (MessageInsufficientBufferException e) {
            throw new CodecException("Truncated " + what + " at offset " + start, e);
        } catch (MessagePackException | IOException e) {
            throw new CodecException("Malformed " + what + " at offset " + start + ": " + e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface UnpackOperation<T> {
        T run() throws IOException;
    }
}
