package visconnect.codec;

import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePackException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Appends MessagePack values to a growing buffer.
 * <p>
 * Floats are always written as float32 and doubles as float64. Arrays are an
 * array header followed by that many values; the element type is not
 * recorded, so readers must know the shape from the field order.
 */
public class WireWriter {
    private static final int INITIAL_CAPACITY = 4096;

    private final MessageBufferPacker packer;

    public WireWriter() {
        this(INITIAL_CAPACITY);
    }

    public WireWriter(int initialCapacity) {
        this.packer = new MessagePack.PackerConfig()
                .withBufferSize(Math.max(16, initialCapacity))
                .newBufferPacker();
    }

    public WireWriter writeBool(boolean value) {
        return pack(() -> packer.packBoolean(value));
    }

    public WireWriter writeInt(int value) {
        return pack(() -> packer.packInt(value));
    }

    public WireWriter writeFloat(float value) {
        return pack(() -> packer.packFloat(value));
    }

    public WireWriter writeDouble(double value) {
        return pack(() -> packer.packDouble(value));
    }

    /**
     * Write a fixed-capacity string: longer values are truncated, shorter ones
     * are padded with spaces up to the capacity.
     */
    public WireWriter writeString(String value, int capacity) {
        byte[] bytes = new byte[capacity];
        Arrays.fill(bytes, (byte) ' ');
        if (value != null) {
            byte[] src = value.getBytes(StandardCharsets.US_ASCII);
            System.arraycopy(src, 0, bytes, 0, Math.min(src.length, capacity));
        }
        return pack(() -> packer.packRawStringHeader(capacity).writePayload(bytes));
    }

    public WireWriter writeArrayHeader(int count) {
        if (count < 0) {
            throw new CodecException("Negative array length " + count);
        }
        return pack(() -> packer.packArrayHeader(count));
    }

    public WireWriter writeIntArray(int[] values) {
        writeArrayHeader(values.length);
        for (int v : values) {
            writeInt(v);
        }
        return this;
    }

    public WireWriter writeFloatArray(float[] values) {
        writeArrayHeader(values.length);
        for (float v : values) {
            writeFloat(v);
        }
        return this;
    }

    /**
     * Write interleaved complex values: the array holds twice the number of
     * complex values, as (real, imaginary) pairs.
     */
    public WireWriter writeComplexArray(float[] interleaved) {
        if (interleaved.length % 2 != 0) {
            throw new CodecException("Complex array has odd length " + interleaved.length);
        }
        return writeFloatArray(interleaved);
    }

    public WireWriter writeDoubleArray(double[] values) {
        writeArrayHeader(values.length);
        for (double v : values) {
            writeDouble(v);
        }
        return this;
    }

    public WireWriter writeBoolArray(boolean[] values) {
        writeArrayHeader(values.length);
        for (boolean v : values) {
            writeBool(v);
        }
        return this;
    }

    public long size() {
        return packer.getTotalWrittenBytes();
    }

    public byte[] toByteArray() {
        return packer.toByteArray();
    }

    private WireWriter pack(PackOperation operation) {
        try {
            operation.run();
        } catch (IOException | MessagePackException e) {
            throw new CodecException("Failed to encode value: " + e.getMessage(), e);
        }
        return this;
    }

    @FunctionalInterface
    private interface PackOperation {
        void run() throws IOException;
    }
}
