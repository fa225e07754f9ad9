package visconnect.codec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visconnect.domain.AmpPhaseOptions;
import visconnect.domain.SpectrumData;
import visconnect.domain.VisData;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes flat dump files holding one reduction product and the
 * options it was computed with. A viewer started from a dump file replays
 * it instead of contacting a server.
 */
public final class DumpFiles {
    private static final Logger logger = LoggerFactory.getLogger(DumpFiles.class);

    static final String MAGIC = "VCDUMP";
    private static final int MAGIC_LENGTH = 8;

    public enum Kind {
        SPECTRUM(1),
        VISDATA(2);

        private final int code;

        Kind(int code) {
            this.code = code;
        }

        public int code() {
            return code;
        }

        static Kind fromCode(int code) {
            for (Kind kind : values()) {
                if (kind.code == code) {
                    return kind;
                }
            }
            throw new CodecException("Unknown dump kind " + code);
        }
    }

    /**
     * Contents of a dump file; exactly one of {@code spectrum} and
     * {@code visData} is set, matching {@code kind}.
     */
    public record Dump(Kind kind, AmpPhaseOptions options, SpectrumData spectrum, VisData visData) {
    }

    private DumpFiles() {
    }

    public static void writeSpectrum(Path file, SpectrumData spectrum, AmpPhaseOptions options) throws IOException {
        WireWriter writer = header(Kind.SPECTRUM, options);
        DomainCodec.writeSpectrumData(writer, spectrum);
        write(file, writer);
    }

    public static void writeVisData(Path file, VisData visData, AmpPhaseOptions options) throws IOException {
        WireWriter writer = header(Kind.VISDATA, options);
        DomainCodec.writeVisData(writer, visData);
        write(file, writer);
    }

    /**
     * Read a dump file.
     *
     * @throws IOException if the file cannot be read
     * @throws CodecException if the file is not a well-formed dump
     */
    public static Dump read(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        WireReader reader = new WireReader(bytes);
        String magic = reader.readString(MAGIC_LENGTH);
        if (!MAGIC.equals(magic)) {
            throw new CodecException(file + " is not a dump file");
        }
        Kind kind = Kind.fromCode(reader.readInt());
        AmpPhaseOptions options = DomainCodec.readOptions(reader);
        Dump dump;
        if (kind == Kind.SPECTRUM) {
            dump = new Dump(kind, options, DomainCodec.readSpectrumData(reader), null);
        } else {
            dump = new Dump(kind, options, null, DomainCodec.readVisData(reader));
        }
        reader.expectEnd();
        logger.info("Read {} dump from {} ({} bytes)", kind, file, bytes.length);
        return dump;
    }

    private static WireWriter header(Kind kind, AmpPhaseOptions options) {
        WireWriter writer = new WireWriter();
        writer.writeString(MAGIC, MAGIC_LENGTH);
        writer.writeInt(kind.code());
        DomainCodec.writeOptions(writer, options);
        return writer;
    }

    private static void write(Path file, WireWriter writer) throws IOException {
        Files.write(file, writer.toByteArray());
        logger.info("Wrote dump {} ({} bytes)", file, writer.size());
    }
}
