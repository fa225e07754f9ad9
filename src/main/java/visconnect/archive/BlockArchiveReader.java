package visconnect.archive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visconnect.domain.AntennaPosition;
import visconnect.domain.CycleRecord;
import visconnect.domain.IfWindow;
import visconnect.domain.Polarisation;
import visconnect.domain.ScanHeader;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Reads the block archive format written by {@link BlockArchiveWriter}.
 */
public class BlockArchiveReader implements ArchiveReader {
    private static final Logger logger = LoggerFactory.getLogger(BlockArchiveReader.class);

    private static final int MAX_ELEMENTS = 1 << 24;

    private final Path path;
    private final DataInputStream in;
    private int nextTag = -1;
    private ScanHeader currentHeader;

    BlockArchiveReader(Path path, DataInputStream in) {
        this.path = path;
        this.in = in;
    }

    /**
     * Open a file and check its magic and version.
     *
     * @throws IOException if the file cannot be opened or is not a block archive
     */
    public static BlockArchiveReader open(Path path) throws IOException {
        DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(path)));
        try {
            byte[] magic = new byte[ArchiveFormat.MAGIC.length];
            in.readFully(magic);
            if (!Arrays.equals(magic, ArchiveFormat.MAGIC)) {
                throw new IOException(path + " is not a block archive");
            }
            int version = in.readInt();
            if (version != ArchiveFormat.VERSION) {
                throw new IOException(path + " has unsupported archive version " + version);
            }
        } catch (IOException e) {
            in.close();
            throw e;
        }
        logger.debug("Opened archive {}", path);
        return new BlockArchiveReader(path, in);
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public Optional<ScanHeader> nextScan() throws IOException {
        while (true) {
            int tag = peekTag();
            if (tag == ArchiveFormat.END_BLOCK) {
                currentHeader = null;
                return Optional.empty();
            }
            nextTag = -1;
            if (tag == ArchiveFormat.HEADER_BLOCK) {
                currentHeader = readHeader();
                return Optional.of(currentHeader);
            }
            if (tag == ArchiveFormat.CYCLE_BLOCK) {
                readCycle();
                continue;
            }
            throw new IOException(String.format("Unknown block tag 0x%02X in %s", tag, path));
        }
    }

    @Override
    public Optional<CycleRecord> nextCycle() throws IOException {
        if (currentHeader == null) {
            return Optional.empty();
        }
        int tag = peekTag();
        if (tag != ArchiveFormat.CYCLE_BLOCK) {
            return Optional.empty();
        }
        nextTag = -1;
        return Optional.of(readCycle());
    }

    @Override
    public void close() throws IOException {
        in.close();
    }

    private int peekTag() throws IOException {
        if (nextTag < 0) {
            try {
                nextTag = in.readUnsignedByte();
            } catch (EOFException e) {
                // A file cut short reads as ended.
                logger.warn("Archive {} ends without an end block", path);
                nextTag = ArchiveFormat.END_BLOCK;
            }
        }
        return nextTag;
    }

    private ScanHeader readHeader() throws IOException {
        String obsDate = in.readUTF();
        float ut = in.readFloat();
        String obsType = in.readUTF();
        String calCode = in.readUTF();
        int cycleTime = in.readInt();
        String source = in.readUTF();
        float ra = in.readFloat();
        float dec = in.readFloat();

        int nant = readCount("antenna");
        List<AntennaPosition> antennas = new ArrayList<>(nant);
        for (int i = 0; i < nant; i++) {
            antennas.add(new AntennaPosition(in.readDouble(), in.readDouble(), in.readDouble()));
        }

        int nwin = readCount("window");
        List<IfWindow> windows = new ArrayList<>(nwin);
        for (int i = 0; i < nwin; i++) {
            double centre = in.readDouble();
            double bandwidth = in.readDouble();
            int nchan = in.readInt();
            int sideband = in.readInt();
            int nstokes = readCount("stokes");
            List<String> stokes = new ArrayList<>(nstokes);
            for (int s = 0; s < nstokes; s++) {
                stokes.add(in.readUTF());
            }
            List<String> names = new ArrayList<>(IfWindow.NUM_NAMES);
            for (int n = 0; n < IfWindow.NUM_NAMES; n++) {
                names.add(in.readUTF());
            }
            windows.add(validated(() -> new IfWindow(centre, bandwidth, nchan, sideband, stokes, names)));
        }
        return validated(() -> new ScanHeader(obsDate, ut, obsType, calCode, cycleTime, source, ra, dec,
                antennas, windows));
    }

    private CycleRecord readCycle() throws IOException {
        float ut = in.readFloat();
        int npoints = readCount("point");
        List<CycleRecord.Point> points = new ArrayList<>(npoints);
        for (int i = 0; i < npoints; i++) {
            int ant1 = in.readInt();
            int ant2 = in.readInt();
            int window = in.readInt();
            int bin = in.readInt();
            boolean flagged = in.readBoolean();
            float u = in.readFloat();
            float v = in.readFloat();
            float w = in.readFloat();
            int nsamples = readCount("sample");
            float[] vis = new float[2 * nsamples];
            for (int k = 0; k < vis.length; k++) {
                vis[k] = in.readFloat();
            }
            float[] weight = new float[nsamples];
            for (int k = 0; k < nsamples; k++) {
                weight[k] = in.readFloat();
            }
            points.add(new CycleRecord.Point(ant1, ant2, window, bin, flagged, u, v, w, vis, weight));
        }
        int ntsys = readCount("system temperature");
        List<CycleRecord.SystemTemperature> tsys = new ArrayList<>(ntsys);
        for (int i = 0; i < ntsys; i++) {
            int antenna = in.readInt();
            int window = in.readInt();
            int feedCode = in.readInt();
            Polarisation feed = validated(() -> Polarisation.fromCode(feedCode));
            tsys.add(new CycleRecord.SystemTemperature(antenna, window, feed, in.readFloat(), in.readFloat()));
        }
        return new CycleRecord(ut, points, tsys);
    }

    private int readCount(String what) throws IOException {
        int count = in.readInt();
        if (count < 0 || count > MAX_ELEMENTS) {
            throw new IOException("Implausible " + what + " count " + count + " in " + path);
        }
        return count;
    }

    private <T> T validated(Supplier<T> constructor) throws IOException {
        try {
            return constructor.get();
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed record in " + path + ": " + e.getMessage(), e);
        }
    }
}
