package visconnect.archive;

import visconnect.domain.AntennaPosition;
import visconnect.domain.CycleRecord;
import visconnect.domain.IfWindow;
import visconnect.domain.ScanHeader;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes block archive files. Scans are written by a header followed by
 * its cycles; {@link #close()} writes the end block.
 */
public class BlockArchiveWriter implements Closeable {

    private final DataOutputStream out;
    private boolean scanOpen;
    private boolean closed;

    public BlockArchiveWriter(Path path) throws IOException {
        this.out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(path)));
        out.write(ArchiveFormat.MAGIC);
        out.writeInt(ArchiveFormat.VERSION);
    }

    public BlockArchiveWriter writeScan(ScanHeader header) throws IOException {
        out.writeByte(ArchiveFormat.HEADER_BLOCK);
        out.writeUTF(header.obsDate());
        out.writeFloat(header.utSeconds());
        out.writeUTF(header.obsType());
        out.writeUTF(header.calCode());
        out.writeInt(header.cycleTime());
        out.writeUTF(header.sourceName());
        out.writeFloat(header.rightAscensionHours());
        out.writeFloat(header.declinationDegrees());

        out.writeInt(header.numAntennas());
        for (AntennaPosition a : header.antennas()) {
            out.writeDouble(a.x());
            out.writeDouble(a.y());
            out.writeDouble(a.z());
        }

        out.writeInt(header.numWindows());
        for (IfWindow w : header.windows()) {
            out.writeDouble(w.centreFreqMhz());
            out.writeDouble(w.bandwidthMhz());
            out.writeInt(w.numChannels());
            out.writeInt(w.sideband());
            out.writeInt(w.numStokes());
            for (String s : w.stokesNames()) {
                out.writeUTF(s);
            }
            for (String name : w.names()) {
                out.writeUTF(name);
            }
        }
        scanOpen = true;
        return this;
    }

    public BlockArchiveWriter writeCycle(CycleRecord cycle) throws IOException {
        if (!scanOpen) {
            throw new IllegalStateException("A cycle must follow a scan header");
        }
        out.writeByte(ArchiveFormat.CYCLE_BLOCK);
        out.writeFloat(cycle.utSeconds());
        out.writeInt(cycle.points().size());
        for (CycleRecord.Point p : cycle.points()) {
            out.writeInt(p.ant1());
            out.writeInt(p.ant2());
            out.writeInt(p.window());
            out.writeInt(p.bin());
            out.writeBoolean(p.flagged());
            out.writeFloat(p.u());
            out.writeFloat(p.v());
            out.writeFloat(p.w());
            out.writeInt(p.weight().length);
            for (float f : p.vis()) {
                out.writeFloat(f);
            }
            for (float f : p.weight()) {
                out.writeFloat(f);
            }
        }
        out.writeInt(cycle.systemTemperatures().size());
        for (CycleRecord.SystemTemperature t : cycle.systemTemperatures()) {
            out.writeInt(t.antenna());
            out.writeInt(t.window());
            out.writeInt(t.feed().code());
            out.writeFloat(t.online());
            out.writeFloat(t.computed());
        }
        return this;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            out.writeByte(ArchiveFormat.END_BLOCK);
        } finally {
            out.close();
        }
    }
}
