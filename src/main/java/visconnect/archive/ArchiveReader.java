package visconnect.archive;

import visconnect.domain.CycleRecord;
import visconnect.domain.ScanHeader;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Sequential access to an archive file: a scan header followed by its
 * cycles, then the next header, and so on. Cycles can only be read in order.
 */
public interface ArchiveReader extends Closeable {

    Path path();

    /**
     * Advance to the next scan, skipping any unread cycles of the current one.
     *
     * @return the header, or empty at the end of the file
     * @throws IOException if the file cannot be read or is malformed
     */
    Optional<ScanHeader> nextScan() throws IOException;

    /**
     * Read the next cycle of the current scan.
     *
     * @return the cycle, or empty when the scan has no more cycles
     * @throws IOException if the file cannot be read or is malformed
     */
    Optional<CycleRecord> nextCycle() throws IOException;

    @Override
    void close() throws IOException;
}
