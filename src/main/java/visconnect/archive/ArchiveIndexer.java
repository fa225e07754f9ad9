package visconnect.archive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visconnect.domain.CycleRecord;
import visconnect.domain.ScanHeader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a time index of archive files by reading each file once.
 * <p>
 * The format only exposes time through sequential reads, so every cycle of
 * every scan is visited to find each scan's last cycle time. A file that
 * cannot be read is logged and left out of the index.
 */
public class ArchiveIndexer {
    private static final Logger logger = LoggerFactory.getLogger(ArchiveIndexer.class);

    private final ArchiveReaderFactory readers;

    public ArchiveIndexer() {
        this(ArchiveReaderFactory.blockFiles());
    }

    public ArchiveIndexer(ArchiveReaderFactory readers) {
        this.readers = Objects.requireNonNull(readers, "readers cannot be null");
    }

    public ArchiveIndex index(List<Path> files) {
        List<ArchiveFileIndex> indexed = new ArrayList<>();
        for (Path file : files) {
            try {
                ArchiveFileIndex fileIndex = indexFile(file);
                indexed.add(fileIndex);
                logger.info("Indexed {}: {} scans", file, fileIndex.scans().size());
            } catch (IOException e) {
                logger.warn("Skipping archive {}: {}", file, e.getMessage());
            }
        }
        return new ArchiveIndex(indexed);
    }

    public ArchiveFileIndex indexFile(Path file) throws IOException {
        List<ScanIndexEntry> scans = new ArrayList<>();
        try (ArchiveReader reader = readers.open(file)) {
            Optional<ScanHeader> header;
            while ((header = reader.nextScan()).isPresent()) {
                scans.add(indexScan(reader, header.get()));
            }
        }
        return new ArchiveFileIndex(file, scans);
    }

    private ScanIndexEntry indexScan(ArchiveReader reader, ScanHeader header) throws IOException {
        double start = header.startMjd();
        double end = start;
        int cycles = 0;
        Optional<CycleRecord> cycle;
        while ((cycle = reader.nextCycle()).isPresent()) {
            end = cycle.get().mjd(header.obsDate());
            cycles++;
        }
        return new ScanIndexEntry(header, start, end, cycles);
    }
}
