package visconnect.archive;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * The scans of one archive file, in file order.
 */
public record ArchiveFileIndex(Path file, List<ScanIndexEntry> scans) {

    public ArchiveFileIndex {
        scans = List.copyOf(scans);
    }

    public boolean isEmpty() {
        return scans.isEmpty();
    }

    /**
     * Cheap file-level test: could any scan of this file cover the time?
     */
    public boolean overlaps(double mjd) {
        if (scans.isEmpty()) {
            return false;
        }
        ScanIndexEntry first = scans.get(0);
        ScanIndexEntry last = scans.get(scans.size() - 1);
        return mjd >= first.startMjd() - first.header().halfCycleDays()
                && mjd <= last.endMjd() + last.header().halfCycleDays();
    }

    public Optional<ScanIndexEntry> findScan(double mjd) {
        return scans.stream().filter(s -> s.covers(mjd)).findFirst();
    }

    public int numCycles() {
        return scans.stream().mapToInt(ScanIndexEntry::numCycles).sum();
    }
}
