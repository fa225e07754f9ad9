package visconnect.archive;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Time index over a set of archive files. Files that could not be read are
 * absent.
 */
public record ArchiveIndex(List<ArchiveFileIndex> files) {

    public ArchiveIndex {
        files = List.copyOf(files);
    }

    public static ArchiveIndex empty() {
        return new ArchiveIndex(List.of());
    }

    /**
     * A scan located in a file.
     */
    public record Location(ArchiveFileIndex file, ScanIndexEntry scan) {
    }

    public Optional<Location> findScan(double mjd) {
        for (ArchiveFileIndex file : files) {
            if (!file.overlaps(mjd)) {
                continue;
            }
            Optional<ScanIndexEntry> scan = file.findScan(mjd);
            if (scan.isPresent()) {
                return Optional.of(new Location(file, scan.get()));
            }
        }
        return Optional.empty();
    }

    public int numScans() {
        return files.stream().mapToInt(f -> f.scans().size()).sum();
    }

    /**
     * The latest cycle time in the index, or 0 if there is none.
     */
    public double latestMjd() {
        double latest = 0;
        for (ArchiveFileIndex file : files) {
            for (ScanIndexEntry scan : file.scans()) {
                latest = Math.max(latest, scan.endMjd());
            }
        }
        return latest;
    }

    /**
     * One line per file and one per scan.
     */
    public List<String> summaryLines() {
        List<String> lines = new ArrayList<>();
        for (ArchiveFileIndex file : files) {
            lines.add(String.format("%s: %d scans, %d cycles", file.file().getFileName(),
                    file.scans().size(), file.numCycles()));
            for (ScanIndexEntry scan : file.scans()) {
                lines.add("  " + scan.summary());
            }
        }
        return lines;
    }
}
