package visconnect.processor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visconnect.archive.ArchiveFileIndex;
import visconnect.archive.ArchiveIndex;
import visconnect.archive.ArchiveIndexer;
import visconnect.archive.ArchiveReader;
import visconnect.archive.ArchiveReaderFactory;
import visconnect.domain.AmpPhase;
import visconnect.domain.AmpPhaseOptions;
import visconnect.domain.CycleRecord;
import visconnect.domain.ScanHeader;
import visconnect.domain.SpectrumData;
import visconnect.domain.VisCycle;
import visconnect.domain.VisData;
import visconnect.domain.VisQuantities;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Walks archive files cycle by cycle and reduces them to spectra or
 * averaged products.
 * <p>
 * Files are read strictly in sequence and the current scan header is reused
 * until a new one appears. When averaged products are computed, the
 * per-channel spectra of a cycle are discarded as soon as they have been
 * averaged. A file that cannot be read is logged and skipped.
 */
public class CycleReducer {
    private static final Logger logger = LoggerFactory.getLogger(CycleReducer.class);

    private final ArchiveReaderFactory readers;
    private final AmpPhaseCalculator calculator;
    private final VisAverager averager;

    public CycleReducer() {
        this(ArchiveReaderFactory.blockFiles());
    }

    public CycleReducer(ArchiveReaderFactory readers) {
        this(readers, new AmpPhaseCalculator(), new VisAverager());
    }

    public CycleReducer(ArchiveReaderFactory readers, AmpPhaseCalculator calculator, VisAverager averager) {
        this.readers = Objects.requireNonNull(readers, "readers cannot be null");
        this.calculator = Objects.requireNonNull(calculator, "calculator cannot be null");
        this.averager = Objects.requireNonNull(averager, "averager cannot be null");
    }

    /**
     * Run one reduction pass.
     *
     * @param modes what to produce
     * @param files the archive files, in time order
     * @param index an existing index, used to skip files that cannot hold
     *              {@code targetMjd}; may be null
     * @param targetMjd the requested time for {@link ReduceMode#GRAB_SPECTRUM}
     * @param options the reduction parameters, left untouched; windows first
     *                seen in a scan are given default settings in the copy
     *                returned with the result
     */
    public ReductionResult reduce(Set<ReduceMode> modes, List<Path> files, ArchiveIndex index,
                                  double targetMjd, AmpPhaseOptions options) {
        EnumSet<ReduceMode> requested = modes.isEmpty() ? EnumSet.noneOf(ReduceMode.class) : EnumSet.copyOf(modes);
        ArchiveIndex currentIndex = index;
        if (requested.contains(ReduceMode.READ_SCAN_METADATA)) {
            currentIndex = new ArchiveIndexer(readers).index(files);
        }

        boolean compute = requested.contains(ReduceMode.COMPUTE_VIS_PRODUCTS);
        boolean grab = requested.contains(ReduceMode.GRAB_SPECTRUM);
        if (!compute && !grab) {
            return new ReductionResult(currentIndex, null, null, options.copy());
        }

        Pass pass = new Pass(compute, grab, targetMjd, options);
        for (Path file : files) {
            if (!compute && !mayHold(currentIndex, file, targetMjd)) {
                logger.debug("Skipping {}: no overlap with MJD {}", file, targetMjd);
                continue;
            }
            try {
                readFile(file, pass);
            } catch (IOException e) {
                logger.warn("Skipping rest of archive {}: {}", file, e.getMessage());
            }
            if (!compute && pass.spectrum != null) {
                break;
            }
        }

        VisData visData = compute ? new VisData(pass.headers, pass.cycles) : null;
        SpectrumData spectrum = grab ? (pass.spectrum == null ? SpectrumData.empty() : pass.spectrum) : null;
        if (compute) {
            logger.info("Reduced {} cycles from {} scans", pass.cycles.size(), pass.headers.size());
        }
        return new ReductionResult(currentIndex, visData, spectrum, pass.options);
    }

    /**
     * Compute the spectra of the cycle at a time.
     *
     * @return the spectra, empty when no cycle lies within half a cycle time
     */
    public SpectrumData grabSpectrum(List<Path> files, ArchiveIndex index, double targetMjd, AmpPhaseOptions options) {
        return reduce(EnumSet.of(ReduceMode.GRAB_SPECTRUM), files, index, targetMjd, options).spectrum();
    }

    public VisData computeVisData(List<Path> files, AmpPhaseOptions options) {
        return reduce(EnumSet.of(ReduceMode.COMPUTE_VIS_PRODUCTS), files, null, 0, options).visData();
    }

    private static boolean mayHold(ArchiveIndex index, Path file, double mjd) {
        if (index == null) {
            return true;
        }
        for (ArchiveFileIndex f : index.files()) {
            if (f.file().equals(file)) {
                return f.overlaps(mjd);
            }
        }
        // Files missing from the index failed to read when it was built.
        return false;
    }

    private void readFile(Path file, Pass pass) throws IOException {
        try (ArchiveReader reader = readers.open(file)) {
            Optional<ScanHeader> next;
            while ((next = reader.nextScan()).isPresent()) {
                ScanHeader header = next.get();
                pass.options.ensureWindows(header.windows());
                int headerIndex = -1;
                Optional<CycleRecord> cycle;
                while ((cycle = reader.nextCycle()).isPresent()) {
                    CycleRecord record = cycle.get();
                    double mjd = record.mjd(header.obsDate());
                    if (pass.grab && pass.spectrum == null
                            && Math.abs(mjd - pass.targetMjd) <= header.halfCycleDays()) {
                        pass.spectrum = new SpectrumData(header, calculator.computeAll(header, record, pass.options));
                        if (!pass.compute) {
                            return;
                        }
                    }
                    if (pass.compute) {
                        if (headerIndex < 0) {
                            pass.headers.add(header);
                            headerIndex = pass.headers.size() - 1;
                        }
                        pass.cycles.add(averageCycle(header, record, mjd, headerIndex, pass.options));
                    }
                }
            }
        }
    }

    private VisCycle averageCycle(ScanHeader header, CycleRecord record, double mjd, int headerIndex,
                                  AmpPhaseOptions options) {
        List<List<VisQuantities>> windows = new ArrayList<>();
        for (List<AmpPhase> pols : calculator.computeAll(header, record, options)) {
            List<VisQuantities> averaged = new ArrayList<>(pols.size());
            for (AmpPhase ap : pols) {
                averaged.add(averager.average(ap, options));
            }
            if (!averaged.isEmpty()) {
                windows.add(averaged);
            }
        }
        return new VisCycle(mjd, headerIndex, windows);
    }

    private static final class Pass {
        final boolean compute;
        final boolean grab;
        final double targetMjd;
        final AmpPhaseOptions options;
        final List<ScanHeader> headers = new ArrayList<>();
        final List<VisCycle> cycles = new ArrayList<>();
        SpectrumData spectrum;

        Pass(boolean compute, boolean grab, double targetMjd, AmpPhaseOptions options) {
            this.compute = compute;
            this.grab = grab;
            this.targetMjd = targetMjd;
            this.options = options.copy();
        }
    }
}
