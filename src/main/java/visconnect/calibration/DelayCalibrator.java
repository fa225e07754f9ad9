package visconnect.calibration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visconnect.domain.Baselines;
import visconnect.domain.DelayModifier;
import visconnect.domain.Mjd;
import visconnect.domain.Polarisation;
import visconnect.domain.ScanHeader;
import visconnect.domain.VisCycle;
import visconnect.domain.VisData;
import visconnect.domain.VisQuantities;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Derives per-antenna delay corrections from the most recent cycles.
 * <p>
 * For every antenna other than the reference, the delay measured on its
 * baseline to the reference is averaged over {@code N} consecutive cycles.
 * Baselines are stored with the lower antenna first, so the sign is flipped
 * when the antenna is numbered below the reference.
 * <p>
 * Every one of the {@code N} cycles must carry the window and polarisation
 * being solved. A baseline that is flagged or has no bins in a cycle is
 * left out of that cycle's average, so an antenna's delay may rest on fewer
 * than {@code N} samples; {@link AntennaDelay} records how many were used.
 * Windows the current scan does not have are skipped.
 */
public class DelayCalibrator {
    private static final Logger logger = LoggerFactory.getLogger(DelayCalibrator.class);

    /** Allowed deviation from the cycle time between neighbouring cycles, in seconds. */
    static final double SPACING_TOLERANCE_SECONDS = 0.1;

    private static final Polarisation[] PARALLEL_HANDS = {Polarisation.XX, Polarisation.YY};

    /**
     * The delays found in one solve, and the time of the latest cycle used.
     */
    public record Solution(double mjd, List<AntennaDelay> delays) {

        public Solution {
            delays = List.copyOf(delays);
        }

        /**
         * Corrections that cancel the measured delays over a time range.
         */
        public List<DelayModifier> toModifiers(DelayScope scope) {
            double from = scope == DelayScope.AFTER ? mjd : Double.NEGATIVE_INFINITY;
            double to = scope == DelayScope.BEFORE ? mjd : Double.POSITIVE_INFINITY;
            List<DelayModifier> modifiers = new ArrayList<>(delays.size());
            for (AntennaDelay d : delays) {
                modifiers.add(new DelayModifier(from, to, d.antenna(), d.window(), d.feed(), -d.delayNs()));
            }
            return modifiers;
        }
    }

    /**
     * Solve for antenna delays.
     *
     * @param data the averaged products, latest cycle last
     * @param refant 1-based reference antenna
     * @param ncycles how many consecutive cycles to average
     * @param windows window indices to solve for
     * @throws CalibrationException if there are not enough consecutive
     *                              cycles, one of them lacks a window or
     *                              polarisation being solved for, or the
     *                              reference antenna is absent
     */
    public Solution solve(VisData data, int refant, int ncycles, int... windows) throws CalibrationException {
        if (ncycles < 1) {
            throw new CalibrationException("nncal must be at least 1");
        }
        int consecutive = trailingConsecutiveCycles(data, ncycles);
        if (consecutive < ncycles) {
            throw new CalibrationException("need " + ncycles + " consecutive cycles, found " + consecutive);
        }
        ScanHeader header = data.latestHeader();
        if (!header.hasAntenna(refant)) {
            throw new CalibrationException("antenna " + refant + " not in current scan");
        }

        int first = data.numCycles() - ncycles;
        Set<Integer> uniqueWindows = new LinkedHashSet<>();
        for (int w : windows) {
            uniqueWindows.add(w);
        }

        List<AntennaDelay> delays = new ArrayList<>();
        for (int window : uniqueWindows) {
            if (window < 0 || window >= header.numWindows()) {
                logger.debug("Window {} not in current scan, no delays solved for it", window);
                continue;
            }
            for (Polarisation pol : PARALLEL_HANDS) {
                int carried = cyclesCarrying(data, first, window, pol);
                if (carried < ncycles) {
                    throw new CalibrationException("need " + ncycles + " consecutive cycles, found " + carried
                            + " with " + pol + " in window " + (window + 1));
                }
                for (int ant = 1; ant <= header.numAntennas(); ant++) {
                    if (ant == refant) {
                        continue;
                    }
                    int baseline = Baselines.toBaseline(ant, refant);
                    float sign = ant < refant ? -1f : 1f;
                    double sum = 0;
                    int used = 0;
                    for (int c = first; c < data.numCycles(); c++) {
                        VisQuantities q = data.cycle(c).find(window, pol);
                        int idx = q.baselineIndex(baseline);
                        if (idx < 0 || q.isFlagged(idx) || q.numBins(idx) == 0) {
                            continue;
                        }
                        sum += sign * q.delay()[idx][0];
                        used++;
                    }
                    if (used > 0) {
                        delays.add(new AntennaDelay(ant, window, pol.firstFeed(), (float) (sum / used), used));
                    }
                }
            }
        }
        double mjd = data.cycle(data.numCycles() - 1).mjd();
        logger.info("Solved {} antenna delays against antenna {} over {} cycles", delays.size(), refant, ncycles);
        return new Solution(mjd, delays);
    }

    private static int cyclesCarrying(VisData data, int first, int window, Polarisation pol) {
        int carried = 0;
        for (int c = first; c < data.numCycles(); c++) {
            if (data.cycle(c).find(window, pol) != null) {
                carried++;
            }
        }
        return carried;
    }

    /**
     * Count the cycles at the end of the data that follow each other at
     * exactly one cycle time, stopping once {@code wanted} are found.
     */
    static int trailingConsecutiveCycles(VisData data, int wanted) {
        int n = data.numCycles();
        if (n == 0) {
            return 0;
        }
        int count = 1;
        for (int c = n - 1; c > 0 && count < wanted; c--) {
            VisCycle later = data.cycle(c);
            VisCycle earlier = data.cycle(c - 1);
            double spacing = Mjd.daysToSeconds(later.mjd() - earlier.mjd());
            int cycleTime = data.header(c).cycleTime();
            if (Math.abs(spacing - cycleTime) > SPACING_TOLERANCE_SECONDS) {
                break;
            }
            count++;
        }
        return count;
    }
}
