package visconnect.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * Channel-averaged amplitude, phase and delay for every baseline of one
 * window, one polarisation and one cycle. Values are indexed
 * {@code [baseline][bin]}.
 */
public final class VisQuantities {

    private final int[] baseline;
    private final Polarisation pol;
    private final int window;
    private final String obsDate;
    private final float utSeconds;
    private final String scanType;
    private final boolean[] flagged;
    private final float[][] amplitude;
    private final float[][] phase;
    private final float[][] delay;
    private final ValueRange amplitudeRange;
    private final ValueRange phaseRange;
    private final ValueRange delayRange;
    private final AmpPhaseOptions options;

    public VisQuantities(int[] baseline, Polarisation pol, int window, String obsDate, float utSeconds,
                         String scanType, boolean[] flagged, float[][] amplitude, float[][] phase,
                         float[][] delay, ValueRange amplitudeRange, ValueRange phaseRange,
                         ValueRange delayRange, AmpPhaseOptions options) {
        int nbl = baseline.length;
        if (flagged.length != nbl || amplitude.length != nbl || phase.length != nbl || delay.length != nbl) {
            throw new IllegalArgumentException("Per-baseline arrays differ from " + nbl + " baselines");
        }
        for (int i = 0; i < nbl; i++) {
            int nbins = amplitude[i].length;
            if (phase[i].length != nbins || delay[i].length != nbins) {
                throw new IllegalArgumentException("Bin arrays differ in length for baseline index " + i);
            }
        }
        this.baseline = baseline;
        this.pol = Objects.requireNonNull(pol, "pol cannot be null");
        this.window = window;
        this.obsDate = obsDate;
        this.utSeconds = utSeconds;
        this.scanType = scanType;
        this.flagged = flagged;
        this.amplitude = amplitude;
        this.phase = phase;
        this.delay = delay;
        this.amplitudeRange = amplitudeRange;
        this.phaseRange = phaseRange;
        this.delayRange = delayRange;
        this.options = options;
    }

    /**
     * Build a VisQuantities whose global ranges cover the unflagged baselines.
     */
    public static VisQuantities withComputedRanges(int[] baseline, Polarisation pol, int window, String obsDate,
                                                   float utSeconds, String scanType, boolean[] flagged,
                                                   float[][] amplitude, float[][] phase, float[][] delay,
                                                   AmpPhaseOptions options) {
        ValueRange.Accumulator amp = new ValueRange.Accumulator();
        ValueRange.Accumulator pha = new ValueRange.Accumulator();
        ValueRange.Accumulator del = new ValueRange.Accumulator();
        for (int i = 0; i < baseline.length; i++) {
            if (flagged[i]) {
                continue;
            }
            amp.add(amplitude[i]);
            pha.add(phase[i]);
            del.add(delay[i]);
        }
        return new VisQuantities(baseline, pol, window, obsDate, utSeconds, scanType, flagged,
                amplitude, phase, delay, amp.toRange(), pha.toRange(), del.toRange(), options);
    }

    /**
     * Copy of this product with the phases replaced.
     */
    public VisQuantities withPhases(float[][] newPhase) {
        ValueRange.Accumulator pha = new ValueRange.Accumulator();
        for (int i = 0; i < baseline.length; i++) {
            if (!flagged[i]) {
                pha.add(newPhase[i]);
            }
        }
        return new VisQuantities(baseline, pol, window, obsDate, utSeconds, scanType, flagged,
                amplitude, newPhase, delay, amplitudeRange, pha.toRange(), delayRange, options);
    }

    public int numBaselines() {
        return baseline.length;
    }

    public int numBins(int baselineIndex) {
        return amplitude[baselineIndex].length;
    }

    public int baselineIndex(int baselineNumber) {
        for (int i = 0; i < baseline.length; i++) {
            if (baseline[i] == baselineNumber) {
                return i;
            }
        }
        return -1;
    }

    public int[] baseline() {
        return baseline;
    }

    public Polarisation pol() {
        return pol;
    }

    public int window() {
        return window;
    }

    public String obsDate() {
        return obsDate;
    }

    public float utSeconds() {
        return utSeconds;
    }

    public String scanType() {
        return scanType;
    }

    public boolean isFlagged(int baselineIndex) {
        return flagged[baselineIndex];
    }

    public boolean[] flagged() {
        return flagged;
    }

    public float[][] amplitude() {
        return amplitude;
    }

    public float[][] phase() {
        return phase;
    }

    public float[][] delay() {
        return delay;
    }

    public ValueRange amplitudeRange() {
        return amplitudeRange;
    }

    public ValueRange phaseRange() {
        return phaseRange;
    }

    public ValueRange delayRange() {
        return delayRange;
    }

    public AmpPhaseOptions options() {
        return options;
    }

    public double mjd() {
        return Mjd.fromObsDate(obsDate, utSeconds);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VisQuantities)) return false;
        VisQuantities that = (VisQuantities) o;
        return window == that.window
                && Float.compare(utSeconds, that.utSeconds) == 0
                && pol == that.pol
                && Arrays.equals(baseline, that.baseline)
                && Objects.equals(obsDate, that.obsDate)
                && Objects.equals(scanType, that.scanType)
                && Arrays.equals(flagged, that.flagged)
                && Arrays.deepEquals(amplitude, that.amplitude)
                && Arrays.deepEquals(phase, that.phase)
                && Arrays.deepEquals(delay, that.delay)
                && amplitudeRange.equals(that.amplitudeRange)
                && phaseRange.equals(that.phaseRange)
                && delayRange.equals(that.delayRange)
                && Objects.equals(options, that.options);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(pol, window, obsDate, utSeconds, scanType);
        result = 31 * result + Arrays.hashCode(baseline);
        result = 31 * result + Arrays.deepHashCode(amplitude);
        return result;
    }

    @Override
    public String toString() {
        return String.format("VisQuantities{window=%d, pol=%s, ut=%.1f, baselines=%d}",
                window, pol, utSeconds, numBaselines());
    }
}
