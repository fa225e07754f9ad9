package visconnect.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * Amplitude, phase and raw complex spectra for every baseline of one window,
 * one polarisation and one cycle.
 * <p>
 * Spectra are indexed {@code [baseline][bin]}; each baseline may carry a
 * different number of bins. Every channel array holds {@link #numChannels()}
 * values, every filtered array holds its bin's filtered count.
 */
public final class AmpPhase {

    public static final int WINDOW_NAME_LENGTH = 8;

    private final int[] channel;
    private final float[] frequency;
    private final int[] baseline;
    private final Polarisation pol;
    private final int window;
    private final String windowName;
    private final String obsDate;
    private final float utSeconds;
    private final String scanType;
    private final BinSpectrum[][] spectra;

    private final ValueRange amplitudeRange;
    private final ValueRange phaseRange;
    private final ValueRange[] baselineAmplitudeRange;
    private final ValueRange[] baselinePhaseRange;

    private final AmpPhaseOptions options;

    public AmpPhase(int[] channel, float[] frequency, int[] baseline, Polarisation pol, int window,
                    String windowName, String obsDate, float utSeconds, String scanType,
                    BinSpectrum[][] spectra, ValueRange amplitudeRange, ValueRange phaseRange,
                    ValueRange[] baselineAmplitudeRange, ValueRange[] baselinePhaseRange,
                    AmpPhaseOptions options) {
        int nchan = channel.length;
        int nbl = baseline.length;
        if (frequency.length != nchan) {
            throw new IllegalArgumentException("Frequency array has " + frequency.length
                    + " values for " + nchan + " channels");
        }
        if (spectra.length != nbl || baselineAmplitudeRange.length != nbl || baselinePhaseRange.length != nbl) {
            throw new IllegalArgumentException("Per-baseline arrays differ from " + nbl + " baselines");
        }
        for (BinSpectrum[] bins : spectra) {
            for (BinSpectrum bin : bins) {
                if (bin.numChannels() != nchan) {
                    throw new IllegalArgumentException("Bin spectrum has " + bin.numChannels()
                            + " channels, expected " + nchan);
                }
            }
        }
        this.channel = channel;
        this.frequency = frequency;
        this.baseline = baseline;
        this.pol = Objects.requireNonNull(pol, "pol cannot be null");
        this.window = window;
        this.windowName = windowName;
        this.obsDate = obsDate;
        this.utSeconds = utSeconds;
        this.scanType = scanType;
        this.spectra = spectra;
        this.amplitudeRange = amplitudeRange;
        this.phaseRange = phaseRange;
        this.baselineAmplitudeRange = baselineAmplitudeRange;
        this.baselinePhaseRange = baselinePhaseRange;
        this.options = options;
    }

    /**
     * Build an AmpPhase, deriving the per-baseline and global ranges from the
     * filtered spectra.
     */
    public static AmpPhase withComputedRanges(int[] channel, float[] frequency, int[] baseline, Polarisation pol,
                                              int window, String windowName, String obsDate, float utSeconds,
                                              String scanType, BinSpectrum[][] spectra, AmpPhaseOptions options) {
        ValueRange.Accumulator amp = new ValueRange.Accumulator();
        ValueRange.Accumulator pha = new ValueRange.Accumulator();
        ValueRange[] blAmp = new ValueRange[baseline.length];
        ValueRange[] blPha = new ValueRange[baseline.length];
        for (int i = 0; i < spectra.length; i++) {
            ValueRange.Accumulator a = new ValueRange.Accumulator();
            ValueRange.Accumulator p = new ValueRange.Accumulator();
            for (BinSpectrum bin : spectra[i]) {
                a.add(bin.filteredAmplitude());
                p.add(bin.filteredPhase());
                amp.add(bin.filteredAmplitude());
                pha.add(bin.filteredPhase());
            }
            blAmp[i] = a.toRange();
            blPha[i] = p.toRange();
        }
        return new AmpPhase(channel, frequency, baseline, pol, window, windowName, obsDate, utSeconds,
                scanType, spectra, amp.toRange(), pha.toRange(), blAmp, blPha, options);
    }

    public int numChannels() {
        return channel.length;
    }

    public int numBaselines() {
        return baseline.length;
    }

    public int numBins(int baselineIndex) {
        return spectra[baselineIndex].length;
    }

    /**
     * Index of a baseline number in this product.
     *
     * @return the index or -1 if the baseline is absent
     */
    public int baselineIndex(int baselineNumber) {
        for (int i = 0; i < baseline.length; i++) {
            if (baseline[i] == baselineNumber) {
                return i;
            }
        }
        return -1;
    }

    public BinSpectrum spectrum(int baselineIndex, int bin) {
        return spectra[baselineIndex][bin];
    }

    public int[] channel() {
        return channel;
    }

    public float[] frequency() {
        return frequency;
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

    public String windowName() {
        return windowName;
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

    public ValueRange amplitudeRange() {
        return amplitudeRange;
    }

    public ValueRange phaseRange() {
        return phaseRange;
    }

    public ValueRange baselineAmplitudeRange(int baselineIndex) {
        return baselineAmplitudeRange[baselineIndex];
    }

    public ValueRange baselinePhaseRange(int baselineIndex) {
        return baselinePhaseRange[baselineIndex];
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
        if (!(o instanceof AmpPhase)) return false;
        AmpPhase that = (AmpPhase) o;
        return window == that.window
                && Float.compare(utSeconds, that.utSeconds) == 0
                && pol == that.pol
                && Arrays.equals(channel, that.channel)
                && Arrays.equals(frequency, that.frequency)
                && Arrays.equals(baseline, that.baseline)
                && Objects.equals(windowName, that.windowName)
                && Objects.equals(obsDate, that.obsDate)
                && Objects.equals(scanType, that.scanType)
                && Arrays.deepEquals(spectra, that.spectra)
                && amplitudeRange.equals(that.amplitudeRange)
                && phaseRange.equals(that.phaseRange)
                && Arrays.equals(baselineAmplitudeRange, that.baselineAmplitudeRange)
                && Arrays.equals(baselinePhaseRange, that.baselinePhaseRange)
                && Objects.equals(options, that.options);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(pol, window, windowName, obsDate, utSeconds, scanType);
        result = 31 * result + Arrays.hashCode(baseline);
        result = 31 * result + Arrays.deepHashCode(spectra);
        return result;
    }

    @Override
    public String toString() {
        return String.format("AmpPhase{window=%s, pol=%s, ut=%.1f, channels=%d, baselines=%d}",
                windowName, pol, utSeconds, numChannels(), numBaselines());
    }
}
