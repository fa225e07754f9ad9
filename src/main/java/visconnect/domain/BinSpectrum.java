package visconnect.domain;

import java.util.Arrays;

/**
 * Per-channel products of one baseline and one bin, with a filtered copy
 * that excludes flagged channels. Arrays are shared, not copied; treat them
 * as read-only.
 */
public final class BinSpectrum {

    private final boolean flagged;
    private final float[] weight;
    private final float[] amplitude;
    private final float[] phase;
    private final float[] raw;

    private final int[] filteredChannel;
    private final float[] filteredFrequency;
    private final float[] filteredWeight;
    private final float[] filteredAmplitude;
    private final float[] filteredPhase;
    private final float[] filteredRaw;

    /**
     * @param raw interleaved (real, imaginary) values, twice the channel count
     * @param filteredRaw interleaved values for the filtered channels
     */
    public BinSpectrum(boolean flagged, float[] weight, float[] amplitude, float[] phase, float[] raw,
                       int[] filteredChannel, float[] filteredFrequency, float[] filteredWeight,
                       float[] filteredAmplitude, float[] filteredPhase, float[] filteredRaw) {
        int n = weight.length;
        if (amplitude.length != n || phase.length != n || raw.length != 2 * n) {
            throw new IllegalArgumentException("Channel arrays differ in length (" + n + " channels)");
        }
        int fn = filteredChannel.length;
        if (fn > n) {
            throw new IllegalArgumentException("Filtered channel count " + fn + " exceeds " + n);
        }
        if (filteredFrequency.length != fn || filteredWeight.length != fn || filteredAmplitude.length != fn
                || filteredPhase.length != fn || filteredRaw.length != 2 * fn) {
            throw new IllegalArgumentException("Filtered arrays differ in length (" + fn + " channels)");
        }
        this.flagged = flagged;
        this.weight = weight;
        this.amplitude = amplitude;
        this.phase = phase;
        this.raw = raw;
        this.filteredChannel = filteredChannel;
        this.filteredFrequency = filteredFrequency;
        this.filteredWeight = filteredWeight;
        this.filteredAmplitude = filteredAmplitude;
        this.filteredPhase = filteredPhase;
        this.filteredRaw = filteredRaw;
    }

    public boolean isFlagged() {
        return flagged;
    }

    public int numChannels() {
        return weight.length;
    }

    public int numFilteredChannels() {
        return filteredChannel.length;
    }

    public float[] weight() {
        return weight;
    }

    public float[] amplitude() {
        return amplitude;
    }

    public float[] phase() {
        return phase;
    }

    public float[] raw() {
        return raw;
    }

    public int[] filteredChannel() {
        return filteredChannel;
    }

    public float[] filteredFrequency() {
        return filteredFrequency;
    }

    public float[] filteredWeight() {
        return filteredWeight;
    }

    public float[] filteredAmplitude() {
        return filteredAmplitude;
    }

    public float[] filteredPhase() {
        return filteredPhase;
    }

    public float[] filteredRaw() {
        return filteredRaw;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinSpectrum)) return false;
        BinSpectrum that = (BinSpectrum) o;
        return flagged == that.flagged
                && Arrays.equals(weight, that.weight)
                && Arrays.equals(amplitude, that.amplitude)
                && Arrays.equals(phase, that.phase)
                && Arrays.equals(raw, that.raw)
                && Arrays.equals(filteredChannel, that.filteredChannel)
                && Arrays.equals(filteredFrequency, that.filteredFrequency)
                && Arrays.equals(filteredWeight, that.filteredWeight)
                && Arrays.equals(filteredAmplitude, that.filteredAmplitude)
                && Arrays.equals(filteredPhase, that.filteredPhase)
                && Arrays.equals(filteredRaw, that.filteredRaw);
    }

    @Override
    public int hashCode() {
        int result = Boolean.hashCode(flagged);
        result = 31 * result + Arrays.hashCode(amplitude);
        result = 31 * result + Arrays.hashCode(phase);
        result = 31 * result + Arrays.hashCode(filteredChannel);
        return result;
    }
}
