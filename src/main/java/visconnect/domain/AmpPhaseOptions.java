package visconnect.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The free parameters of data reduction.
 * <p>
 * Instances are mutable and shared by reference: the server keeps one
 * authoritative instance and every viewer that has not changed an option
 * works from a copy of it. Per-window settings are held in arrays indexed
 * by window number.
 */
public class AmpPhaseOptions {

    private boolean phaseInDegrees;
    private boolean includeFlaggedData;
    private TsysCorrection tsysCorrection;
    private int[] delayAveraging;
    private int[] minTvChannel;
    private int[] maxTvChannel;
    private AveragingMethod[] averagingMethod;
    private final List<DelayModifier> delayModifiers = new ArrayList<>();

    public AmpPhaseOptions() {
        this.phaseInDegrees = true;
        this.includeFlaggedData = false;
        this.tsysCorrection = TsysCorrection.ONLINE;
        this.delayAveraging = new int[0];
        this.minTvChannel = new int[0];
        this.maxTvChannel = new int[0];
        this.averagingMethod = new AveragingMethod[0];
    }

    /**
     * Make sure there are settings for every window, filling new windows with
     * defaults derived from the channel count. Existing settings are kept.
     */
    public void ensureWindows(List<IfWindow> windows) {
        int existing = delayAveraging.length;
        if (windows.size() <= existing) {
            return;
        }
        delayAveraging = Arrays.copyOf(delayAveraging, windows.size());
        minTvChannel = Arrays.copyOf(minTvChannel, windows.size());
        maxTvChannel = Arrays.copyOf(maxTvChannel, windows.size());
        averagingMethod = Arrays.copyOf(averagingMethod, windows.size());
        for (int i = existing; i < windows.size(); i++) {
            int nchan = windows.get(i).numChannels();
            delayAveraging[i] = 1;
            minTvChannel[i] = defaultMinTvChannel(nchan);
            maxTvChannel[i] = defaultMaxTvChannel(nchan);
            averagingMethod[i] = AveragingMethod.DEFAULT;
        }
    }

    static int defaultMinTvChannel(int nchan) {
        return nchan <= 1 ? 1 : Math.min(nchan, nchan / 4 + 1);
    }

    static int defaultMaxTvChannel(int nchan) {
        return nchan <= 1 ? 1 : Math.min(nchan, 3 * nchan / 4 + 1);
    }

    /**
     * Replace the per-window settings wholesale. All arrays must have the same length.
     */
    public void setWindowSettings(int[] delayAveraging, int[] minTvChannel, int[] maxTvChannel,
                                  AveragingMethod[] averagingMethod) {
        int n = delayAveraging.length;
        if (minTvChannel.length != n || maxTvChannel.length != n || averagingMethod.length != n) {
            throw new IllegalArgumentException("Per-window option arrays differ in length");
        }
        this.delayAveraging = delayAveraging.clone();
        this.minTvChannel = minTvChannel.clone();
        this.maxTvChannel = maxTvChannel.clone();
        this.averagingMethod = averagingMethod.clone();
    }

    public int numWindows() {
        return delayAveraging.length;
    }

    public boolean isPhaseInDegrees() {
        return phaseInDegrees;
    }

    public void setPhaseInDegrees(boolean phaseInDegrees) {
        this.phaseInDegrees = phaseInDegrees;
    }

    public boolean isIncludeFlaggedData() {
        return includeFlaggedData;
    }

    public void setIncludeFlaggedData(boolean includeFlaggedData) {
        this.includeFlaggedData = includeFlaggedData;
    }

    public TsysCorrection getTsysCorrection() {
        return tsysCorrection;
    }

    public void setTsysCorrection(TsysCorrection tsysCorrection) {
        this.tsysCorrection = Objects.requireNonNull(tsysCorrection, "tsysCorrection cannot be null");
    }

    public int getDelayAveraging(int window) {
        return window < delayAveraging.length ? delayAveraging[window] : 1;
    }

    public void setDelayAveraging(int window, int factor) {
        checkWindow(window);
        if (factor < 1) {
            throw new IllegalArgumentException("Delay averaging must be at least 1");
        }
        delayAveraging[window] = factor;
    }

    public int getMinTvChannel(int window) {
        checkWindow(window);
        return minTvChannel[window];
    }

    public int getMaxTvChannel(int window) {
        checkWindow(window);
        return maxTvChannel[window];
    }

    public void setTvChannels(int window, int min, int max) {
        checkWindow(window);
        if (min < 1 || max < min) {
            throw new IllegalArgumentException("Invalid tv channel range " + min + " - " + max);
        }
        minTvChannel[window] = min;
        maxTvChannel[window] = max;
    }

    public AveragingMethod getAveragingMethod(int window) {
        return window < averagingMethod.length ? averagingMethod[window] : AveragingMethod.DEFAULT;
    }

    public void setAveragingMethod(int window, AveragingMethod method) {
        checkWindow(window);
        averagingMethod[window] = Objects.requireNonNull(method, "method cannot be null");
    }

    public List<DelayModifier> getDelayModifiers() {
        return List.copyOf(delayModifiers);
    }

    public void addDelayModifiers(List<DelayModifier> modifiers) {
        delayModifiers.addAll(modifiers);
    }

    public void clearDelayModifiers() {
        delayModifiers.clear();
    }

    /**
     * Sum of every delay correction that applies to an antenna feed at a time.
     */
    public float delayCorrection(int antenna, int window, Polarisation feed, double mjd) {
        float total = 0;
        for (DelayModifier m : delayModifiers) {
            if (m.appliesTo(antenna, window, feed) && m.appliesAt(mjd)) {
                total += m.delayNs();
            }
        }
        return total;
    }

    private void checkWindow(int window) {
        if (window < 0 || window >= delayAveraging.length) {
            throw new IllegalArgumentException("No options for window " + window);
        }
    }

    public AmpPhaseOptions copy() {
        AmpPhaseOptions copy = new AmpPhaseOptions();
        copy.phaseInDegrees = phaseInDegrees;
        copy.includeFlaggedData = includeFlaggedData;
        copy.tsysCorrection = tsysCorrection;
        copy.setWindowSettings(delayAveraging, minTvChannel, maxTvChannel, averagingMethod);
        copy.delayModifiers.addAll(delayModifiers);
        return copy;
    }

    /**
     * Human readable description, one line per setting.
     */
    public List<String> describe(ScanHeader header) {
        List<String> lines = new ArrayList<>();
        lines.add("Phase units: " + (phaseInDegrees ? "degrees" : "radians"));
        lines.add("Flagged data: " + (includeFlaggedData ? "included" : "excluded"));
        lines.add("Tsys correction: " + tsysCorrection.name().toLowerCase());
        for (int i = 0; i < numWindows(); i++) {
            String name = header != null && i < header.numWindows() ? header.window(i).label() : "window " + (i + 1);
            lines.add(String.format("  %s: tvchannels %d - %d, delay averaging %d, averaging %s",
                    name, minTvChannel[i], maxTvChannel[i], delayAveraging[i], averagingMethod[i]));
        }
        lines.add("Delay modifiers: " + delayModifiers.size());
        return lines;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AmpPhaseOptions)) return false;
        AmpPhaseOptions that = (AmpPhaseOptions) o;
        return phaseInDegrees == that.phaseInDegrees
                && includeFlaggedData == that.includeFlaggedData
                && tsysCorrection == that.tsysCorrection
                && Arrays.equals(delayAveraging, that.delayAveraging)
                && Arrays.equals(minTvChannel, that.minTvChannel)
                && Arrays.equals(maxTvChannel, that.maxTvChannel)
                && Arrays.equals(averagingMethod, that.averagingMethod)
                && delayModifiers.equals(that.delayModifiers);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(phaseInDegrees, includeFlaggedData, tsysCorrection, delayModifiers);
        result = 31 * result + Arrays.hashCode(delayAveraging);
        result = 31 * result + Arrays.hashCode(minTvChannel);
        result = 31 * result + Arrays.hashCode(maxTvChannel);
        result = 31 * result + Arrays.hashCode(averagingMethod);
        return result;
    }

    @Override
    public String toString() {
        return String.format("AmpPhaseOptions{degrees=%s, flagged=%s, tsys=%s, windows=%d, modifiers=%d}",
                phaseInDegrees, includeFlaggedData, tsysCorrection, numWindows(), delayModifiers.size());
    }
}
