package visconnect.domain;

/**
 * A delay correction for one antenna feed in one window, valid over a time range.
 *
 * @param validFromMjd start of validity (may be negative infinity)
 * @param validToMjd end of validity (may be positive infinity)
 * @param antenna 1-based antenna number
 * @param window 0-based window index
 * @param feed X or Y
 * @param delayNs delay to add to the antenna, in nanoseconds
 */
public record DelayModifier(
        double validFromMjd,
        double validToMjd,
        int antenna,
        int window,
        Polarisation feed,
        float delayNs
) {
    public boolean appliesAt(double mjd) {
        return mjd >= validFromMjd && mjd <= validToMjd;
    }

    public boolean appliesTo(int antenna, int window, Polarisation feed) {
        return this.antenna == antenna && this.window == window && this.feed == feed;
    }
}
