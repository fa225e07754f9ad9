package visconnect.domain;

/**
 * Baseline number conventions: baseline = 256 * ant1 + ant2 with ant1 <= ant2,
 * antennas numbered from 1.
 */
public final class Baselines {

    private Baselines() {
    }

    public static int toBaseline(int ant1, int ant2) {
        if (ant1 > ant2) {
            return 256 * ant2 + ant1;
        }
        return 256 * ant1 + ant2;
    }

    public static int firstAntenna(int baseline) {
        return baseline / 256;
    }

    public static int secondAntenna(int baseline) {
        return baseline % 256;
    }

    public static boolean isAutocorrelation(int baseline) {
        return firstAntenna(baseline) == secondAntenna(baseline);
    }

    public static boolean involves(int baseline, int antenna) {
        return firstAntenna(baseline) == antenna || secondAntenna(baseline) == antenna;
    }

    public static String label(int baseline) {
        return firstAntenna(baseline) + "-" + secondAntenna(baseline);
    }
}
