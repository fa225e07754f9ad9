package visconnect.domain;

import java.util.List;

/**
 * Immutable per-scan metadata read from an archive scan header.
 */
public record ScanHeader(
        String obsDate,
        float utSeconds,
        String obsType,
        String calCode,
        int cycleTime,
        String sourceName,
        float rightAscensionHours,
        float declinationDegrees,
        List<AntennaPosition> antennas,
        List<IfWindow> windows
) {
    public static final int OBSDATE_LENGTH = 12;
    public static final int OBSTYPE_LENGTH = 16;
    public static final int SOURCE_LENGTH = 16;
    public static final int CALCODE_LENGTH = 4;

    public ScanHeader {
        antennas = List.copyOf(antennas);
        windows = List.copyOf(windows);
        if (cycleTime < 0) {
            throw new IllegalArgumentException("Negative cycle time: " + cycleTime);
        }
    }

    public int numAntennas() {
        return antennas.size();
    }

    public int numWindows() {
        return windows.size();
    }

    public IfWindow window(int index) {
        return windows.get(index);
    }

    /**
     * Find a window by any of its alias names.
     *
     * @return the 0-based window index, or -1 if no window has that name
     */
    public int findWindow(String name) {
        for (int i = 0; i < windows.size(); i++) {
            if (windows.get(i).matchesName(name)) {
                return i;
            }
        }
        return -1;
    }

    public boolean hasAntenna(int antenna) {
        return antenna >= 1 && antenna <= antennas.size();
    }

    public double startMjd() {
        return Mjd.fromObsDate(obsDate, utSeconds);
    }

    /**
     * Half a cycle time, in days.
     */
    public double halfCycleDays() {
        return Mjd.secondsToDays(cycleTime / 2.0);
    }

    /**
     * Length of a baseline between two 1-based antennas, in metres.
     */
    public double baselineLength(int ant1, int ant2) {
        if (!hasAntenna(ant1) || !hasAntenna(ant2)) {
            return 0;
        }
        return antennas.get(ant1 - 1).distanceTo(antennas.get(ant2 - 1));
    }
}
