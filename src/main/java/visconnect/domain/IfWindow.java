package visconnect.domain;

import java.util.List;

/**
 * Frequency configuration of one IF/window of a scan.
 *
 * @param centreFreqMhz centre frequency in MHz
 * @param bandwidthMhz total bandwidth in MHz
 * @param numChannels channel count
 * @param sideband +1 for upper sideband, -1 for lower
 * @param stokesNames the correlation products recorded, in recording order
 * @param names three alias names ("f1", "1", "2100MHz") any of which selects the window
 */
public record IfWindow(
        double centreFreqMhz,
        double bandwidthMhz,
        int numChannels,
        int sideband,
        List<String> stokesNames,
        List<String> names
) {
    public static final int NUM_NAMES = 3;

    public IfWindow {
        if (numChannels < 0) {
            throw new IllegalArgumentException("Negative channel count: " + numChannels);
        }
        stokesNames = List.copyOf(stokesNames);
        names = List.copyOf(names);
        if (names.size() != NUM_NAMES) {
            throw new IllegalArgumentException("An IF needs " + NUM_NAMES + " names, got " + names.size());
        }
    }

    public int numStokes() {
        return stokesNames.size();
    }

    public String label() {
        return names.get(0);
    }

    public boolean matchesName(String name) {
        for (String n : names) {
            if (n.equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Index of a polarisation within the recorded stokes products.
     *
     * @return the index, or -1 if the product was not recorded
     */
    public int stokesIndex(Polarisation pol) {
        for (int i = 0; i < stokesNames.size(); i++) {
            if (Polarisation.fromLabel(stokesNames.get(i)) == pol) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Sky frequency of a 1-based channel, in GHz.
     */
    public double channelFrequencyGhz(int channel) {
        if (numChannels <= 1) {
            return centreFreqMhz / 1000.0;
        }
        double width = bandwidthMhz / (numChannels - 1);
        double centreChannel = (numChannels + 1) / 2.0;
        return (centreFreqMhz + sideband * (channel - centreChannel) * width) / 1000.0;
    }
}
