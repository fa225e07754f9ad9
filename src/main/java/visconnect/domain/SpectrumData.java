package visconnect.domain;

import java.util.List;

/**
 * The per-channel spectra of a single cycle, indexed {@code [window][pol]}.
 *
 * @param header the scan header of the cycle, null when no cycle matched
 * @param spectra one list of polarisation products per window
 */
public record SpectrumData(ScanHeader header, List<List<AmpPhase>> spectra) {

    private static final SpectrumData EMPTY = new SpectrumData(null, List.of());

    public SpectrumData {
        spectra = spectra.stream().map(List::copyOf).toList();
    }

    public static SpectrumData empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return spectra.isEmpty();
    }

    public int numWindows() {
        return spectra.size();
    }

    public int numPols(int window) {
        return spectra.get(window).size();
    }

    public AmpPhase get(int window, int pol) {
        return spectra.get(window).get(pol);
    }

    public double mjd() {
        if (isEmpty() || spectra.get(0).isEmpty()) {
            return 0;
        }
        return spectra.get(0).get(0).mjd();
    }
}
