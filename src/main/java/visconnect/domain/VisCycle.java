package visconnect.domain;

import java.util.List;

/**
 * Averaged products of one cycle, indexed {@code [window][pol]}. Different
 * cycles may have different window and polarisation counts.
 *
 * @param mjd the cycle time
 * @param headerIndex index of the cycle's scan header in the owning {@link VisData}
 * @param windows one list of polarisation products per active window
 */
public record VisCycle(double mjd, int headerIndex, List<List<VisQuantities>> windows) {

    public VisCycle {
        windows = windows.stream().map(List::copyOf).toList();
    }

    public int numWindows() {
        return windows.size();
    }

    public int numPols(int window) {
        return windows.get(window).size();
    }

    public VisQuantities get(int window, int pol) {
        return windows.get(window).get(pol);
    }

    /**
     * Find the product for a window number and polarisation.
     *
     * @return the product or null if the cycle lacks it
     */
    public VisQuantities find(int window, Polarisation pol) {
        for (List<VisQuantities> pols : windows) {
            for (VisQuantities q : pols) {
                if (q.window() == window && q.pol() == pol) {
                    return q;
                }
            }
        }
        return null;
    }
}
