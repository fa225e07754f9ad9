package visconnect.output;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What a viewer has chosen to display.
 *
 * @param products windows and polarisations to show
 * @param antennas antennas whose baselines are shown; empty for all
 * @param historyMinutes length of the time window
 * @param historyOffsetMinutes how far before the latest cycle the window ends
 * @param panels panels to draw, in order
 * @param scales manual y limits by panel; panels without one scale automatically
 * @param sortByLength order baselines by length rather than number
 */
public record PlotSelection(List<PlotProduct> products, Set<Integer> antennas, double historyMinutes,
                            double historyOffsetMinutes, List<PanelType> panels,
                            Map<PanelType, float[]> scales, boolean sortByLength) {

    public PlotSelection {
        products = List.copyOf(products);
        antennas = Set.copyOf(antennas);
        panels = List.copyOf(panels);
        scales = Map.copyOf(scales);
    }

    public boolean includesBaseline(int ant1, int ant2) {
        return antennas.isEmpty() || (antennas.contains(ant1) && antennas.contains(ant2));
    }
}
