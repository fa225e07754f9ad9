package visconnect.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A time series of averaged products: cycles x windows x polarisations,
 * ragged in the last two dimensions. Scan headers are held once and
 * referenced by index from each cycle.
 */
public record VisData(List<ScanHeader> headers, List<VisCycle> cycles) {

    private static final VisData EMPTY = new VisData(List.of(), List.of());

    public VisData {
        headers = List.copyOf(headers);
        cycles = List.copyOf(cycles);
        for (VisCycle cycle : cycles) {
            if (cycle.headerIndex() < 0 || cycle.headerIndex() >= headers.size()) {
                throw new IllegalArgumentException("Cycle references missing header " + cycle.headerIndex());
            }
        }
    }

    public static VisData empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return cycles.isEmpty();
    }

    public int numCycles() {
        return cycles.size();
    }

    public VisCycle cycle(int index) {
        return cycles.get(index);
    }

    public ScanHeader header(int cycleIndex) {
        return headers.get(cycles.get(cycleIndex).headerIndex());
    }

    /**
     * The number of windows of every cycle, in cycle order.
     */
    public int[] windowCounts() {
        int[] counts = new int[cycles.size()];
        for (int i = 0; i < counts.length; i++) {
            counts[i] = cycles.get(i).numWindows();
        }
        return counts;
    }

    /**
     * The header of the latest cycle, or null if there is no data.
     */
    public ScanHeader latestHeader() {
        return isEmpty() ? null : header(cycles.size() - 1);
    }

    /**
     * Copy of this data with every product passed through a transform.
     */
    public VisData map(UnaryOperator<VisQuantities> transform) {
        List<VisCycle> mapped = new ArrayList<>(cycles.size());
        for (VisCycle cycle : cycles) {
            List<List<VisQuantities>> windows = new ArrayList<>();
            for (List<VisQuantities> pols : cycle.windows()) {
                windows.add(pols.stream().map(transform).toList());
            }
            mapped.add(new VisCycle(cycle.mjd(), cycle.headerIndex(), windows));
        }
        return new VisData(headers, mapped);
    }
}
