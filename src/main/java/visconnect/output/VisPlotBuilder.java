package visconnect.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visconnect.domain.AmpPhase;
import visconnect.domain.Baselines;
import visconnect.domain.BinSpectrum;
import visconnect.domain.Mjd;
import visconnect.domain.ScanHeader;
import visconnect.domain.SpectrumData;
import visconnect.domain.VisCycle;
import visconnect.domain.VisData;
import visconnect.domain.VisQuantities;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns reduced data and a selection into numeric series ready to draw.
 * <p>
 * Time series are plotted against minutes before the latest cycle; spectra
 * against channel number. Flagged points are left out. Panels without a
 * manual scale get limits from the data they show.
 */
public class VisPlotBuilder {
    private static final Logger logger = LoggerFactory.getLogger(VisPlotBuilder.class);

    private static final double MINUTES_PER_DAY = 1440.0;

    /**
     * Build amplitude, phase and delay time series.
     *
     * @param data the averaged products, latest cycle last
     * @param selection what to show
     * @return the plot, empty if nothing matches the selection
     */
    public PlotModel timeSeries(VisData data, PlotSelection selection) {
        if (data.isEmpty()) {
            return emptyModel("No data", "Minutes before latest cycle");
        }
        double latest = data.cycle(data.numCycles() - 1).mjd();
        double end = latest - selection.historyOffsetMinutes() / MINUTES_PER_DAY;
        double start = end - selection.historyMinutes() / MINUTES_PER_DAY;

        List<Integer> cycles = new ArrayList<>();
        for (int c = 0; c < data.numCycles(); c++) {
            double mjd = data.cycle(c).mjd();
            if (mjd >= start && mjd <= end) {
                cycles.add(c);
            }
        }

        ScanHeader header = data.latestHeader();
        List<PlotSeries> series = new ArrayList<>();
        for (PanelType panel : selection.panels()) {
            for (PlotProduct product : selection.products()) {
                for (int baseline : baselines(data, cycles, product, selection, header)) {
                    PlotSeries s = timeSeries(data, cycles, product, baseline, panel, latest);
                    if (s.size() > 0) {
                        series.add(s);
                    }
                }
            }
        }
        logger.debug("Built {} time series from {} cycles", series.size(), cycles.size());

        double xMin = -(selection.historyOffsetMinutes() + selection.historyMinutes());
        double xMax = -selection.historyOffsetMinutes();
        PlotDecorations decorations = new PlotDecorations(title(header, latest),
                "Minutes before latest cycle", productNotes(selection));
        return new PlotModel(series, ranges(series, selection, xMin, xMax), decorations);
    }

    /**
     * Build amplitude and phase spectra of one cycle.
     */
    public PlotModel spectra(SpectrumData data, PlotSelection selection) {
        if (data.isEmpty()) {
            return emptyModel("No spectrum", "Channel");
        }
        ScanHeader header = data.header();
        List<PlotSeries> series = new ArrayList<>();
        double xMin = Double.POSITIVE_INFINITY;
        double xMax = Double.NEGATIVE_INFINITY;
        for (PanelType panel : selection.panels()) {
            if (panel == PanelType.DELAY) {
                continue;
            }
            for (PlotProduct product : selection.products()) {
                AmpPhase ap = find(data, product);
                if (ap == null) {
                    continue;
                }
                List<Integer> order = new ArrayList<>();
                for (int baseline : ap.baseline()) {
                    if (!Baselines.isAutocorrelation(baseline) && selection.includesBaseline(
                            Baselines.firstAntenna(baseline), Baselines.secondAntenna(baseline))) {
                        order.add(baseline);
                    }
                }
                order.sort(baselineOrder(header, selection.sortByLength()));
                for (int baseline : order) {
                    BinSpectrum s = ap.spectrum(ap.baselineIndex(baseline), 0);
                    int n = s.numFilteredChannels();
                    double[] x = new double[n];
                    float[] y = new float[n];
                    for (int k = 0; k < n; k++) {
                        x[k] = s.filteredChannel()[k];
                        y[k] = panel == PanelType.AMPLITUDE ? s.filteredAmplitude()[k] : s.filteredPhase()[k];
                    }
                    if (n > 0) {
                        xMin = Math.min(xMin, x[0]);
                        xMax = Math.max(xMax, x[n - 1]);
                        series.add(new PlotSeries(panel, seriesLabel(baseline, product), x, y));
                    }
                }
            }
        }
        if (series.isEmpty()) {
            xMin = 0;
            xMax = 1;
        }
        PlotDecorations decorations = new PlotDecorations(title(header, data.mjd()), "Channel",
                productNotes(selection));
        return new PlotModel(series, ranges(series, selection, xMin, xMax), decorations);
    }

    private static PlotSeries timeSeries(VisData data, List<Integer> cycles, PlotProduct product, int baseline,
                                         PanelType panel, double latest) {
        double[] x = new double[cycles.size()];
        float[] y = new float[cycles.size()];
        int n = 0;
        for (int c : cycles) {
            VisCycle cycle = data.cycle(c);
            VisQuantities q = cycle.find(product.window(), product.pol());
            if (q == null) {
                continue;
            }
            int idx = q.baselineIndex(baseline);
            if (idx < 0 || q.isFlagged(idx) || q.numBins(idx) == 0) {
                continue;
            }
            float value = switch (panel) {
                case AMPLITUDE -> q.amplitude()[idx][0];
                case PHASE -> q.phase()[idx][0];
                case DELAY -> q.delay()[idx][0];
            };
            if (Float.isNaN(value)) {
                continue;
            }
            x[n] = (cycle.mjd() - latest) * MINUTES_PER_DAY;
            y[n] = value;
            n++;
        }
        return new PlotSeries(panel, seriesLabel(baseline, product),
                Arrays.copyOf(x, n), Arrays.copyOf(y, n));
    }

    private static List<Integer> baselines(VisData data, List<Integer> cycles, PlotProduct product,
                                           PlotSelection selection, ScanHeader header) {
        Set<Integer> found = new LinkedHashSet<>();
        for (int c : cycles) {
            VisQuantities q = data.cycle(c).find(product.window(), product.pol());
            if (q == null) {
                continue;
            }
            for (int baseline : q.baseline()) {
                if (!Baselines.isAutocorrelation(baseline) && selection.includesBaseline(
                        Baselines.firstAntenna(baseline), Baselines.secondAntenna(baseline))) {
                    found.add(baseline);
                }
            }
        }
        List<Integer> ordered = new ArrayList<>(found);
        ordered.sort(baselineOrder(header, selection.sortByLength()));
        return ordered;
    }

    static Comparator<Integer> baselineOrder(ScanHeader header, boolean byLength) {
        Comparator<Integer> numeric = Comparator.naturalOrder();
        if (!byLength || header == null) {
            return numeric;
        }
        Comparator<Integer> length = Comparator.comparingDouble(
                b -> header.baselineLength(Baselines.firstAntenna(b), Baselines.secondAntenna(b)));
        return length.thenComparing(numeric);
    }

    private static AmpPhase find(SpectrumData data, PlotProduct product) {
        for (List<AmpPhase> pols : data.spectra()) {
            for (AmpPhase ap : pols) {
                if (ap.window() == product.window() && ap.pol() == product.pol()) {
                    return ap;
                }
            }
        }
        return null;
    }

    /**
     * One range per panel that has series, plus every manually scaled panel.
     */
    static List<AxisRange> ranges(List<PlotSeries> series, PlotSelection selection, double xMin, double xMax) {
        Map<PanelType, float[]> limits = new EnumMap<>(PanelType.class);
        for (PlotSeries s : series) {
            float[] l = limits.computeIfAbsent(s.panel(),
                    p -> new float[]{Float.POSITIVE_INFINITY, Float.NEGATIVE_INFINITY});
            for (float v : s.y()) {
                if (!Float.isNaN(v)) {
                    l[0] = Math.min(l[0], v);
                    l[1] = Math.max(l[1], v);
                }
            }
        }
        List<AxisRange> ranges = new ArrayList<>();
        for (PanelType panel : selection.panels()) {
            float[] manual = selection.scales().get(panel);
            float[] auto = limits.get(panel);
            if (manual != null) {
                ranges.add(new AxisRange(panel, xMin, xMax, manual[0], manual[1]));
            } else if (auto != null && auto[0] <= auto[1]) {
                float pad = auto[0] == auto[1] ? 1f : 0f;
                ranges.add(new AxisRange(panel, xMin, xMax, auto[0] - pad, auto[1] + pad));
            }
        }
        return ranges;
    }

    private static String seriesLabel(int baseline, PlotProduct product) {
        return Baselines.label(baseline) + " " + product.label();
    }

    private static List<String> productNotes(PlotSelection selection) {
        List<String> notes = new ArrayList<>();
        for (PlotProduct product : selection.products()) {
            notes.add(product.label() + ": window " + (product.window() + 1) + " " + product.pol().label().trim());
        }
        return notes;
    }

    private static String title(ScanHeader header, double mjd) {
        if (header == null) {
            return String.format("MJD %.5f", mjd);
        }
        double ut = Mjd.daysToSeconds(mjd - Math.floor(mjd));
        int seconds = (int) Math.round(ut);
        return String.format("%s (%s) %s %02d:%02d:%02d", header.sourceName().trim(), header.obsType().trim(),
                header.obsDate().trim(), seconds / 3600 % 24, seconds / 60 % 60, seconds % 60);
    }

    private static PlotModel emptyModel(String title, String xLabel) {
        return new PlotModel(List.of(), List.of(), new PlotDecorations(title, xLabel, List.of()));
    }
}
