package visconnect.output;

import java.util.List;

/**
 * Everything a renderer needs for one drawing.
 */
public record PlotModel(List<PlotSeries> series, List<AxisRange> ranges, PlotDecorations decorations) {

    public PlotModel {
        series = List.copyOf(series);
        ranges = List.copyOf(ranges);
    }

    public boolean isEmpty() {
        return series.isEmpty();
    }
}
