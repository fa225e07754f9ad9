package visconnect.output;

import java.util.Arrays;
import java.util.Objects;

/**
 * One line on one panel.
 *
 * @param panel the panel it belongs to
 * @param label legend text, e.g. "1-2 XX f1"
 * @param x abscissae
 * @param y ordinates, same length as {@code x}
 */
public record PlotSeries(PanelType panel, String label, double[] x, float[] y) {

    public PlotSeries {
        Objects.requireNonNull(panel, "panel cannot be null");
        if (x.length != y.length) {
            throw new IllegalArgumentException("Series " + label + " has " + x.length + " x and " + y.length + " y values");
        }
    }

    public int size() {
        return x.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PlotSeries that)) return false;
        return panel == that.panel && Objects.equals(label, that.label)
                && Arrays.equals(x, that.x) && Arrays.equals(y, that.y);
    }

    @Override
    public int hashCode() {
        return Objects.hash(panel, label, Arrays.hashCode(x), Arrays.hashCode(y));
    }

    @Override
    public String toString() {
        return "PlotSeries{" + panel + ", " + label + ", " + x.length + " points}";
    }
}
