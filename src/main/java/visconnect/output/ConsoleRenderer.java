package visconnect.output;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Draws plots as text on a terminal: one line per series with its latest
 * value and extent, grouped by panel.
 */
public class ConsoleRenderer implements Renderer {

    private static final int COMPACT_SERIES_PER_PANEL = 5;

    private final PrintStream out;
    private final boolean verbose;
    private final boolean colorized;

    // ANSI color codes
    private static final class Colors {
        static final String RESET = "\u001B[0m";
        static final String BRIGHT = "\u001B[1m";
        static final String DIM = "\u001B[2m";
        static final String GREEN = "\u001B[32m";
        static final String YELLOW = "\u001B[33m";
        static final String MAGENTA = "\u001B[35m";
        static final String CYAN = "\u001B[36m";
    }

    /**
     * @param out where to print
     * @param verbose if true, list every series; if false, a few per panel
     * @param colorized if true, use ANSI colors
     */
    public ConsoleRenderer(PrintStream out, boolean verbose, boolean colorized) {
        this.out = Objects.requireNonNull(out, "out cannot be null");
        this.verbose = verbose;
        this.colorized = colorized;
    }

    public ConsoleRenderer(boolean colorized) {
        this(System.out, false, colorized);
    }

    @Override
    public void render(PlotModel model) {
        String cyan = color(Colors.CYAN);
        String bright = color(Colors.BRIGHT);
        String yellow = color(Colors.YELLOW);
        String dim = color(Colors.DIM);
        String reset = color(Colors.RESET);

        out.println(cyan + "━".repeat(60) + reset);
        out.println(bright + model.decorations().title() + reset);
        for (String note : model.decorations().notes()) {
            out.println(dim + "  " + note + reset);
        }
        if (model.isEmpty()) {
            out.println(yellow + "Nothing to plot" + reset);
        }
        for (AxisRange range : model.ranges()) {
            printPanel(model, range);
        }
        if (out.checkError()) {
            throw new IllegalStateException("Console output error: write failure");
        }
    }

    private void printPanel(PlotModel model, AxisRange range) {
        String magenta = color(Colors.MAGENTA);
        String dim = color(Colors.DIM);
        String reset = color(Colors.RESET);

        out.println(magenta + range.panel().axisLabel() + reset + dim
                + String.format(" [%.3f, %.3f] vs %s [%.2f, %.2f]", range.yMin(), range.yMax(),
                model.decorations().xLabel(), range.xMin(), range.xMax()) + reset);
        int shown = 0;
        int total = 0;
        for (PlotSeries series : model.series()) {
            if (series.panel() != range.panel()) {
                continue;
            }
            total++;
            if (verbose || shown < COMPACT_SERIES_PER_PANEL) {
                printSeries(series);
                shown++;
            }
        }
        if (total > shown) {
            out.println("  " + dim + "... and " + (total - shown) + " more" + reset);
        }
    }

    private void printSeries(PlotSeries series) {
        String green = color(Colors.GREEN);
        String bright = color(Colors.BRIGHT);
        String dim = color(Colors.DIM);
        String reset = color(Colors.RESET);

        float min = Float.POSITIVE_INFINITY;
        float max = Float.NEGATIVE_INFINITY;
        for (float v : series.y()) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        float last = series.y()[series.size() - 1];
        out.println("  " + green + series.label() + reset + " " + bright + String.format("%.3f", last) + reset
                + dim + String.format(" (%d points, %.3f to %.3f)", series.size(), min, max) + reset);
    }

    /**
     * Apply color if colorization is enabled.
     */
    private String color(String colorCode) {
        return colorized ? colorCode : "";
    }
}
