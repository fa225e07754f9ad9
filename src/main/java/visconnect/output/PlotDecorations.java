package visconnect.output;

import java.util.List;

/**
 * Text drawn around the panels.
 *
 * @param title heading, usually source and time
 * @param xLabel abscissa label shared by every panel
 * @param notes extra lines such as the selected products
 */
public record PlotDecorations(String title, String xLabel, List<String> notes) {

    public PlotDecorations {
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
}
