package visconnect.output;

/**
 * Axis limits of one panel.
 */
public record AxisRange(PanelType panel, double xMin, double xMax, float yMin, float yMax) {
}
