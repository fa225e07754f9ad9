package visconnect.output;

import visconnect.domain.Polarisation;

/**
 * A window and polarisation to plot, with its legend name.
 */
public record PlotProduct(int window, Polarisation pol, String label) {
}
