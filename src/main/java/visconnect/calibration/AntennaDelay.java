package visconnect.calibration;

import visconnect.domain.Polarisation;

/**
 * Measured delay of one antenna feed relative to the reference antenna.
 *
 * @param antenna 1-based antenna number
 * @param window 0-based window index
 * @param feed X or Y
 * @param delayNs the cycle-averaged delay in nanoseconds
 * @param cycles cycles that contributed
 */
public record AntennaDelay(int antenna, int window, Polarisation feed, float delayNs, int cycles) {
}
