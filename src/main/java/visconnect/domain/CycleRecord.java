package visconnect.domain;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One correlator dump: every baseline/window/bin sample recorded at one time.
 * Consumed by the reducer and discarded.
 */
public record CycleRecord(
        float utSeconds,
        List<Point> points,
        List<SystemTemperature> systemTemperatures
) {
    public CycleRecord {
        points = List.copyOf(points);
        systemTemperatures = List.copyOf(systemTemperatures);
    }

    /**
     * Baseline numbers in the order they first appear in this cycle.
     */
    public List<Integer> baselines() {
        Set<Integer> seen = new LinkedHashSet<>();
        for (Point p : points) {
            seen.add(Baselines.toBaseline(p.ant1(), p.ant2()));
        }
        return new ArrayList<>(seen);
    }

    public double mjd(String obsDate) {
        return Mjd.fromObsDate(obsDate, utSeconds);
    }

    /**
     * Find the system temperature record for an antenna feed.
     *
     * @return the record, or null if the cycle carries none for that feed
     */
    public SystemTemperature systemTemperature(int antenna, int window, Polarisation feed) {
        for (SystemTemperature t : systemTemperatures) {
            if (t.antenna() == antenna && t.window() == window && t.feed() == feed) {
                return t;
            }
        }
        return null;
    }

    /**
     * Raw samples for one baseline, window and bin.
     *
     * @param vis interleaved (real, imaginary) samples, channel-major then stokes
     * @param weight one weight per complex sample
     */
    public record Point(
            int ant1,
            int ant2,
            int window,
            int bin,
            boolean flagged,
            float u,
            float v,
            float w,
            float[] vis,
            float[] weight
    ) {
        public Point {
            if (vis.length != 2 * weight.length) {
                throw new IllegalArgumentException("Expected " + 2 * weight.length
                        + " visibility floats, got " + vis.length);
            }
        }

        public int baseline() {
            return Baselines.toBaseline(ant1, ant2);
        }
    }

    /**
     * System temperatures of one antenna feed: the value applied online and
     * the value computed from the noise-diode bins.
     */
    public record SystemTemperature(int antenna, int window, Polarisation feed, float online, float computed) {
    }
}
