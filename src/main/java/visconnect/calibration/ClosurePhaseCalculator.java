package visconnect.calibration;

import visconnect.domain.AmpPhaseOptions;
import visconnect.domain.Baselines;
import visconnect.domain.VisData;
import visconnect.domain.VisQuantities;

/**
 * Replaces baseline phases with closure phases around a reference antenna.
 * <p>
 * For a baseline i-j the closure phase is the sum of the phases around the
 * triangle i, j, ref. Baselines involving the reference antenna, and
 * autocorrelations, have a closure phase of zero. The transform is a pure
 * function of its input.
 */
public class ClosurePhaseCalculator {

    public VisData apply(VisData data, int refant) {
        return data.map(q -> closure(q, refant));
    }

    VisQuantities closure(VisQuantities q, int refant) {
        AmpPhaseOptions options = q.options();
        boolean degrees = options == null || options.isPhaseInDegrees();
        float[][] phase = q.phase();
        float[][] closure = new float[q.numBaselines()][];
        for (int i = 0; i < q.numBaselines(); i++) {
            int baseline = q.baseline()[i];
            int a1 = Baselines.firstAntenna(baseline);
            int a2 = Baselines.secondAntenna(baseline);
            closure[i] = new float[phase[i].length];
            if (a1 == a2 || a1 == refant || a2 == refant) {
                continue;
            }
            int toFirst = q.baselineIndex(Baselines.toBaseline(refant, a1));
            int toSecond = q.baselineIndex(Baselines.toBaseline(refant, a2));
            if (toFirst < 0 || toSecond < 0) {
                continue;
            }
            for (int b = 0; b < closure[i].length; b++) {
                double sum = phase[i][b]
                        + oriented(phase, toSecond, b, a2, refant)
                        + oriented(phase, toFirst, b, refant, a1);
                closure[i][b] = wrap(sum, degrees);
            }
        }
        return q.withPhases(closure);
    }

    /**
     * Phase of the baseline from antenna {@code from} to antenna {@code to};
     * stored baselines run from the lower antenna, so the reverse direction
     * negates the phase.
     */
    private static double oriented(float[][] phase, int index, int bin, int from, int to) {
        float[] bins = phase[index];
        float value = bins.length == 0 ? 0f : bins[Math.min(bin, bins.length - 1)];
        return from < to ? value : -value;
    }

    private static float wrap(double value, boolean degrees) {
        double turn = degrees ? 360.0 : 2 * Math.PI;
        double half = turn / 2;
        double wrapped = value % turn;
        if (wrapped > half) {
            wrapped -= turn;
        } else if (wrapped <= -half) {
            wrapped += turn;
        }
        return (float) wrapped;
    }
}
