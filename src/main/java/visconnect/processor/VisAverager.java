package visconnect.processor;

import visconnect.domain.AmpPhase;
import visconnect.domain.AmpPhaseOptions;
import visconnect.domain.AveragingMethod;
import visconnect.domain.BinSpectrum;
import visconnect.domain.VisQuantities;

/**
 * Averages per-channel spectra over the tv-channel window into one
 * amplitude, phase and delay per baseline and bin.
 * <p>
 * Vector averaging combines the complex values and takes amplitude and
 * phase of the result; scalar averaging combines amplitudes and phases
 * separately. The delay is the mean (or median) phase slope between
 * adjacent groups of {@code delayAveraging} channels, in nanoseconds.
 */
public class VisAverager {

    public VisQuantities average(AmpPhase ap, AmpPhaseOptions options) {
        int window = ap.window();
        int minTv = 1;
        int maxTv = ap.numChannels();
        if (window < options.numWindows()) {
            minTv = options.getMinTvChannel(window);
            maxTv = options.getMaxTvChannel(window);
        }
        AveragingMethod method = options.getAveragingMethod(window);
        int delayAveraging = options.getDelayAveraging(window);
        boolean degrees = options.isPhaseInDegrees();

        int nbl = ap.numBaselines();
        boolean[] flagged = new boolean[nbl];
        float[][] amplitude = new float[nbl][];
        float[][] phase = new float[nbl][];
        float[][] delay = new float[nbl][];
        for (int i = 0; i < nbl; i++) {
            int nbins = ap.numBins(i);
            amplitude[i] = new float[nbins];
            phase[i] = new float[nbins];
            delay[i] = new float[nbins];
            boolean anyData = false;
            for (int b = 0; b < nbins; b++) {
                Channels ch = Channels.select(ap.spectrum(i, b), minTv, maxTv);
                if (ch.count == 0) {
                    continue;
                }
                anyData = true;
                averageBin(ch, method, degrees, amplitude[i], phase[i], b);
                delay[i][b] = delay(ch, delayAveraging, method.statistic());
            }
            flagged[i] = !anyData;
        }

        return VisQuantities.withComputedRanges(ap.baseline(), ap.pol(), window, ap.obsDate(), ap.utSeconds(),
                ap.scanType(), flagged, amplitude, phase, delay, ap.options());
    }

    private static void averageBin(Channels ch, AveragingMethod method, boolean degrees,
                                   float[] amplitude, float[] phase, int bin) {
        boolean median = method.statistic() == AveragingMethod.Statistic.MEDIAN;
        if (method.combination() == AveragingMethod.Combination.VECTOR) {
            float re = median ? Statistics.median(ch.re.clone(), ch.count) : Statistics.mean(ch.re, ch.count);
            float im = median ? Statistics.median(ch.im.clone(), ch.count) : Statistics.mean(ch.im, ch.count);
            amplitude[bin] = (float) Math.hypot(re, im);
            double ph = Math.atan2(im, re);
            phase[bin] = (float) (degrees ? Math.toDegrees(ph) : ph);
        } else {
            amplitude[bin] = median ? Statistics.median(ch.amp.clone(), ch.count) : Statistics.mean(ch.amp, ch.count);
            phase[bin] = median ? Statistics.median(ch.phase.clone(), ch.count) : Statistics.mean(ch.phase, ch.count);
        }
    }

    /**
     * Phase slope across the band in nanoseconds: channels are combined in
     * groups, and the wrapped phase difference between adjacent groups is
     * divided by {@code 2 pi} times their frequency difference in GHz.
     */
    static float delay(Channels ch, int groupSize, AveragingMethod.Statistic statistic) {
        int size = Math.max(1, groupSize);
        int ngroups = (ch.count + size - 1) / size;
        if (ngroups < 2) {
            return 0f;
        }
        double[] groupPhase = new double[ngroups];
        double[] groupFreq = new double[ngroups];
        for (int g = 0; g < ngroups; g++) {
            double re = 0;
            double im = 0;
            double freq = 0;
            int n = 0;
            for (int k = g * size; k < Math.min(ch.count, (g + 1) * size); k++) {
                re += ch.re[k];
                im += ch.im[k];
                freq += ch.freq[k];
                n++;
            }
            groupPhase[g] = Math.atan2(im, re);
            groupFreq[g] = freq / n;
        }
        float[] slopes = new float[ngroups - 1];
        int nslopes = 0;
        for (int g = 1; g < ngroups; g++) {
            double df = groupFreq[g] - groupFreq[g - 1];
            if (df == 0) {
                continue;
            }
            double dphi = Statistics.wrapRadians(groupPhase[g] - groupPhase[g - 1]);
            slopes[nslopes++] = (float) (dphi / (2 * Math.PI * df));
        }
        return statistic == AveragingMethod.Statistic.MEDIAN
                ? Statistics.median(slopes, nslopes)
                : Statistics.mean(slopes, nslopes);
    }

    /**
     * The filtered channels of one bin that fall inside the tv window,
     * with phases in the units they were computed in.
     */
    static final class Channels {
        final float[] freq;
        final float[] re;
        final float[] im;
        final float[] amp;
        final float[] phase;
        final int count;

        private Channels(float[] freq, float[] re, float[] im, float[] amp, float[] phase, int count) {
            this.freq = freq;
            this.re = re;
            this.im = im;
            this.amp = amp;
            this.phase = phase;
            this.count = count;
        }

        static Channels select(BinSpectrum s, int minTv, int maxTv) {
            int fn = s.numFilteredChannels();
            float[] freq = new float[fn];
            float[] re = new float[fn];
            float[] im = new float[fn];
            float[] amp = new float[fn];
            float[] phase = new float[fn];
            int n = 0;
            for (int k = 0; k < fn; k++) {
                int channel = s.filteredChannel()[k];
                if (channel < minTv || channel > maxTv) {
                    continue;
                }
                freq[n] = s.filteredFrequency()[k];
                re[n] = s.filteredRaw()[2 * k];
                im[n] = s.filteredRaw()[2 * k + 1];
                amp[n] = s.filteredAmplitude()[k];
                phase[n] = s.filteredPhase()[k];
                n++;
            }
            return new Channels(freq, re, im, amp, phase, n);
        }
    }
}
