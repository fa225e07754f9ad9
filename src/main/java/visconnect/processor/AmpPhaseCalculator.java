package visconnect.processor;

import visconnect.domain.AmpPhase;
import visconnect.domain.AmpPhaseOptions;
import visconnect.domain.BinSpectrum;
import visconnect.domain.CycleRecord;
import visconnect.domain.IfWindow;
import visconnect.domain.Polarisation;
import visconnect.domain.ScanHeader;
import visconnect.domain.TsysCorrection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes per-channel amplitude, phase and raw complex spectra of one
 * window and polarisation of a cycle.
 * <p>
 * Delay corrections from the options rotate each cross-correlation by
 * {@code exp(i 2 pi f (d2 - d1))}; system temperature scaling is applied
 * per baseline. A channel enters the filtered arrays only when its weight is
 * positive, its value is a number, and its point is unflagged or flagged
 * data is included.
 */
public class AmpPhaseCalculator {

    /**
     * @return the spectra, or null when the window does not exist or the
     * polarisation was not recorded
     */
    public AmpPhase compute(ScanHeader header, CycleRecord cycle, int window, Polarisation pol,
                            AmpPhaseOptions options) {
        if (window < 0 || window >= header.numWindows()) {
            return null;
        }
        IfWindow win = header.window(window);
        int stokes = win.stokesIndex(pol);
        if (stokes < 0) {
            return null;
        }
        int nchan = win.numChannels();
        int nstokes = win.numStokes();
        double mjd = cycle.mjd(header.obsDate());

        int[] channel = new int[nchan];
        float[] frequency = new float[nchan];
        for (int c = 0; c < nchan; c++) {
            channel[c] = c + 1;
            frequency[c] = (float) win.channelFrequencyGhz(c + 1);
        }

        Map<Integer, List<CycleRecord.Point>> byBaseline = new LinkedHashMap<>();
        for (CycleRecord.Point p : cycle.points()) {
            if (p.window() == window) {
                byBaseline.computeIfAbsent(p.baseline(), k -> new ArrayList<>()).add(p);
            }
        }

        int[] baseline = new int[byBaseline.size()];
        BinSpectrum[][] spectra = new BinSpectrum[baseline.length][];
        int i = 0;
        for (Map.Entry<Integer, List<CycleRecord.Point>> entry : byBaseline.entrySet()) {
            baseline[i] = entry.getKey();
            int nbins = 0;
            for (CycleRecord.Point p : entry.getValue()) {
                nbins = Math.max(nbins, p.bin() + 1);
            }
            spectra[i] = new BinSpectrum[nbins];
            for (CycleRecord.Point p : entry.getValue()) {
                if (p.bin() >= 0 && p.weight().length >= nchan * nstokes) {
                    spectra[i][p.bin()] = binSpectrum(p, cycle, window, pol, stokes, nstokes,
                            frequency, mjd, options);
                }
            }
            for (int b = 0; b < nbins; b++) {
                if (spectra[i][b] == null) {
                    spectra[i][b] = emptyBin(nchan);
                }
            }
            i++;
        }

        return AmpPhase.withComputedRanges(channel, frequency, baseline, pol, window, win.label(),
                header.obsDate(), cycle.utSeconds(), header.obsType(), spectra, options);
    }

    /**
     * Every recorded polarisation of every window of a cycle, indexed [window][pol].
     */
    public List<List<AmpPhase>> computeAll(ScanHeader header, CycleRecord cycle, AmpPhaseOptions options) {
        List<List<AmpPhase>> windows = new ArrayList<>(header.numWindows());
        for (int w = 0; w < header.numWindows(); w++) {
            List<AmpPhase> pols = new ArrayList<>();
            for (String name : header.window(w).stokesNames()) {
                Polarisation pol = Polarisation.fromLabel(name);
                if (pol == null) {
                    continue;
                }
                AmpPhase ap = compute(header, cycle, w, pol, options);
                if (ap != null) {
                    pols.add(ap);
                }
            }
            windows.add(pols);
        }
        return windows;
    }

    private BinSpectrum binSpectrum(CycleRecord.Point p, CycleRecord cycle, int window,
                                    Polarisation pol, int stokes, int nstokes, float[] frequency, double mjd,
                                    AmpPhaseOptions options) {
        int nchan = frequency.length;
        boolean cross = p.ant1() != p.ant2();
        double delayDiff = 0;
        if (cross) {
            delayDiff = options.delayCorrection(p.ant2(), window, pol.secondFeed(), mjd)
                    - options.delayCorrection(p.ant1(), window, pol.firstFeed(), mjd);
        }
        float scale = tsysScale(cycle, p, window, pol, options.getTsysCorrection());

        float[] weight = new float[nchan];
        float[] amplitude = new float[nchan];
        float[] phase = new float[nchan];
        float[] raw = new float[2 * nchan];
        int[] fch = new int[nchan];
        float[] ffreq = new float[nchan];
        float[] fweight = new float[nchan];
        float[] famp = new float[nchan];
        float[] fphase = new float[nchan];
        float[] fraw = new float[2 * nchan];
        int fn = 0;
        boolean usable = !p.flagged() || options.isIncludeFlaggedData();

        for (int c = 0; c < nchan; c++) {
            int vidx = stokes + c * nstokes;
            double re = p.vis()[2 * vidx];
            double im = p.vis()[2 * vidx + 1];
            if (delayDiff != 0) {
                double theta = 2 * Math.PI * frequency[c] * delayDiff;
                double cos = Math.cos(theta);
                double sin = Math.sin(theta);
                double r = re * cos - im * sin;
                im = re * sin + im * cos;
                re = r;
            }
            re *= scale;
            im *= scale;

            weight[c] = p.weight()[vidx];
            raw[2 * c] = (float) re;
            raw[2 * c + 1] = (float) im;
            amplitude[c] = (float) Math.hypot(re, im);
            double ph = Math.atan2(im, re);
            phase[c] = (float) (options.isPhaseInDegrees() ? Math.toDegrees(ph) : ph);

            if (usable && weight[c] > 0 && !Float.isNaN(amplitude[c]) && !Float.isNaN(phase[c])) {
                fch[fn] = c + 1;
                ffreq[fn] = frequency[c];
                fweight[fn] = weight[c];
                famp[fn] = amplitude[c];
                fphase[fn] = phase[c];
                fraw[2 * fn] = raw[2 * c];
                fraw[2 * fn + 1] = raw[2 * c + 1];
                fn++;
            }
        }

        return new BinSpectrum(p.flagged(), weight, amplitude, phase, raw,
                Arrays.copyOf(fch, fn), Arrays.copyOf(ffreq, fn),
                Arrays.copyOf(fweight, fn), Arrays.copyOf(famp, fn),
                Arrays.copyOf(fphase, fn), Arrays.copyOf(fraw, 2 * fn));
    }

    /**
     * Factor applied to a baseline's correlations for a tsys correction
     * mode. The online scaling multiplied correlation coefficients by
     * {@code sqrt(T1 T2)}; missing or non-positive temperatures leave the
     * data unscaled.
     */
    static float tsysScale(CycleRecord cycle, CycleRecord.Point p, int window, Polarisation pol,
                           TsysCorrection mode) {
        if (mode == TsysCorrection.ONLINE) {
            return 1f;
        }
        CycleRecord.SystemTemperature t1 = cycle.systemTemperature(p.ant1(), window, pol.firstFeed());
        CycleRecord.SystemTemperature t2 = cycle.systemTemperature(p.ant2(), window, pol.secondFeed());
        if (t1 == null || t2 == null || t1.online() <= 0 || t2.online() <= 0) {
            return 1f;
        }
        double online = Math.sqrt((double) t1.online() * t2.online());
        if (mode == TsysCorrection.REVERSE_ONLINE) {
            return (float) (1.0 / online);
        }
        if (t1.computed() <= 0 || t2.computed() <= 0) {
            return 1f;
        }
        return (float) (Math.sqrt((double) t1.computed() * t2.computed()) / online);
    }

    private static BinSpectrum emptyBin(int nchan) {
        return new BinSpectrum(true, new float[nchan], new float[nchan], new float[nchan], new float[2 * nchan],
                new int[0], new float[0], new float[0], new float[0], new float[0], new float[0]);
    }
}
