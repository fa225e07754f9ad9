package visconnect.codec;

import visconnect.domain.AmpPhase;
import visconnect.domain.AmpPhaseOptions;
import visconnect.domain.AntennaPosition;
import visconnect.domain.AveragingMethod;
import visconnect.domain.BinSpectrum;
import visconnect.domain.DelayModifier;
import visconnect.domain.IfWindow;
import visconnect.domain.Polarisation;
import visconnect.domain.ScanHeader;
import visconnect.domain.SpectrumData;
import visconnect.domain.TsysCorrection;
import visconnect.domain.ValueRange;
import visconnect.domain.VisCycle;
import visconnect.domain.VisData;
import visconnect.domain.VisQuantities;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Encodes and decodes the reduction data structures as token streams.
 * <p>
 * Field order is fixed and both sides must agree on it. Shape information
 * (channel, baseline, bin, window and polarisation counts) is always written
 * before the payload it describes so that the reader can size and validate
 * every array it allocates.
 * <p>
 * Options objects that compare equal inside one decoded structure are
 * returned as a single shared instance, which mirrors how products made in
 * one reduction pass reference the same options.
 */
public final class DomainCodec {

    static final int STOKES_NAME_LENGTH = 2;
    static final int IF_NAME_LENGTH = 8;

    private DomainCodec() {
    }

    // ---- top level helpers -------------------------------------------------

    public static byte[] encode(VisData data) {
        WireWriter writer = new WireWriter();
        writeVisData(writer, data);
        return writer.toByteArray();
    }

    public static VisData decodeVisData(byte[] bytes) {
        WireReader reader = new WireReader(bytes);
        VisData data = readVisData(reader);
        reader.expectEnd();
        return data;
    }

    public static byte[] encode(SpectrumData data) {
        WireWriter writer = new WireWriter();
        writeSpectrumData(writer, data);
        return writer.toByteArray();
    }

    public static SpectrumData decodeSpectrumData(byte[] bytes) {
        WireReader reader = new WireReader(bytes);
        SpectrumData data = readSpectrumData(reader);
        reader.expectEnd();
        return data;
    }

    public static byte[] encode(AmpPhaseOptions options) {
        WireWriter writer = new WireWriter(256);
        writeOptions(writer, options);
        return writer.toByteArray();
    }

    public static AmpPhaseOptions decodeOptions(byte[] bytes) {
        WireReader reader = new WireReader(bytes);
        AmpPhaseOptions options = readOptions(reader);
        reader.expectEnd();
        return options;
    }

    // ---- scan header -------------------------------------------------------

    public static void writeScanHeader(WireWriter w, ScanHeader header) {
        w.writeString(header.obsDate(), ScanHeader.OBSDATE_LENGTH);
        w.writeFloat(header.utSeconds());
        w.writeString(header.obsType(), ScanHeader.OBSTYPE_LENGTH);
        w.writeString(header.calCode(), ScanHeader.CALCODE_LENGTH);
        w.writeInt(header.cycleTime());
        w.writeString(header.sourceName(), ScanHeader.SOURCE_LENGTH);
        w.writeFloat(header.rightAscensionHours());
        w.writeFloat(header.declinationDegrees());

        w.writeInt(header.numAntennas());
        for (AntennaPosition a : header.antennas()) {
            w.writeDouble(a.x());
            w.writeDouble(a.y());
            w.writeDouble(a.z());
        }

        w.writeInt(header.numWindows());
        for (IfWindow win : header.windows()) {
            w.writeDouble(win.centreFreqMhz());
            w.writeDouble(win.bandwidthMhz());
            w.writeInt(win.numChannels());
            w.writeInt(win.sideband());
            w.writeArrayHeader(win.stokesNames().size());
            for (String s : win.stokesNames()) {
                w.writeString(s, STOKES_NAME_LENGTH);
            }
            for (String name : win.names()) {
                w.writeString(name, IF_NAME_LENGTH);
            }
        }
    }

    public static ScanHeader readScanHeader(WireReader r) {
        String obsDate = r.readString(ScanHeader.OBSDATE_LENGTH);
        float ut = r.readFloat();
        String obsType = r.readString(ScanHeader.OBSTYPE_LENGTH);
        String calCode = r.readString(ScanHeader.CALCODE_LENGTH);
        int cycleTime = r.readInt();
        String source = r.readString(ScanHeader.SOURCE_LENGTH);
        float ra = r.readFloat();
        float dec = r.readFloat();

        int nant = readCount(r, "antenna", TokenType.DOUBLE);
        List<AntennaPosition> antennas = new ArrayList<>(nant);
        for (int i = 0; i < nant; i++) {
            antennas.add(new AntennaPosition(r.readDouble(), r.readDouble(), r.readDouble()));
        }

        int nwin = readCount(r, "window", TokenType.DOUBLE);
        List<IfWindow> windows = new ArrayList<>(nwin);
        for (int i = 0; i < nwin; i++) {
            double centre = r.readDouble();
            double bandwidth = r.readDouble();
            int nchan = r.readInt();
            int sideband = r.readInt();
            int nstokes = r.readArrayHeader(TokenType.STRING);
            List<String> stokes = new ArrayList<>(nstokes);
            for (int s = 0; s < nstokes; s++) {
                stokes.add(r.readString(STOKES_NAME_LENGTH));
            }
            List<String> names = new ArrayList<>(IfWindow.NUM_NAMES);
            for (int n = 0; n < IfWindow.NUM_NAMES; n++) {
                names.add(r.readString(IF_NAME_LENGTH));
            }
            windows.add(checked(() -> new IfWindow(centre, bandwidth, nchan, sideband, stokes, names)));
        }
        return checked(() -> new ScanHeader(obsDate, ut, obsType, calCode, cycleTime, source, ra, dec,
                antennas, windows));
    }

    // ---- options -----------------------------------------------------------

    public static void writeOptions(WireWriter w, AmpPhaseOptions options) {
        w.writeBool(options.isPhaseInDegrees());
        w.writeBool(options.isIncludeFlaggedData());
        w.writeInt(options.getTsysCorrection().ordinal());

        int nwin = options.numWindows();
        int[] delayAveraging = new int[nwin];
        int[] minTv = new int[nwin];
        int[] maxTv = new int[nwin];
        int[] averaging = new int[nwin];
        for (int i = 0; i < nwin; i++) {
            delayAveraging[i] = options.getDelayAveraging(i);
            minTv[i] = options.getMinTvChannel(i);
            maxTv[i] = options.getMaxTvChannel(i);
            averaging[i] = options.getAveragingMethod(i).toBits();
        }
        w.writeInt(nwin);
        w.writeIntArray(delayAveraging);
        w.writeIntArray(minTv);
        w.writeIntArray(maxTv);
        w.writeIntArray(averaging);

        List<DelayModifier> modifiers = options.getDelayModifiers();
        w.writeInt(modifiers.size());
        for (DelayModifier m : modifiers) {
            w.writeDouble(m.validFromMjd());
            w.writeDouble(m.validToMjd());
            w.writeInt(m.antenna());
            w.writeInt(m.window());
            w.writeInt(m.feed().code());
            w.writeFloat(m.delayNs());
        }
    }

    public static AmpPhaseOptions readOptions(WireReader r) {
        AmpPhaseOptions options = new AmpPhaseOptions();
        options.setPhaseInDegrees(r.readBool());
        options.setIncludeFlaggedData(r.readBool());
        options.setTsysCorrection(checked(() -> TsysCorrection.fromCode(r.readInt())));

        int nwin = readCount(r, "options window", TokenType.INT);
        int[] delayAveraging = r.readIntArray(nwin);
        int[] minTv = r.readIntArray(nwin);
        int[] maxTv = r.readIntArray(nwin);
        int[] averagingBits = r.readIntArray(nwin);
        AveragingMethod[] averaging = new AveragingMethod[nwin];
        for (int i = 0; i < nwin; i++) {
            int bits = averagingBits[i];
            averaging[i] = checked(() -> AveragingMethod.fromBits(bits));
        }
        options.setWindowSettings(delayAveraging, minTv, maxTv, averaging);

        int nmod = readCount(r, "delay modifier", TokenType.DOUBLE);
        List<DelayModifier> modifiers = new ArrayList<>(nmod);
        for (int i = 0; i < nmod; i++) {
            double from = r.readDouble();
            double to = r.readDouble();
            int antenna = r.readInt();
            int window = r.readInt();
            Polarisation feed = checked(() -> Polarisation.fromCode(r.readInt()));
            float delay = r.readFloat();
            modifiers.add(new DelayModifier(from, to, antenna, window, feed, delay));
        }
        options.addDelayModifiers(modifiers);
        return options;
    }

    // ---- per-channel spectra -----------------------------------------------

    public static void writeAmpPhase(WireWriter w, AmpPhase ap) {
        int nbl = ap.numBaselines();
        w.writeInt(ap.numChannels());
        w.writeInt(nbl);
        w.writeIntArray(ap.channel());
        w.writeFloatArray(ap.frequency());
        w.writeIntArray(ap.baseline());
        w.writeInt(ap.pol().code());
        w.writeInt(ap.window());
        w.writeString(ap.windowName(), AmpPhase.WINDOW_NAME_LENGTH);
        w.writeString(ap.obsDate(), ScanHeader.OBSDATE_LENGTH);
        w.writeFloat(ap.utSeconds());
        w.writeString(ap.scanType(), ScanHeader.OBSTYPE_LENGTH);

        int[] nbins = new int[nbl];
        for (int i = 0; i < nbl; i++) {
            nbins[i] = ap.numBins(i);
        }
        w.writeIntArray(nbins);
        for (int i = 0; i < nbl; i++) {
            boolean[] flagged = new boolean[nbins[i]];
            for (int b = 0; b < nbins[i]; b++) {
                flagged[b] = ap.spectrum(i, b).isFlagged();
            }
            w.writeBoolArray(flagged);
        }
        for (int i = 0; i < nbl; i++) {
            for (int b = 0; b < nbins[i]; b++) {
                BinSpectrum s = ap.spectrum(i, b);
                w.writeFloatArray(s.weight());
                w.writeFloatArray(s.amplitude());
                w.writeFloatArray(s.phase());
                w.writeComplexArray(s.raw());
            }
        }
        for (int i = 0; i < nbl; i++) {
            for (int b = 0; b < nbins[i]; b++) {
                BinSpectrum s = ap.spectrum(i, b);
                w.writeInt(s.numFilteredChannels());
                w.writeIntArray(s.filteredChannel());
                w.writeFloatArray(s.filteredFrequency());
                w.writeFloatArray(s.filteredWeight());
                w.writeFloatArray(s.filteredAmplitude());
                w.writeFloatArray(s.filteredPhase());
                w.writeComplexArray(s.filteredRaw());
            }
        }

        writeRange(w, ap.amplitudeRange());
        writeRange(w, ap.phaseRange());
        float[][] blRanges = new float[4][nbl];
        for (int i = 0; i < nbl; i++) {
            blRanges[0][i] = ap.baselineAmplitudeRange(i).min();
            blRanges[1][i] = ap.baselineAmplitudeRange(i).max();
            blRanges[2][i] = ap.baselinePhaseRange(i).min();
            blRanges[3][i] = ap.baselinePhaseRange(i).max();
        }
        for (float[] values : blRanges) {
            w.writeFloatArray(values);
        }

        writeOptionalOptions(w, ap.options());
    }

    public static AmpPhase readAmpPhase(WireReader r) {
        return readAmpPhase(r, new OptionsPool());
    }

    static AmpPhase readAmpPhase(WireReader r, OptionsPool pool) {
        int nchan = readCount(r, "channel", TokenType.INT);
        int nbl = readCount(r, "baseline", TokenType.INT);
        int[] channel = r.readIntArray(nchan);
        float[] frequency = r.readFloatArray(nchan);
        int[] baseline = r.readIntArray(nbl);
        Polarisation pol = checked(() -> Polarisation.fromCode(r.readInt()));
        int window = r.readInt();
        String windowName = r.readString(AmpPhase.WINDOW_NAME_LENGTH);
        String obsDate = r.readString(ScanHeader.OBSDATE_LENGTH);
        float ut = r.readFloat();
        String scanType = r.readString(ScanHeader.OBSTYPE_LENGTH);

        int[] nbins = r.readIntArray(nbl);
        boolean[][] flagged = new boolean[nbl][];
        for (int i = 0; i < nbl; i++) {
            if (nbins[i] < 0) {
                throw new CodecException("Negative bin count " + nbins[i]);
            }
            flagged[i] = r.readBoolArray(nbins[i]);
        }
        float[][][][] channelData = new float[nbl][][][];
        for (int i = 0; i < nbl; i++) {
            channelData[i] = new float[nbins[i]][][];
            for (int b = 0; b < nbins[i]; b++) {
                channelData[i][b] = new float[][]{
                        r.readFloatArray(nchan),
                        r.readFloatArray(nchan),
                        r.readFloatArray(nchan),
                        r.readComplexArray(nchan)
                };
            }
        }
        BinSpectrum[][] spectra = new BinSpectrum[nbl][];
        for (int i = 0; i < nbl; i++) {
            spectra[i] = new BinSpectrum[nbins[i]];
            for (int b = 0; b < nbins[i]; b++) {
                int fn = r.readInt();
                if (fn < 0 || fn > nchan) {
                    throw new CodecException("Filtered channel count " + fn + " outside 0.." + nchan);
                }
                int[] fch = r.readIntArray(fn);
                float[] ffreq = r.readFloatArray(fn);
                float[] fweight = r.readFloatArray(fn);
                float[] famp = r.readFloatArray(fn);
                float[] fphase = r.readFloatArray(fn);
                float[] fraw = r.readComplexArray(fn);
                float[][] c = channelData[i][b];
                spectra[i][b] = new BinSpectrum(flagged[i][b], c[0], c[1], c[2], c[3],
                        fch, ffreq, fweight, famp, fphase, fraw);
            }
        }

        ValueRange amplitudeRange = readRange(r);
        ValueRange phaseRange = readRange(r);
        float[] ampMin = r.readFloatArray(nbl);
        float[] ampMax = r.readFloatArray(nbl);
        float[] phaMin = r.readFloatArray(nbl);
        float[] phaMax = r.readFloatArray(nbl);
        ValueRange[] blAmp = new ValueRange[nbl];
        ValueRange[] blPha = new ValueRange[nbl];
        for (int i = 0; i < nbl; i++) {
            blAmp[i] = new ValueRange(ampMin[i], ampMax[i]);
            blPha[i] = new ValueRange(phaMin[i], phaMax[i]);
        }

        AmpPhaseOptions options = readOptionalOptions(r, pool);
        return new AmpPhase(channel, frequency, baseline, pol, window, windowName, obsDate, ut, scanType,
                spectra, amplitudeRange, phaseRange, blAmp, blPha, options);
    }

    public static void writeSpectrumData(WireWriter w, SpectrumData data) {
        w.writeBool(data.header() != null);
        if (data.header() != null) {
            writeScanHeader(w, data.header());
        }
        int nwin = data.numWindows();
        int[] npols = new int[nwin];
        for (int i = 0; i < nwin; i++) {
            npols[i] = data.numPols(i);
        }
        w.writeInt(nwin);
        w.writeIntArray(npols);
        for (List<AmpPhase> pols : data.spectra()) {
            for (AmpPhase ap : pols) {
                writeAmpPhase(w, ap);
            }
        }
    }

    public static SpectrumData readSpectrumData(WireReader r) {
        ScanHeader header = r.readBool() ? readScanHeader(r) : null;
        int nwin = readCount(r, "spectrum window", TokenType.INT);
        int[] npols = r.readIntArray(nwin);
        OptionsPool pool = new OptionsPool();
        List<List<AmpPhase>> spectra = new ArrayList<>(nwin);
        for (int i = 0; i < nwin; i++) {
            int n = checkCount(npols[i], r, "spectrum polarisation");
            List<AmpPhase> pols = new ArrayList<>(n);
            for (int p = 0; p < n; p++) {
                pols.add(readAmpPhase(r, pool));
            }
            spectra.add(pols);
        }
        return new SpectrumData(header, spectra);
    }

    // ---- averaged products -------------------------------------------------

    public static void writeVisQuantities(WireWriter w, VisQuantities q) {
        int nbl = q.numBaselines();
        w.writeInt(nbl);
        w.writeIntArray(q.baseline());
        w.writeInt(q.pol().code());
        w.writeInt(q.window());
        w.writeString(q.obsDate(), ScanHeader.OBSDATE_LENGTH);
        w.writeFloat(q.utSeconds());
        w.writeString(q.scanType(), ScanHeader.OBSTYPE_LENGTH);
        w.writeBoolArray(q.flagged());
        int[] nbins = new int[nbl];
        for (int i = 0; i < nbl; i++) {
            nbins[i] = q.numBins(i);
        }
        w.writeIntArray(nbins);
        for (int i = 0; i < nbl; i++) {
            w.writeFloatArray(q.amplitude()[i]);
            w.writeFloatArray(q.phase()[i]);
            w.writeFloatArray(q.delay()[i]);
        }
        writeRange(w, q.amplitudeRange());
        writeRange(w, q.phaseRange());
        writeRange(w, q.delayRange());
        writeOptionalOptions(w, q.options());
    }

    public static VisQuantities readVisQuantities(WireReader r) {
        return readVisQuantities(r, new OptionsPool());
    }

    static VisQuantities readVisQuantities(WireReader r, OptionsPool pool) {
        int nbl = readCount(r, "baseline", TokenType.INT);
        int[] baseline = r.readIntArray(nbl);
        Polarisation pol = checked(() -> Polarisation.fromCode(r.readInt()));
        int window = r.readInt();
        String obsDate = r.readString(ScanHeader.OBSDATE_LENGTH);
        float ut = r.readFloat();
        String scanType = r.readString(ScanHeader.OBSTYPE_LENGTH);
        boolean[] flagged = r.readBoolArray(nbl);
        int[] nbins = r.readIntArray(nbl);
        float[][] amplitude = new float[nbl][];
        float[][] phase = new float[nbl][];
        float[][] delay = new float[nbl][];
        for (int i = 0; i < nbl; i++) {
            if (nbins[i] < 0) {
                throw new CodecException("Negative bin count " + nbins[i]);
            }
            amplitude[i] = r.readFloatArray(nbins[i]);
            phase[i] = r.readFloatArray(nbins[i]);
            delay[i] = r.readFloatArray(nbins[i]);
        }
        ValueRange amplitudeRange = readRange(r);
        ValueRange phaseRange = readRange(r);
        ValueRange delayRange = readRange(r);
        AmpPhaseOptions options = readOptionalOptions(r, pool);
        return new VisQuantities(baseline, pol, window, obsDate, ut, scanType, flagged, amplitude, phase,
                delay, amplitudeRange, phaseRange, delayRange, options);
    }

    public static void writeVisData(WireWriter w, VisData data) {
        w.writeInt(data.headers().size());
        for (ScanHeader header : data.headers()) {
            writeScanHeader(w, header);
        }
        int ncycles = data.numCycles();
        double[] mjd = new double[ncycles];
        int[] headerIndex = new int[ncycles];
        for (int c = 0; c < ncycles; c++) {
            mjd[c] = data.cycle(c).mjd();
            headerIndex[c] = data.cycle(c).headerIndex();
        }
        w.writeInt(ncycles);
        w.writeDoubleArray(mjd);
        w.writeIntArray(headerIndex);
        w.writeIntArray(data.windowCounts());
        for (VisCycle cycle : data.cycles()) {
            int[] npols = new int[cycle.numWindows()];
            for (int i = 0; i < npols.length; i++) {
                npols[i] = cycle.numPols(i);
            }
            w.writeIntArray(npols);
        }
        for (VisCycle cycle : data.cycles()) {
            for (List<VisQuantities> pols : cycle.windows()) {
                for (VisQuantities q : pols) {
                    writeVisQuantities(w, q);
                }
            }
        }
    }

    public static VisData readVisData(WireReader r) {
        int nheaders = readCount(r, "header", TokenType.STRING);
        List<ScanHeader> headers = new ArrayList<>(nheaders);
        for (int i = 0; i < nheaders; i++) {
            headers.add(readScanHeader(r));
        }
        int ncycles = readCount(r, "cycle", TokenType.DOUBLE);
        double[] mjd = r.readDoubleArray(ncycles);
        int[] headerIndex = r.readIntArray(ncycles);
        int[] numWindows = r.readIntArray(ncycles);
        int[][] numPols = new int[ncycles][];
        for (int c = 0; c < ncycles; c++) {
            checkCount(numWindows[c], r, "cycle window");
            numPols[c] = r.readIntArray(numWindows[c]);
        }
        OptionsPool pool = new OptionsPool();
        List<VisCycle> cycles = new ArrayList<>(ncycles);
        for (int c = 0; c < ncycles; c++) {
            List<List<VisQuantities>> windows = new ArrayList<>(numWindows[c]);
            for (int i = 0; i < numWindows[c]; i++) {
                int n = checkCount(numPols[c][i], r, "cycle polarisation");
                List<VisQuantities> pols = new ArrayList<>(n);
                for (int p = 0; p < n; p++) {
                    pols.add(readVisQuantities(r, pool));
                }
                windows.add(pols);
            }
            cycles.add(new VisCycle(mjd[c], headerIndex[c], windows));
        }
        return checked(() -> new VisData(headers, cycles));
    }

    // ---- shared pieces -----------------------------------------------------

    private static void writeRange(WireWriter w, ValueRange range) {
        w.writeFloat(range.min());
        w.writeFloat(range.max());
    }

    private static ValueRange readRange(WireReader r) {
        return new ValueRange(r.readFloat(), r.readFloat());
    }

    private static void writeOptionalOptions(WireWriter w, AmpPhaseOptions options) {
        w.writeBool(options != null);
        if (options != null) {
            writeOptions(w, options);
        }
    }

    private static AmpPhaseOptions readOptionalOptions(WireReader r, OptionsPool pool) {
        return r.readBool() ? pool.intern(readOptions(r)) : null;
    }

    /**
     * Read a count token and check it could describe that many elements of
     * the given type in the bytes left.
     */
    private static int readCount(WireReader r, String what, TokenType elementType) {
        int count = r.readInt();
        if (count < 0 || (long) count * elementType.minSize() > r.remaining()) {
            throw new CodecException("Implausible " + what + " count " + count
                    + " with " + r.remaining() + " bytes remaining");
        }
        return count;
    }

    private static int checkCount(int count, WireReader r, String what) {
        if (count < 0 || count > r.remaining()) {
            throw new CodecException("Implausible " + what + " count " + count);
        }
        return count;
    }

    /**
     * Run a domain constructor, reporting its validation failures as codec errors.
     */
    private static <T> T checked(Supplier<T> constructor) {
        try {
            return constructor.get();
        } catch (CodecException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new CodecException("Decoded value is invalid: " + e.getMessage(), e);
        }
    }

    /**
     * Returns a previously decoded instance in place of an equal one.
     */
    static final class OptionsPool {
        private final List<AmpPhaseOptions> seen = new ArrayList<>();

        AmpPhaseOptions intern(AmpPhaseOptions options) {
            for (AmpPhaseOptions existing : seen) {
                if (existing.equals(options)) {
                    return existing;
                }
            }
            seen.add(options);
            return options;
        }
    }
}
