package visconnect.processor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import visconnect.archive.ArchiveFixtures;
import visconnect.domain.AmpPhase;
import visconnect.domain.AmpPhaseOptions;
import visconnect.domain.BinSpectrum;
import visconnect.domain.CycleRecord;
import visconnect.domain.DelayModifier;
import visconnect.domain.Polarisation;
import visconnect.domain.ScanHeader;
import visconnect.domain.TsysCorrection;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class AmpPhaseCalculatorTest {

    private final AmpPhaseCalculator calculator = new AmpPhaseCalculator();
    private final ScanHeader header = ArchiveFixtures.header("1934-638", 3600);

    @Test
    @DisplayName("Should compute amplitude and phase of every channel of a baseline")
    void testAmplitudeAndPhase() {
        CycleRecord cycle = ArchiveFixtures.cycle(header, 3600);

        AmpPhase ap = calculator.compute(header, cycle, 0, Polarisation.XX, new AmpPhaseOptions());

        assertThat(ap.numChannels()).isEqualTo(ArchiveFixtures.NUM_CHANNELS);
        assertThat(ap.baseline()).containsExactly(257, 258, 259, 514, 515, 771);
        BinSpectrum oneThree = ap.spectrum(ap.baselineIndex(259), 0);
        assertThat(oneThree.numFilteredChannels()).isEqualTo(ArchiveFixtures.NUM_CHANNELS);
        for (int c = 0; c < ArchiveFixtures.NUM_CHANNELS; c++) {
            assertThat(oneThree.amplitude()[c]).isCloseTo(ArchiveFixtures.AMPLITUDE, within(1e-5f));
            assertThat(oneThree.phase()[c]).isCloseTo(30f, within(1e-3f));
        }
        assertThat(ap.channel()[0]).isEqualTo(1);
        assertThat(ap.frequency()[1]).isGreaterThan(ap.frequency()[0]);
    }

    @Test
    @DisplayName("Should report phases in radians when asked")
    void testRadians() {
        AmpPhaseOptions options = new AmpPhaseOptions();
        options.setPhaseInDegrees(false);

        AmpPhase ap = calculator.compute(header, ArchiveFixtures.cycle(header, 3600), 1, Polarisation.YY, options);

        float phase = ap.spectrum(ap.baselineIndex(258), 0).phase()[3];
        assertThat(phase).isCloseTo((float) Math.toRadians(10), within(1e-5f));
    }

    @Test
    @DisplayName("Should leave flagged points out of the filtered channels unless flagged data is included")
    void testFlaggedData() {
        CycleRecord flagged = ArchiveFixtures.cycle(header, 3600, ArchiveFixtures.ANTENNA_PHASES, true);
        AmpPhaseOptions options = new AmpPhaseOptions();

        BinSpectrum excluded = calculator.compute(header, flagged, 0, Polarisation.XX, options).spectrum(1, 0);
        assertThat(excluded.isFlagged()).isTrue();
        assertThat(excluded.numFilteredChannels()).isZero();
        assertThat(excluded.numChannels()).isEqualTo(ArchiveFixtures.NUM_CHANNELS);

        options.setIncludeFlaggedData(true);
        BinSpectrum included = calculator.compute(header, flagged, 0, Polarisation.XX, options).spectrum(1, 0);
        assertThat(included.numFilteredChannels()).isEqualTo(ArchiveFixtures.NUM_CHANNELS);
    }

    @Test
    @DisplayName("Should rotate cross correlations by the delay difference of their feeds")
    void testDelayRotation() {
        AmpPhaseOptions options = new AmpPhaseOptions();
        options.addDelayModifiers(List.of(new DelayModifier(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY,
                2, 0, Polarisation.X, 1f)));
        CycleRecord cycle = ArchiveFixtures.cycle(header, 3600);

        AmpPhase xx = calculator.compute(header, cycle, 0, Polarisation.XX, options);
        BinSpectrum rotated = xx.spectrum(xx.baselineIndex(258), 0);
        for (int c = 0; c < xx.numChannels(); c++) {
            double expected = Math.toDegrees(Statistics.wrapRadians(
                    Math.toRadians(10) + 2 * Math.PI * xx.frequency()[c]));
            assertThat((double) rotated.phase()[c]).isCloseTo(expected, within(0.05));
            assertThat(rotated.amplitude()[c]).isCloseTo(ArchiveFixtures.AMPLITUDE, within(1e-4f));
        }

        BinSpectrum auto = xx.spectrum(xx.baselineIndex(514), 0);
        assertThat(auto.phase()[0]).isCloseTo(0f, within(1e-4f));

        AmpPhase yy = calculator.compute(header, cycle, 0, Polarisation.YY, options);
        assertThat(yy.spectrum(yy.baselineIndex(258), 0).phase()[0]).isCloseTo(10f, within(1e-3f));
    }

    @Test
    @DisplayName("Should scale correlations by the selected system temperature correction")
    void testTsysScale() {
        CycleRecord plain = ArchiveFixtures.cycle(header, 3600);
        CycleRecord cycle = new CycleRecord(3600, plain.points(), List.of(
                new CycleRecord.SystemTemperature(1, 0, Polarisation.X, 25f, 50f),
                new CycleRecord.SystemTemperature(2, 0, Polarisation.X, 100f, 200f)));
        CycleRecord.Point oneTwo = cycle.points().get(1);
        assertThat(oneTwo.baseline()).isEqualTo(258);

        assertThat(AmpPhaseCalculator.tsysScale(cycle, oneTwo, 0, Polarisation.XX, TsysCorrection.ONLINE))
                .isEqualTo(1f);
        assertThat(AmpPhaseCalculator.tsysScale(cycle, oneTwo, 0, Polarisation.XX, TsysCorrection.REVERSE_ONLINE))
                .isCloseTo(0.02f, within(1e-6f));
        assertThat(AmpPhaseCalculator.tsysScale(cycle, oneTwo, 0, Polarisation.XX, TsysCorrection.COMPUTED))
                .isCloseTo(2f, within(1e-6f));
        assertThat(AmpPhaseCalculator.tsysScale(cycle, oneTwo, 0, Polarisation.YY, TsysCorrection.COMPUTED))
                .isEqualTo(1f);
    }

    @Test
    @DisplayName("Should return null for a missing window or an unrecorded polarisation")
    void testMissingProducts() {
        CycleRecord cycle = ArchiveFixtures.cycle(header, 3600);

        assertThat(calculator.compute(header, cycle, 5, Polarisation.XX, new AmpPhaseOptions())).isNull();
        assertThat(calculator.compute(header, cycle, 0, Polarisation.X, new AmpPhaseOptions())).isNull();
        assertThat(calculator.computeAll(header, cycle, new AmpPhaseOptions()))
                .hasSize(2)
                .allSatisfy(pols -> assertThat(pols).extracting(AmpPhase::pol)
                        .containsExactly(Polarisation.XX, Polarisation.YY, Polarisation.XY, Polarisation.YX));
    }
}
