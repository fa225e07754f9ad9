package visconnect.processor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import visconnect.archive.ArchiveFixtures;
import visconnect.domain.AmpPhase;
import visconnect.domain.AmpPhaseOptions;
import visconnect.domain.AveragingMethod;
import visconnect.domain.CycleRecord;
import visconnect.domain.DelayModifier;
import visconnect.domain.Polarisation;
import visconnect.domain.ScanHeader;
import visconnect.domain.VisQuantities;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class VisAveragerTest {

    private final AmpPhaseCalculator calculator = new AmpPhaseCalculator();
    private final VisAverager averager = new VisAverager();
    private final ScanHeader header = ArchiveFixtures.header("0823-500", 3600);

    private AmpPhaseOptions options() {
        AmpPhaseOptions options = new AmpPhaseOptions();
        options.ensureWindows(header.windows());
        return options;
    }

    private VisQuantities average(CycleRecord cycle, AmpPhaseOptions options) {
        AmpPhase ap = calculator.compute(header, cycle, 0, Polarisation.XX, options);
        return averager.average(ap, options);
    }

    @Test
    @DisplayName("Should average constant spectra to their amplitude and phase with no delay")
    void testConstantSpectrum() {
        VisQuantities q = average(ArchiveFixtures.cycle(header, 3600), options());

        int oneTwo = q.baselineIndex(258);
        assertThat(q.isFlagged(oneTwo)).isFalse();
        assertThat(q.amplitude()[oneTwo][0]).isCloseTo(ArchiveFixtures.AMPLITUDE, within(1e-5f));
        assertThat(q.phase()[oneTwo][0]).isCloseTo(10f, within(1e-3f));
        assertThat(q.delay()[oneTwo][0]).isCloseTo(0f, within(1e-4f));
        assertThat(q.phase()[q.baselineIndex(259)][0]).isCloseTo(30f, within(1e-3f));
    }

    @Test
    @DisplayName("Should give the same answer for every averaging method on constant data")
    void testAveragingMethods() {
        for (AveragingMethod.Statistic statistic : AveragingMethod.Statistic.values()) {
            for (AveragingMethod.Combination combination : AveragingMethod.Combination.values()) {
                AmpPhaseOptions options = options();
                options.setAveragingMethod(0, new AveragingMethod(statistic, combination));

                VisQuantities q = average(ArchiveFixtures.cycle(header, 3600), options);

                int oneThree = q.baselineIndex(259);
                assertThat(q.amplitude()[oneThree][0]).as("%s %s", statistic, combination)
                        .isCloseTo(ArchiveFixtures.AMPLITUDE, within(1e-5f));
                assertThat(q.phase()[oneThree][0]).as("%s %s", statistic, combination)
                        .isCloseTo(30f, within(1e-3f));
            }
        }
    }

    @Test
    @DisplayName("Should recover an applied delay from the phase slope")
    void testDelayFromSlope() {
        AmpPhaseOptions options = options();
        options.addDelayModifiers(List.of(new DelayModifier(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY,
                2, 0, Polarisation.X, 1.5f)));

        VisQuantities q = average(ArchiveFixtures.cycle(header, 3600), options);
        assertThat(q.delay()[q.baselineIndex(258)][0]).isCloseTo(1.5f, within(1e-2f));
        assertThat(q.delay()[q.baselineIndex(259)][0]).isCloseTo(0f, within(1e-3f));

        options.setDelayAveraging(0, 3);
        q = average(ArchiveFixtures.cycle(header, 3600), options);
        assertThat(q.delay()[q.baselineIndex(258)][0]).isCloseTo(1.5f, within(1e-2f));
    }

    @Test
    @DisplayName("Should report no delay when the tv window holds a single channel")
    void testSingleChannelWindow() {
        AmpPhaseOptions options = options();
        options.setTvChannels(0, 4, 4);
        options.addDelayModifiers(List.of(new DelayModifier(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY,
                2, 0, Polarisation.X, 1.5f)));

        VisQuantities q = average(ArchiveFixtures.cycle(header, 3600), options);

        assertThat(q.delay()[q.baselineIndex(258)][0]).isZero();
        assertThat(q.isFlagged(q.baselineIndex(258))).isFalse();
    }

    @Test
    @DisplayName("Should flag baselines with no usable channels")
    void testFlaggedBaselines() {
        CycleRecord flagged = ArchiveFixtures.cycle(header, 3600, ArchiveFixtures.ANTENNA_PHASES, true);

        VisQuantities q = average(flagged, options());

        for (int i = 0; i < q.numBaselines(); i++) {
            assertThat(q.isFlagged(i)).isTrue();
        }
    }

    @Test
    @DisplayName("Should take the median of an even count as the mean of the middle values")
    void testStatistics() {
        assertThat(Statistics.mean(new float[]{1, 2, 3, 10}, 3)).isEqualTo(2f);
        assertThat(Statistics.median(new float[]{4, 1, 3, 2}, 4)).isEqualTo(2.5f);
        assertThat(Statistics.wrapRadians(2.5 * Math.PI)).isCloseTo((float) (0.5 * Math.PI), within(1e-5f));
    }
}
