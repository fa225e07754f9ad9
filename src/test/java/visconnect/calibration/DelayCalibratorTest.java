package visconnect.calibration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import visconnect.domain.DelayModifier;
import visconnect.domain.Polarisation;
import visconnect.domain.VisData;
import visconnect.domain.VisFixtures;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DelayCalibratorTest {

    private final DelayCalibrator calibrator = new DelayCalibrator();
    private final float[] phases = {0f, 0f, 0f};

    private VisData threeCycles() {
        return VisFixtures.data(List.of(
                VisFixtures.parallelHands(3600, phases, new float[]{1f, 4f, 6f}),
                VisFixtures.parallelHands(3610, phases, new float[]{2f, 4f, 6f}),
                VisFixtures.parallelHands(3620, phases, new float[]{3f, 4f, 6f})));
    }

    @Test
    @DisplayName("Should average the delays to the reference antenna over consecutive cycles")
    void testAveragesAgainstReference() throws CalibrationException {
        DelayCalibrator.Solution solution = calibrator.solve(threeCycles(), 1, 3, 0);

        assertThat(solution.delays()).containsExactly(
                new AntennaDelay(2, 0, Polarisation.X, 2f, 3),
                new AntennaDelay(3, 0, Polarisation.X, 4f, 3),
                new AntennaDelay(2, 0, Polarisation.Y, 2f, 3),
                new AntennaDelay(3, 0, Polarisation.Y, 4f, 3));
    }

    @Test
    @DisplayName("Should flip the sign for antennas numbered below the reference")
    void testSignBelowReference() throws CalibrationException {
        DelayCalibrator.Solution solution = calibrator.solve(threeCycles(), 2, 3, 0, 0);

        assertThat(solution.delays())
                .filteredOn(d -> d.feed() == Polarisation.X)
                .extracting(AntennaDelay::antenna, AntennaDelay::delayNs)
                .containsExactly(tuple(1, -2f), tuple(3, 6f));
    }

    @Test
    @DisplayName("Should only use the most recent cycles")
    void testUsesLatestCycles() throws CalibrationException {
        DelayCalibrator.Solution solution = calibrator.solve(threeCycles(), 1, 1, 0);

        assertThat(solution.delays().get(0).delayNs()).isEqualTo(3f);
        assertThat(solution.delays().get(0).cycles()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should refuse to solve without enough consecutive cycles")
    void testNotEnoughConsecutiveCycles() {
        VisData gapped = VisFixtures.data(List.of(
                VisFixtures.parallelHands(3600, phases, new float[]{1f, 1f, 1f}),
                VisFixtures.parallelHands(3700, phases, new float[]{1f, 1f, 1f}),
                VisFixtures.parallelHands(3710, phases, new float[]{1f, 1f, 1f})));

        assertThatThrownBy(() -> calibrator.solve(gapped, 1, 3, 0))
                .isInstanceOf(CalibrationException.class)
                .hasMessage("need 3 consecutive cycles, found 2");
        assertThatThrownBy(() -> calibrator.solve(VisData.empty(), 1, 3, 0))
                .isInstanceOf(CalibrationException.class)
                .hasMessage("need 3 consecutive cycles, found 0");
    }

    @Test
    @DisplayName("Should refuse to solve when a cycle lacks the window being solved")
    void testCycleMissingWindow() {
        VisData data = VisFixtures.data(List.of(
                VisFixtures.parallelHands(3600, phases, new float[]{1f, 4f, 6f}),
                VisFixtures.cycle(0, 3610, List.of(
                        VisFixtures.quantities(1, Polarisation.XX, 3610, phases, new float[]{2f, 4f, 6f}),
                        VisFixtures.quantities(1, Polarisation.YY, 3610, phases, new float[]{2f, 4f, 6f}))),
                VisFixtures.parallelHands(3620, phases, new float[]{3f, 4f, 6f})));

        assertThatThrownBy(() -> calibrator.solve(data, 1, 3, 0))
                .isInstanceOf(CalibrationException.class)
                .hasMessageStartingWith("need 3 consecutive cycles, found 2");
    }

    @Test
    @DisplayName("Should skip windows the current scan does not have")
    void testSkipsUnknownWindow() throws CalibrationException {
        DelayCalibrator.Solution solution = calibrator.solve(threeCycles(), 1, 3, 0, 7);

        assertThat(solution.delays()).hasSize(4)
                .allSatisfy(d -> assertThat(d.window()).isZero());
    }

    @Test
    @DisplayName("Should refuse a reference antenna missing from the current scan")
    void testMissingReference() {
        assertThatThrownBy(() -> calibrator.solve(threeCycles(), 5, 3, 0))
                .isInstanceOf(CalibrationException.class)
                .hasMessage("antenna 5 not in current scan");
    }

    @Test
    @DisplayName("Should skip flagged baselines when averaging")
    void testSkipsFlagged() throws CalibrationException {
        VisData data = VisFixtures.data(List.of(
                VisFixtures.parallelHands(3600, phases, new float[]{2f, 4f, 6f}),
                VisFixtures.cycle(0, 3610, List.of(
                        VisFixtures.quantities(0, Polarisation.XX, 3610, VisFixtures.CROSS_BASELINES, phases,
                                new float[]{100f, 8f, 6f}, new boolean[]{true, false, false}),
                        VisFixtures.quantities(0, Polarisation.YY, 3610, phases, new float[]{2f, 4f, 6f})))));

        DelayCalibrator.Solution solution = calibrator.solve(data, 1, 2, 0);

        assertThat(solution.delays())
                .filteredOn(d -> d.feed() == Polarisation.X)
                .containsExactly(
                        new AntennaDelay(2, 0, Polarisation.X, 2f, 1),
                        new AntennaDelay(3, 0, Polarisation.X, 6f, 2));
    }

    @Test
    @DisplayName("Should turn a solution into cancelling corrections over the requested range")
    void testModifiers() throws CalibrationException {
        DelayCalibrator.Solution solution = calibrator.solve(threeCycles(), 1, 3, 0);

        List<DelayModifier> after = solution.toModifiers(DelayScope.AFTER);
        assertThat(after).hasSize(4);
        assertThat(after.get(0).delayNs()).isEqualTo(-2f);
        assertThat(after.get(0).validFromMjd()).isEqualTo(solution.mjd());
        assertThat(after.get(0).validToMjd()).isEqualTo(Double.POSITIVE_INFINITY);

        DelayModifier before = solution.toModifiers(DelayScope.BEFORE).get(1);
        assertThat(before.validFromMjd()).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat(before.validToMjd()).isEqualTo(solution.mjd());
        assertThat(before.antenna()).isEqualTo(3);

        assertThat(solution.toModifiers(DelayScope.ALL))
                .allSatisfy(m -> assertThat(m.appliesAt(0)).isTrue());
        assertThat(DelayScope.fromWord("After")).isEqualTo(DelayScope.AFTER);
        assertThat(DelayScope.fromWord("sometime")).isNull();
    }
}
