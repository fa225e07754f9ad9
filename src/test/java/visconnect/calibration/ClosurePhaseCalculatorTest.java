package visconnect.calibration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import visconnect.domain.Polarisation;
import visconnect.domain.VisData;
import visconnect.domain.VisFixtures;
import visconnect.domain.VisQuantities;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ClosurePhaseCalculatorTest {

    private final ClosurePhaseCalculator calculator = new ClosurePhaseCalculator();
    private final float[] delays = {0f, 0f, 0f};

    private VisData data(float p12, float p13, float p23) {
        return VisFixtures.data(List.of(VisFixtures.parallelHands(3600, new float[]{p12, p13, p23}, delays)));
    }

    private static float phase(VisData data, int baseline) {
        VisQuantities q = data.cycle(0).find(0, Polarisation.XX);
        return q.phase()[q.baselineIndex(baseline)][0];
    }

    @Test
    @DisplayName("Should sum phases around the triangle with the reference antenna")
    void testClosureAroundReference() {
        VisData closed = calculator.apply(data(10f, 30f, 50f), 1);

        assertThat(phase(closed, 515)).isCloseTo(30f, within(1e-4f));
        assertThat(phase(closed, 258)).isZero();
        assertThat(phase(closed, 259)).isZero();

        VisData aroundTwo = calculator.apply(data(10f, 30f, 50f), 2);
        assertThat(phase(aroundTwo, 259)).isCloseTo(-30f, within(1e-4f));
        assertThat(phase(aroundTwo, 258)).isZero();
    }

    @Test
    @DisplayName("Should give zero closure phase for antenna-based phases")
    void testAntennaBasedPhasesClose() {
        VisData closed = calculator.apply(data(10f, 30f, 20f), 1);

        assertThat(phase(closed, 515)).isCloseTo(0f, within(1e-4f));
    }

    @Test
    @DisplayName("Should wrap the closure phase into a single turn")
    void testWraps() {
        VisData closed = calculator.apply(data(170f, -170f, 170f), 1);

        assertThat(phase(closed, 515)).isCloseTo(150f, within(1e-3f));
    }

    @Test
    @DisplayName("Should be deterministic and unchanged when applied twice")
    void testIdempotent() {
        VisData original = data(10f, 30f, 50f);

        VisData once = calculator.apply(original, 1);
        VisData twice = calculator.apply(once, 1);

        assertThat(calculator.apply(original, 1)).isEqualTo(once);
        assertThat(twice).isEqualTo(once);
        assertThat(phase(original, 515)).isEqualTo(50f);
    }
}
