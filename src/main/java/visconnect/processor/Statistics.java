package visconnect.processor;

import java.util.Arrays;

/**
 * Mean and median over the leading part of a work array.
 */
final class Statistics {

    private Statistics() {
    }

    static float mean(float[] values, int n) {
        if (n == 0) {
            return 0f;
        }
        double sum = 0;
        for (int i = 0; i < n; i++) {
            sum += values[i];
        }
        return (float) (sum / n);
    }

    /**
     * Median of the first {@code n} values. The array is reordered.
     */
    static float median(float[] values, int n) {
        if (n == 0) {
            return 0f;
        }
        Arrays.sort(values, 0, n);
        if (n % 2 == 1) {
            return values[n / 2];
        }
        return (values[n / 2 - 1] + values[n / 2]) / 2f;
    }

    static float wrapRadians(double phase) {
        double wrapped = phase % (2 * Math.PI);
        if (wrapped > Math.PI) {
            wrapped -= 2 * Math.PI;
        } else if (wrapped <= -Math.PI) {
            wrapped += 2 * Math.PI;
        }
        return (float) wrapped;
    }
}
