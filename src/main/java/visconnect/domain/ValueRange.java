package visconnect.domain;

/**
 * Minimum and maximum of a set of values. A set with no finite values has
 * the range (0, 0).
 */
public record ValueRange(float min, float max) {

    public static final ValueRange EMPTY = new ValueRange(0, 0);

    public static ValueRange of(float[]... arrays) {
        Accumulator acc = new Accumulator();
        for (float[] values : arrays) {
            acc.add(values);
        }
        return acc.toRange();
    }

    /**
     * Collects values one array at a time, skipping NaNs.
     */
    public static final class Accumulator {
        private float min;
        private float max;
        private boolean empty = true;

        public Accumulator add(float value) {
            if (Float.isNaN(value)) {
                return this;
            }
            if (empty) {
                min = value;
                max = value;
                empty = false;
            } else {
                min = Math.min(min, value);
                max = Math.max(max, value);
            }
            return this;
        }

        public Accumulator add(float[] values) {
            for (float v : values) {
                add(v);
            }
            return this;
        }

        public Accumulator add(ValueRange range) {
            return add(range.min).add(range.max);
        }

        public ValueRange toRange() {
            return empty ? EMPTY : new ValueRange(min, max);
        }
    }
}
