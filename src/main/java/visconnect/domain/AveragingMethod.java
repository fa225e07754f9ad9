package visconnect.domain;

/**
 * How channels are combined when averaging a spectrum down to one value.
 */
public record AveragingMethod(Statistic statistic, Combination combination) {

    public static final int MEAN_BIT = 1;
    public static final int MEDIAN_BIT = 2;
    public static final int VECTOR_BIT = 4;
    public static final int SCALAR_BIT = 8;

    public static final AveragingMethod DEFAULT = new AveragingMethod(Statistic.MEAN, Combination.VECTOR);

    public enum Statistic {
        MEAN,
        MEDIAN
    }

    /**
     * Vector averaging combines the complex values, scalar averaging combines
     * amplitudes and phases separately.
     */
    public enum Combination {
        VECTOR,
        SCALAR
    }

    public int toBits() {
        int bits = statistic == Statistic.MEAN ? MEAN_BIT : MEDIAN_BIT;
        return bits | (combination == Combination.VECTOR ? VECTOR_BIT : SCALAR_BIT);
    }

    public static AveragingMethod fromBits(int bits) {
        Statistic statistic = (bits & MEDIAN_BIT) != 0 ? Statistic.MEDIAN : Statistic.MEAN;
        Combination combination = (bits & SCALAR_BIT) != 0 ? Combination.SCALAR : Combination.VECTOR;
        return new AveragingMethod(statistic, combination);
    }

    @Override
    public String toString() {
        return statistic.name().toLowerCase() + " " + combination.name().toLowerCase();
    }
}
