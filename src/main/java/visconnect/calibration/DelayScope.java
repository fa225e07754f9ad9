package visconnect.calibration;

/**
 * Time range over which a delay solution applies.
 */
public enum DelayScope {
    /** From the start of the data up to the solution time. */
    BEFORE,
    /** From the solution time onwards. */
    AFTER,
    /** At all times. */
    ALL;

    /**
     * @return the scope, or null if the word names none
     */
    public static DelayScope fromWord(String word) {
        if (word == null) {
            return null;
        }
        for (DelayScope scope : values()) {
            if (scope.name().equalsIgnoreCase(word)) {
                return scope;
            }
        }
        return null;
    }
}
