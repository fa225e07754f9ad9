package visconnect.viewer;

/**
 * Minimum unambiguous prefix matching of command words.
 */
public final class MinMatch {

    private MinMatch() {
    }

    /**
     * Whether {@code typed} abbreviates {@code word}: at least {@code minChars}
     * characters long and a prefix of it, ignoring case.
     */
    public static boolean matches(String word, String typed, int minChars) {
        if (typed == null || typed.length() < Math.min(minChars, word.length()) || typed.length() > word.length()) {
            return false;
        }
        return word.regionMatches(true, 0, typed, 0, typed.length());
    }
}
