package visconnect.viewer;

/**
 * Commands understood by a viewer, with the fewest characters that may be typed.
 */
public enum CommandWord {
    SELECT("select", 3),
    ARRAY("array", 3),
    HISTORY("history", 3),
    SCALE("scale", 3),
    CALBAND("calband", 3),
    SORT("sort", 2),
    REFANT("refant", 3),
    CLOSURE("closure", 3),
    NNCAL("nncal", 3),
    DCAL("dcal", 2),
    RESET("reset", 3),
    DUMP("dump", 2),
    SPECTRUM("spectrum", 4),
    TVCHANNELS("tvchannels", 2),
    TSYSCORR("tsyscorr", 2),
    AVERAGE("average", 3),
    DELAVG("delavg", 3),
    PHASE("phase", 2),
    INCLUDE("include", 3),
    EXCLUDE("exclude", 3),
    PRINT("print", 2),
    DESCRIBE("describe", 3),
    EXIT("exit", 3),
    QUIT("quit", 1);

    private final String word;
    private final int minChars;

    CommandWord(String word, int minChars) {
        this.word = word;
        this.minChars = minChars;
    }

    public String word() {
        return word;
    }

    public int minChars() {
        return minChars;
    }

    /**
     * @return the command abbreviated by {@code typed}, or null if none or ambiguous
     */
    public static CommandWord match(String typed) {
        CommandWord found = null;
        for (CommandWord command : values()) {
            if (command.word.equalsIgnoreCase(typed)) {
                return command;
            }
            if (MinMatch.matches(command.word, typed, command.minChars)) {
                if (found != null) {
                    return null;
                }
                found = command;
            }
        }
        return found;
    }
}
