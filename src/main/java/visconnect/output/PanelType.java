package visconnect.output;

/**
 * The quantity shown in one plot panel.
 */
public enum PanelType {
    AMPLITUDE("Amplitude"),
    PHASE("Phase"),
    DELAY("Delay (ns)");

    private final String axisLabel;

    PanelType(String axisLabel) {
        this.axisLabel = axisLabel;
    }

    public String axisLabel() {
        return axisLabel;
    }

    /**
     * @return the panel, or null if the word names none
     */
    public static PanelType fromWord(String word) {
        for (PanelType type : values()) {
            if (type.name().toLowerCase().startsWith(word.toLowerCase())) {
                return type;
            }
        }
        return null;
    }
}
