package visconnect.config;

/**
 * Output format of the {@code dump} command.
 */
public enum DumpFormat {
    JSON("json"),
    TEXT("txt");

    private final String extension;

    DumpFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }
}
