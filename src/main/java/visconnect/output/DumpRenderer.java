package visconnect.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visconnect.config.DumpFormat;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Writes a plot to a file instead of a screen, as JSON or as whitespace
 * separated columns.
 */
public class DumpRenderer implements Renderer {
    private static final Logger logger = LoggerFactory.getLogger(DumpRenderer.class);

    /** JSON document written for one plot. */
    public record PlotDump(Instant written, PlotModel plot) {
    }

    private final Path file;
    private final DumpFormat format;
    private final ObjectMapper objectMapper;

    public DumpRenderer(Path file, DumpFormat format) {
        this.file = Objects.requireNonNull(file, "file cannot be null");
        this.format = Objects.requireNonNull(format, "format cannot be null");
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Path file() {
        return file;
    }

    @Override
    public void render(PlotModel model) {
        try {
            if (format == DumpFormat.JSON) {
                objectMapper.writeValue(file.toFile(), new PlotDump(Instant.now(), model));
            } else {
                writeText(model);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write plot to " + file, e);
        }
        logger.info("Wrote {} series to {}", model.series().size(), file);
    }

    private void writeText(PlotModel model) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write("# " + model.decorations().title() + " written " + Instant.now());
            writer.newLine();
            for (String note : model.decorations().notes()) {
                writer.write("# " + note);
                writer.newLine();
            }
            for (PlotSeries series : model.series()) {
                writer.write("# " + series.panel() + " " + series.label());
                writer.newLine();
                for (int i = 0; i < series.size(); i++) {
                    writer.write(String.format(Locale.ROOT, "%.6f %.6f", series.x()[i], series.y()[i]));
                    writer.newLine();
                }
            }
        }
    }
}
