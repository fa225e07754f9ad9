package visconnect.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import visconnect.config.DumpFormat;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DumpRendererTest {

    @TempDir
    Path tempDir;

    private static PlotModel model() {
        return new PlotModel(
                List.of(new PlotSeries(PanelType.PHASE, "1-2 aa", new double[]{-0.5, 0}, new float[]{10f, 12.5f})),
                List.of(new AxisRange(PanelType.PHASE, -20, 0, 10f, 12.5f)),
                new PlotDecorations("1934-638 (Dwell) 2024-05-01 01:00:20", "Minutes before latest cycle",
                        List.of("aa: window 1 XX")));
    }

    @Test
    @DisplayName("Should write the plot as a JSON document with a timestamp")
    void testJson() throws IOException {
        Path file = tempDir.resolve("plot.json");
        DumpRenderer renderer = new DumpRenderer(file, DumpFormat.JSON);

        renderer.render(model());

        JsonNode root = new ObjectMapper().readTree(file.toFile());
        assertThat(Instant.parse(root.get("written").asText())).isBeforeOrEqualTo(Instant.now());
        JsonNode series = root.get("plot").get("series");
        assertThat(series).hasSize(1);
        assertThat(series.get(0).get("panel").asText()).isEqualTo("PHASE");
        assertThat(series.get(0).get("label").asText()).isEqualTo("1-2 aa");
        assertThat(series.get(0).get("y").get(1).floatValue()).isEqualTo(12.5f);
        assertThat(root.get("plot").get("decorations").get("title").asText()).startsWith("1934-638");
        assertThat(renderer.file()).isEqualTo(file);
    }

    @Test
    @DisplayName("Should write the plot as commented columns")
    void testText() throws IOException {
        Path file = tempDir.resolve("plot.txt");

        new DumpRenderer(file, DumpFormat.TEXT).render(model());

        List<String> lines = Files.readAllLines(file);
        assertThat(lines.get(0)).startsWith("# 1934-638 (Dwell) 2024-05-01 01:00:20 written ");
        assertThat(lines).containsSubsequence(
                "# aa: window 1 XX",
                "# PHASE 1-2 aa",
                "-0.500000 10.000000",
                "0.000000 12.500000");
    }

    @Test
    @DisplayName("Should report a file that cannot be written")
    void testUnwritable() {
        Path file = tempDir.resolve("missing").resolve("plot.txt");

        assertThatThrownBy(() -> new DumpRenderer(file, DumpFormat.TEXT).render(model()))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("plot.txt");
    }
}
