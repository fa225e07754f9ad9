package visconnect.archive;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import visconnect.domain.CycleRecord;
import visconnect.domain.ScanHeader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class BlockArchiveReaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should read back scans and cycles in the order written")
    void testReadsWhatWasWritten() throws IOException {
        Path file = ArchiveFixtures.writeArchive(tempDir.resolve("two.vcar"), 2, 3, 60);

        try (ArchiveReader reader = BlockArchiveReader.open(file)) {
            ScanHeader first = reader.nextScan().orElseThrow();
            assertThat(first).isEqualTo(ArchiveFixtures.header("source0", ArchiveFixtures.scanStart(0, 3, 60)));

            CycleRecord cycle = reader.nextCycle().orElseThrow();
            assertThat(cycle.utSeconds()).isEqualTo(ArchiveFixtures.cycleTime(0, 0, 3, 60));
            assertThat(cycle.points()).hasSize(12);
            assertThat(cycle.baselines()).containsExactly(257, 258, 259, 514, 515, 771);
            CycleRecord.Point expected = ArchiveFixtures.cycle(first, cycle.utSeconds()).points().get(1);
            assertThat(cycle.points().get(1).vis()).containsExactly(expected.vis());

            assertThat(reader.nextCycle()).isPresent();
            assertThat(reader.nextCycle()).isPresent();
            assertThat(reader.nextCycle()).isEmpty();

            assertThat(reader.nextScan().orElseThrow().sourceName()).isEqualTo("source1");
            assertThat(reader.path()).isEqualTo(file);
        }
    }

    @Test
    @DisplayName("Should skip unread cycles when moving to the next scan")
    void testNextScanSkipsCycles() throws IOException {
        Path file = ArchiveFixtures.writeArchive(tempDir.resolve("skip.vcar"), 3, 4, 60);

        try (ArchiveReader reader = BlockArchiveReader.open(file)) {
            assertThat(reader.nextScan().map(ScanHeader::sourceName)).contains("source0");
            assertThat(reader.nextScan().map(ScanHeader::sourceName)).contains("source1");
            assertThat(reader.nextScan().map(ScanHeader::sourceName)).contains("source2");
            assertThat(reader.nextScan()).isEmpty();
        }
    }

    @Test
    @DisplayName("Should treat a file missing its end block as ended")
    void testMissingEndBlock() throws IOException {
        Path file = ArchiveFixtures.writeArchive(tempDir.resolve("cut.vcar"), 1, 2, 60);
        byte[] bytes = Files.readAllBytes(file);
        Files.write(file, Arrays.copyOf(bytes, bytes.length - 1));

        try (ArchiveReader reader = BlockArchiveReader.open(file)) {
            assertThat(reader.nextScan()).isPresent();
            assertThat(reader.nextCycle()).isPresent();
            assertThat(reader.nextCycle()).isPresent();
            assertThat(reader.nextCycle()).isEmpty();
            assertThat(reader.nextScan()).isEmpty();
        }
    }

    @Test
    @DisplayName("Should fail on a block cut short")
    void testTruncatedBlock() throws IOException {
        Path file = ArchiveFixtures.writeArchive(tempDir.resolve("short.vcar"), 1, 2, 60);
        byte[] bytes = Files.readAllBytes(file);
        Files.write(file, Arrays.copyOf(bytes, bytes.length - 40));

        try (ArchiveReader reader = BlockArchiveReader.open(file)) {
            reader.nextScan();
            reader.nextCycle();
            assertThatThrownBy(reader::nextCycle).isInstanceOf(IOException.class);
        }
    }

    @Test
    @DisplayName("Should reject a file that is not an archive")
    void testBadMagic() throws IOException {
        Path file = tempDir.resolve("bad.vcar");
        Files.write(file, "not an archive at all".getBytes());

        assertThatThrownBy(() -> BlockArchiveReader.open(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not a block archive");
    }

    @Test
    @DisplayName("Should return no cycles before the first scan")
    void testNoCycleBeforeScan() throws IOException {
        Path file = ArchiveFixtures.writeArchive(tempDir.resolve("one.vcar"), 1, 1, 60);

        try (ArchiveReader reader = BlockArchiveReader.open(file)) {
            Optional<CycleRecord> cycle = reader.nextCycle();
            assertThat(cycle).isEmpty();
        }
    }

    @Test
    @DisplayName("Should refuse a cycle written before any scan")
    void testWriterNeedsScan() throws IOException {
        try (BlockArchiveWriter writer = new BlockArchiveWriter(tempDir.resolve("w.vcar"))) {
            ScanHeader header = ArchiveFixtures.header("x", 0);
            assertThatThrownBy(() -> writer.writeCycle(ArchiveFixtures.cycle(header, 0)))
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
