package visconnect.archive;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens archive readers; swapped out in tests.
 */
@FunctionalInterface
public interface ArchiveReaderFactory {

    ArchiveReader open(Path path) throws IOException;

    static ArchiveReaderFactory blockFiles() {
        return BlockArchiveReader::open;
    }
}
