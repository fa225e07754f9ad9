package visconnect.archive;

import java.nio.charset.StandardCharsets;

/**
 * Layout constants of the block archive format.
 * <p>
 * A file starts with the magic bytes and a version number, then holds a
 * sequence of tagged blocks: a header block opens a scan, cycle blocks
 * follow it, and an end block closes the file. All numbers are big-endian.
 */
final class ArchiveFormat {

    static final byte[] MAGIC = "VCAR".getBytes(StandardCharsets.US_ASCII);
    static final int VERSION = 1;

    static final byte HEADER_BLOCK = 'H';
    static final byte CYCLE_BLOCK = 'C';
    static final byte END_BLOCK = 'E';

    private ArchiveFormat() {
    }
}
