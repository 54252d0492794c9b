package im.arun.rptsearch.binary;

import java.io.IOException;

/**
 * Raised when an archive file cannot be parsed at all: wrong signature,
 * header shorter than the fixed layout, or a table marker missing at its
 * declared offset. Fatal for the file it concerns, never for a batch.
 */
public class ArchiveFormatException extends IOException {
    private final String source;
    private final long offset;

    public ArchiveFormatException(String source, long offset, String message) {
        super(String.format("%s (offset 0x%X): %s", source, offset, message));
        this.source = source;
        this.offset = offset;
    }

    public String getSource() {
        return source;
    }

    public long getOffset() {
        return offset;
    }
}
