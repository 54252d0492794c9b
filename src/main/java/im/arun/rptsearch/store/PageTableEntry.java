package im.arun.rptsearch.store;

import lombok.Data;

/**
 * One 24-byte page table entry. {@code offset} is absolute (the stored value is
 * relative to the instance header). {@code readable} is false when the entry's
 * compressed block does not lie inside the file.
 */
@Data
public final class PageTableEntry {
    private final int pageNumber;
    private final long offset;
    private final int lineWidth;
    private final int linesPerPage;
    private final long uncompressedSize;
    private final long compressedSize;
    private final boolean readable;
}
