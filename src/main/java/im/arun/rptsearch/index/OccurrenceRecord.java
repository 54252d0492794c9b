package im.arun.rptsearch.index;

import lombok.Data;

/**
 * Master-segment data record linking an occurrence key to a page.
 * {@code sectionBoundary} is the page word's high bit; {@code recordId} and {@code extra} are opaque.
 */
@Data
public final class OccurrenceRecord {
    private final long occurrenceKey;
    private final int pageNumber;
    private final boolean sectionBoundary;
    private final int recordId;
    private final long extra;
}
