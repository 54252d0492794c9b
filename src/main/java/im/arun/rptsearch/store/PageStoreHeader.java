package im.arun.rptsearch.store;

import lombok.Data;

/**
 * Header line and table directory of a page store. Table offsets are absolute
 * (directory value plus the instance header base), 0 when the row is empty.
 */
@Data
public final class PageStoreHeader {
    private final int domainId;
    private final int speciesId;
    private final String timestamp;
    private final int declaredPageCount;
    private final long pageTableOffset;
    private final int declaredSectionCount;
    private final long sectionTableOffset;
    private final long binaryObjectCount;
}
