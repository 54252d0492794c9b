package im.arun.rptsearch.index;

/**
 * The two entry trailer layouts found in field segments. Both occupy five bytes
 * after the value, so the entry size is always {@code 7 + field_width}.
 */
public enum LocatorEncoding {
    /** {@code [page:u16][flags:3]} */
    DIRECT_PAGE,
    /** {@code [occurrence:u32][trailer:1]}, resolved to a page through the master segment */
    OCCURRENCE_INDEX
}
