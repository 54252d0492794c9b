package im.arun.rptsearch.index;

import lombok.Data;

/**
 * One decoded field-segment entry. {@code position} is the entry's ordinal within its segment.
 */
@Data
public final class IndexEntry {
    private final String value;
    private final Locator locator;
    private final int position;
}
