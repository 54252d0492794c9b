package im.arun.rptsearch.index;

import lombok.Data;

/**
 * Master-segment record {@code [segment:1][line_id:1][field_id:1][flags:1]}.
 */
@Data
public final class SegmentLookupRecord {
    private final int segment;
    private final int lineId;
    private final int fieldId;
    private final int flags;
}
