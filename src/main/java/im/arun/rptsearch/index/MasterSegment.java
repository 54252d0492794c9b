package im.arun.rptsearch.index;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Segment 0 of an index file: the (line, field) to segment directory and the
 * occurrence table used to turn occurrence-index locators into page numbers.
 */
public final class MasterSegment {
    private final List<SegmentLookupRecord> lookupTable;
    private final Map<Long, OccurrenceRecord> occurrences;

    MasterSegment(List<SegmentLookupRecord> lookupTable, Map<Long, OccurrenceRecord> occurrences) {
        this.lookupTable = List.copyOf(lookupTable);
        this.occurrences = Collections.unmodifiableMap(occurrences);
    }

    static MasterSegment empty() {
        return new MasterSegment(List.of(), Map.of());
    }

    public List<SegmentLookupRecord> getLookupTable() {
        return lookupTable;
    }

    public Map<Long, OccurrenceRecord> getOccurrences() {
        return occurrences;
    }

    /**
     * First lookup record for the given line and field, in table order.
     */
    public OptionalInt lookupSegment(int lineId, int fieldId) {
        for (SegmentLookupRecord record : lookupTable) {
            if (record.getLineId() == lineId && record.getFieldId() == fieldId) {
                return OptionalInt.of(record.getSegment());
            }
        }
        return OptionalInt.empty();
    }

    public OptionalInt resolveOccurrence(long occurrenceKey) {
        OccurrenceRecord record = occurrences.get(occurrenceKey);
        if (record == null || record.getPageNumber() <= 0) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(record.getPageNumber());
    }
}
