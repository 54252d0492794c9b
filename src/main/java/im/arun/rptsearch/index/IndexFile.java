package im.arun.rptsearch.index;

import im.arun.rptsearch.model.IntegrityWarning;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Parsed index file of one report instance revision. Immutable once built by
 * {@link IndexFileParser}; safe to share between concurrent queries.
 */
public final class IndexFile {
    private final String source;
    private final IndexHeader header;
    private final MasterSegment master;
    private final List<FieldSegment> fieldSegments;
    private final List<IntegrityWarning> warnings;

    IndexFile(String source, IndexHeader header, MasterSegment master,
              List<FieldSegment> fieldSegments, List<IntegrityWarning> warnings) {
        this.source = source;
        this.header = header;
        this.master = master;
        this.fieldSegments = List.copyOf(fieldSegments);
        this.warnings = List.copyOf(warnings);
    }

    public String getSource() {
        return source;
    }

    public IndexHeader getHeader() {
        return header;
    }

    public MasterSegment getMaster() {
        return master;
    }

    /**
     * Segment count derived from the markers actually present, master included.
     */
    public int segmentCount() {
        return fieldSegments.size() + 1;
    }

    public List<FieldSegment> getFieldSegments() {
        return fieldSegments;
    }

    public List<IntegrityWarning> getWarnings() {
        return warnings;
    }

    public Optional<FieldSegment> segment(int segmentNumber) {
        if (segmentNumber < 1 || segmentNumber > fieldSegments.size()) {
            return Optional.empty();
        }
        return Optional.of(fieldSegments.get(segmentNumber - 1));
    }

    public OptionalInt lookupSegment(int lineId, int fieldId) {
        return master.lookupSegment(lineId, fieldId);
    }

    /**
     * Every entry of the segment equal to {@code value}; empty when nothing matches
     * or the segment does not exist.
     */
    public List<IndexEntry> binarySearch(int segmentNumber, String value) {
        return segment(segmentNumber)
            .map(segment -> segment.search(value))
            .orElse(List.of());
    }

    /**
     * Every entry of the segment whose value starts with {@code prefix}.
     */
    public List<IndexEntry> prefixSearch(int segmentNumber, String prefix) {
        return segment(segmentNumber)
            .map(segment -> segment.searchPrefix(prefix))
            .orElse(List.of());
    }

    public OptionalInt resolveOccurrence(long occurrenceKey) {
        return master.resolveOccurrence(occurrenceKey);
    }
}
