package im.arun.rptsearch.index;

import im.arun.rptsearch.binary.ArchiveBuffer;
import im.arun.rptsearch.binary.ArchiveFormatException;
import im.arun.rptsearch.config.RptSearchConfig;
import im.arun.rptsearch.model.IntegrityWarning;
import im.arun.rptsearch.model.IntegrityWarning.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes binary index (.MAP) files.
 *
 * <p>Layout: a fixed 0x48-byte header (signature, version, declared segment
 * count, two dates) followed by segments that each start with the
 * {@code **ME} marker. Segment 0 is the master directory; the others hold
 * fixed-width sorted entries for one field each.</p>
 */
public class IndexFileParser {
    private static final Logger logger = LoggerFactory.getLogger(IndexFileParser.class);

    public static final byte[] SIGNATURE = ArchiveBuffer.doubleByte("MAPHDR");
    public static final byte[] SEGMENT_MARKER = ArchiveBuffer.doubleByte("**ME");

    public static final int VERSION_OFFSET = 0x10;
    public static final int SEGMENT_COUNT_OFFSET = 0x12;
    public static final int CREATED_DATE_OFFSET = 0x20;
    public static final int MODIFIED_DATE_OFFSET = 0x34;
    public static final int DATE_LENGTH = 20;
    public static final int HEADER_LENGTH = 0x48;

    /** Field metadata block, relative to the segment marker. */
    public static final int FIELD_METADATA_OFFSET = 0x18;
    public static final int FIELD_METADATA_LENGTH = 16;
    /** Master lookup table, relative to the segment marker. */
    public static final int LOOKUP_TABLE_OFFSET = 0xC2;
    /** First field entry, relative to the segment marker. */
    public static final int FIELD_DATA_OFFSET = 0xCD;

    public static final int LOOKUP_RECORD_SIZE = 4;
    public static final int OCCURRENCE_RECORD_SIZE = 15;
    public static final int OCCURRENCE_DATA_TYPE = 0x08;

    private final int probeSample;
    private final int maxFieldWidth;

    public IndexFileParser() {
        this(new RptSearchConfig());
    }

    public IndexFileParser(RptSearchConfig config) {
        this.probeSample = Math.max(1, config.getFormatProbeSample());
        this.maxFieldWidth = config.getMaxFieldWidth();
    }

    public IndexFile open(Path path) throws IOException {
        return open(Files.readAllBytes(path), path.getFileName().toString());
    }

    public IndexFile open(byte[] data, String source) throws ArchiveFormatException {
        ArchiveBuffer buffer = new ArchiveBuffer(data, source);
        List<IntegrityWarning> warnings = new ArrayList<>();

        IndexHeader header = parseHeader(buffer);
        List<Integer> markers = findMarkers(buffer);

        if (markers.size() != header.getDeclaredSegmentCount()) {
            warn(warnings, IntegrityWarning.of(Kind.SEGMENT_COUNT_MISMATCH,
                "%s declares %d segments but contains %d segment markers",
                source, header.getDeclaredSegmentCount(), markers.size()));
        }

        MasterSegment master = MasterSegment.empty();
        List<FieldSegment> fieldSegments = new ArrayList<>();
        for (int i = 0; i < markers.size(); i++) {
            int start = markers.get(i);
            int end = i + 1 < markers.size() ? markers.get(i + 1) : buffer.length();
            if (i == 0) {
                master = parseMaster(buffer, start, end, warnings);
            } else {
                fieldSegments.add(parseFieldSegment(buffer, i, start, end, warnings));
            }
        }

        crossCheckLookupTable(source, master, fieldSegments, warnings);

        logger.debug("Parsed {}: version {}, {} segments, {} lookup records, {} occurrence records",
            source, header.getVersion(), markers.size(), master.getLookupTable().size(),
            master.getOccurrences().size());
        return new IndexFile(source, header, master, fieldSegments, warnings);
    }

    private IndexHeader parseHeader(ArchiveBuffer buffer) throws ArchiveFormatException {
        if (!buffer.regionMatches(0, SIGNATURE)) {
            throw buffer.formatError(0, "missing MAPHDR signature");
        }
        if (buffer.length() < HEADER_LENGTH) {
            throw buffer.formatError(buffer.length(), "header truncated, " + buffer.length() + " bytes");
        }
        return new IndexHeader(
            buffer.u16(VERSION_OFFSET),
            buffer.u16(SEGMENT_COUNT_OFFSET),
            buffer.doubleByteText(CREATED_DATE_OFFSET, DATE_LENGTH),
            buffer.doubleByteText(MODIFIED_DATE_OFFSET, DATE_LENGTH));
    }

    private List<Integer> findMarkers(ArchiveBuffer buffer) {
        List<Integer> positions = new ArrayList<>();
        int pos = buffer.indexOf(SEGMENT_MARKER, HEADER_LENGTH);
        while (pos >= 0) {
            positions.add(pos);
            pos = buffer.indexOf(SEGMENT_MARKER, pos + SEGMENT_MARKER.length);
        }
        return positions;
    }

    private MasterSegment parseMaster(ArchiveBuffer buffer, int start, int end, List<IntegrityWarning> warnings) {
        int offset = start + LOOKUP_TABLE_OFFSET;
        if (offset > end) {
            warn(warnings, IntegrityWarning.of(Kind.EMPTY_SEGMENT,
                "master segment at 0x%X is too short for a lookup table", start));
            return MasterSegment.empty();
        }

        List<SegmentLookupRecord> lookupTable = new ArrayList<>();
        boolean terminated = false;
        while (offset + LOOKUP_RECORD_SIZE <= end) {
            if (buffer.u32(offset) == 0) {
                if (offset + 2 * LOOKUP_RECORD_SIZE <= end && buffer.u32(offset + LOOKUP_RECORD_SIZE) == 0) {
                    offset += 2 * LOOKUP_RECORD_SIZE;
                    terminated = true;
                    break;
                }
                offset += LOOKUP_RECORD_SIZE;
                continue;
            }
            lookupTable.add(new SegmentLookupRecord(
                buffer.u8(offset), buffer.u8(offset + 1), buffer.u8(offset + 2), buffer.u8(offset + 3)));
            offset += LOOKUP_RECORD_SIZE;
        }

        if (!terminated) {
            logger.debug("{}: master lookup table at 0x{} has no terminator", buffer.source(),
                Integer.toHexString(start).toUpperCase());
        }

        // Occurrence records lie on a 15-byte grid starting at the lookup table, not after it.
        // Only type 0x08 records count; a repeated key keeps the last record.
        Map<Long, OccurrenceRecord> occurrences = new HashMap<>();
        int duplicates = 0;
        for (int rec = start + LOOKUP_TABLE_OFFSET; rec + OCCURRENCE_RECORD_SIZE <= end; rec += OCCURRENCE_RECORD_SIZE) {
            if (buffer.u8(rec + 5) != OCCURRENCE_DATA_TYPE) {
                continue;
            }
            long rawPage = buffer.u32(rec);
            long key = buffer.u32(rec + 7);
            OccurrenceRecord previous = occurrences.put(key, new OccurrenceRecord(
                key,
                (int) (rawPage & 0x7FFFFFFFL),
                (rawPage & 0x80000000L) != 0,
                buffer.u8(rec + 4),
                buffer.u32(rec + 11)));
            if (previous != null) {
                duplicates++;
            }
        }
        if (duplicates > 0) {
            logger.debug("{}: {} occurrence keys repeat; the last record wins", buffer.source(), duplicates);
        }
        return new MasterSegment(lookupTable, occurrences);
    }

    private FieldSegment parseFieldSegment(ArchiveBuffer buffer, int number, int start, int end,
                                           List<IntegrityWarning> warnings) {
        int meta = start + FIELD_METADATA_OFFSET;
        if (meta + FIELD_METADATA_LENGTH > end) {
            warn(warnings, IntegrityWarning.of(Kind.EMPTY_SEGMENT,
                "segment %d at 0x%X is too short for field metadata", number, start));
            return emptySegment(buffer, number, 0, 0, 0, 0, 0, start);
        }

        int pageStart = buffer.u16(meta);
        int lineId = buffer.u16(meta + 2);
        int fieldId = buffer.u16(meta + 6);
        int fieldWidth = buffer.u16(meta + 10);
        int declaredEntries = buffer.u16(meta + 14);
        int dataOffset = start + FIELD_DATA_OFFSET;
        int entrySize = FieldSegment.ENTRY_OVERHEAD + fieldWidth;

        if (fieldWidth == 0 || fieldWidth > maxFieldWidth || dataOffset + entrySize > end) {
            warn(warnings, IntegrityWarning.of(Kind.EMPTY_SEGMENT,
                "segment %d (line %d, field %d) has field width %d and %d data bytes; treated as empty",
                number, lineId, fieldId, fieldWidth, Math.max(0, end - dataOffset)));
            return emptySegment(buffer, number, lineId, fieldId, fieldWidth, pageStart, declaredEntries, dataOffset);
        }

        int count = 0;
        int offset = dataOffset;
        while (offset + entrySize <= end && buffer.u16(offset) == fieldWidth) {
            count++;
            offset += entrySize;
        }
        if (offset + 2 <= end && offset + entrySize > end && buffer.u16(offset) == fieldWidth) {
            warn(warnings, IntegrityWarning.of(Kind.TRUNCATED_ENTRY,
                "segment %d: entry %d at 0x%X is cut off by the segment end; discarded",
                number, count, offset));
        }

        LocatorEncoding encoding = probeEncoding(buffer, dataOffset, entrySize, fieldWidth, count);
        FieldSegment segment = new FieldSegment(buffer, number, lineId, fieldId, fieldWidth, pageStart,
            declaredEntries, dataOffset, count, encoding, true);

        int disorderAt = firstDisorder(segment);
        if (disorderAt > 0) {
            warn(warnings, IntegrityWarning.of(Kind.NON_MONOTONIC_SEGMENT,
                "segment %d: entry %d sorts before entry %d; searches fall back to a linear scan",
                number, disorderAt, disorderAt - 1));
            segment = new FieldSegment(buffer, number, lineId, fieldId, fieldWidth, pageStart,
                declaredEntries, dataOffset, count, encoding, false);
        }

        logger.debug("Segment {}: line {}, field {}, width {}, {} entries ({} declared), {}",
            number, lineId, fieldId, fieldWidth, count, declaredEntries, encoding);
        return segment;
    }

    private FieldSegment emptySegment(ArchiveBuffer buffer, int number, int lineId, int fieldId, int fieldWidth,
                                      int pageStart, int declaredEntries, int dataOffset) {
        return new FieldSegment(buffer, number, lineId, fieldId, fieldWidth, pageStart, declaredEntries,
            dataOffset, 0, LocatorEncoding.DIRECT_PAGE, true);
    }

    /**
     * Shape probe: occurrence counters are always odd in their low word, page numbers are not.
     */
    private LocatorEncoding probeEncoding(ArchiveBuffer buffer, int dataOffset, int entrySize,
                                          int fieldWidth, int count) {
        int sample = Math.min(probeSample, count);
        int odd = 0;
        for (int i = 0; i < sample; i++) {
            int trailer = dataOffset + i * entrySize + 2 + fieldWidth;
            if ((buffer.u16(trailer) & 1) == 1) {
                odd++;
            }
        }
        return sample >= 3 && odd == sample ? LocatorEncoding.OCCURRENCE_INDEX : LocatorEncoding.DIRECT_PAGE;
    }

    private int firstDisorder(FieldSegment segment) {
        String previous = null;
        for (int i = 0; i < segment.getEntryCount(); i++) {
            String current = segment.valueAt(i);
            if (previous != null && current.compareTo(previous) < 0) {
                return i;
            }
            previous = current;
        }
        return -1;
    }

    private void crossCheckLookupTable(String source, MasterSegment master, List<FieldSegment> fieldSegments,
                                       List<IntegrityWarning> warnings) {
        for (SegmentLookupRecord record : master.getLookupTable()) {
            int number = record.getSegment();
            if (number < 1 || number > fieldSegments.size()) {
                warn(warnings, IntegrityWarning.of(Kind.SEGMENT_MISMATCH,
                    "%s: lookup record for line %d, field %d points at missing segment %d",
                    source, record.getLineId(), record.getFieldId(), number));
                continue;
            }
            FieldSegment segment = fieldSegments.get(number - 1);
            if (segment.getLineId() != record.getLineId() || segment.getFieldId() != record.getFieldId()) {
                warn(warnings, IntegrityWarning.of(Kind.SEGMENT_MISMATCH,
                    "%s: lookup record says segment %d holds line %d, field %d; segment header says line %d, field %d",
                    source, number, record.getLineId(), record.getFieldId(),
                    segment.getLineId(), segment.getFieldId()));
            }
        }
    }

    private void warn(List<IntegrityWarning> warnings, IntegrityWarning warning) {
        logger.warn("{}", warning);
        warnings.add(warning);
    }
}
