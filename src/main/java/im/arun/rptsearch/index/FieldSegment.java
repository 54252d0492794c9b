package im.arun.rptsearch.index;

import im.arun.rptsearch.binary.ArchiveBuffer;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * A per-field sorted value segment. Entries are read straight from the shared
 * archive buffer on demand; the segment itself holds only layout facts fixed at parse time.
 */
public final class FieldSegment {
    /** Length prefix, value, five trailer bytes. */
    public static final int ENTRY_OVERHEAD = 7;

    private final ArchiveBuffer buffer;
    private final int segmentNumber;
    private final int lineId;
    private final int fieldId;
    private final int fieldWidth;
    private final int pageStart;
    private final int declaredEntryCount;
    private final int dataOffset;
    private final int entryCount;
    private final LocatorEncoding encoding;
    private final boolean sorted;

    FieldSegment(ArchiveBuffer buffer, int segmentNumber, int lineId, int fieldId, int fieldWidth,
                 int pageStart, int declaredEntryCount, int dataOffset, int entryCount,
                 LocatorEncoding encoding, boolean sorted) {
        this.buffer = buffer;
        this.segmentNumber = segmentNumber;
        this.lineId = lineId;
        this.fieldId = fieldId;
        this.fieldWidth = fieldWidth;
        this.pageStart = pageStart;
        this.declaredEntryCount = declaredEntryCount;
        this.dataOffset = dataOffset;
        this.entryCount = entryCount;
        this.encoding = encoding;
        this.sorted = sorted;
    }

    /**
     * Strip the trailing space/NUL padding of a fixed-width value.
     */
    public static String trimPadding(String value) {
        int end = value.length();
        while (end > 0 && (value.charAt(end - 1) == ' ' || value.charAt(end - 1) == '\0')) {
            end--;
        }
        return value.substring(0, end);
    }

    public int getSegmentNumber() {
        return segmentNumber;
    }

    public int getLineId() {
        return lineId;
    }

    public int getFieldId() {
        return fieldId;
    }

    public int getFieldWidth() {
        return fieldWidth;
    }

    public int getPageStart() {
        return pageStart;
    }

    public int getDeclaredEntryCount() {
        return declaredEntryCount;
    }

    public int getEntryCount() {
        return entryCount;
    }

    public LocatorEncoding getEncoding() {
        return encoding;
    }

    public boolean isSorted() {
        return sorted;
    }

    public boolean isEmpty() {
        return entryCount == 0;
    }

    int entrySize() {
        return ENTRY_OVERHEAD + fieldWidth;
    }

    String valueAt(int position) {
        int offset = dataOffset + position * entrySize() + 2;
        return trimPadding(buffer.text(offset, fieldWidth, StandardCharsets.ISO_8859_1));
    }

    IndexEntry entryAt(int position) {
        int trailerOffset = dataOffset + position * entrySize() + 2 + fieldWidth;
        Locator locator;
        if (encoding == LocatorEncoding.OCCURRENCE_INDEX) {
            locator = new OccurrenceLocator(buffer.u32(trailerOffset), buffer.bytes(trailerOffset + 4, 1));
        } else {
            locator = new DirectPageLocator(buffer.u16(trailerOffset), buffer.bytes(trailerOffset + 2, 3));
        }
        return new IndexEntry(valueAt(position), locator, position);
    }

    /**
     * All entries whose trimmed value equals {@code value}, in segment order.
     * Binary search followed by a scan in both directions while the value holds.
     */
    public List<IndexEntry> search(String value) {
        if (entryCount == 0 || value == null) {
            return List.of();
        }
        String key = trimPadding(value);
        if (!sorted) {
            return linearScan(key::equals);
        }

        int lo = 0;
        int hi = entryCount - 1;
        int hit = -1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            int cmp = valueAt(mid).compareTo(key);
            if (cmp < 0) {
                lo = mid + 1;
            } else if (cmp > 0) {
                hi = mid - 1;
            } else {
                hit = mid;
                break;
            }
        }
        if (hit < 0) {
            return List.of();
        }

        int first = hit;
        while (first > 0 && valueAt(first - 1).equals(key)) {
            first--;
        }
        int last = hit;
        while (last < entryCount - 1 && valueAt(last + 1).equals(key)) {
            last++;
        }

        List<IndexEntry> matches = new ArrayList<>(last - first + 1);
        for (int i = first; i <= last; i++) {
            matches.add(entryAt(i));
        }
        return matches;
    }

    /**
     * All entries whose trimmed value starts with {@code prefix}, in segment order.
     * Lower-bound binary search, then a forward scan while the prefix holds.
     */
    public List<IndexEntry> searchPrefix(String prefix) {
        if (entryCount == 0 || prefix == null || prefix.isEmpty()) {
            return List.of();
        }
        if (!sorted) {
            return linearScan(value -> value.startsWith(prefix));
        }

        int lo = 0;
        int hi = entryCount;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (valueAt(mid).compareTo(prefix) < 0) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }

        List<IndexEntry> matches = new ArrayList<>();
        for (int i = lo; i < entryCount && valueAt(i).startsWith(prefix); i++) {
            matches.add(entryAt(i));
        }
        return matches;
    }

    private List<IndexEntry> linearScan(Predicate<String> accept) {
        List<IndexEntry> matches = new ArrayList<>();
        for (int i = 0; i < entryCount; i++) {
            if (accept.test(valueAt(i))) {
                matches.add(entryAt(i));
            }
        }
        return matches;
    }

    public List<IndexEntry> entries() {
        List<IndexEntry> entries = new ArrayList<>(entryCount);
        for (int i = 0; i < entryCount; i++) {
            entries.add(entryAt(i));
        }
        return entries;
    }

    /**
     * Distinct values with their entry counts, in segment order.
     */
    public Map<String, Integer> distinctValues() {
        return distinctValues(0);
    }

    /**
     * Distinct values of the first {@code maxEntries} entries; 0 reads them all.
     */
    public Map<String, Integer> distinctValues(int maxEntries) {
        int limit = maxEntries > 0 ? Math.min(maxEntries, entryCount) : entryCount;
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (int i = 0; i < limit; i++) {
            counts.merge(valueAt(i), 1, Integer::sum);
        }
        return counts;
    }
}
