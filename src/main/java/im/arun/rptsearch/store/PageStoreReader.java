package im.arun.rptsearch.store;

import im.arun.rptsearch.binary.ArchiveBuffer;
import im.arun.rptsearch.binary.ArchiveFormatException;
import im.arun.rptsearch.model.IntegrityWarning;
import im.arun.rptsearch.model.IntegrityWarning.Kind;
import im.arun.rptsearch.model.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes binary page store (.RPT) files.
 *
 * <p>Layout: an ASCII header line ({@code RPTFILEHDR\t<domain>:<species>\t<timestamp>})
 * at 0x000, the instance header ({@code RPTINSTHDR}) at 0x0F0, a table directory
 * at 0x1D0 and zlib page blocks from 0x200. The page table ({@code PAGETBLHDR})
 * and section table ({@code SECTIONHDR}) follow the page blocks. Every offset
 * stored in the directory or the page table is relative to the instance header.</p>
 */
public class PageStoreReader {
    private static final Logger logger = LoggerFactory.getLogger(PageStoreReader.class);

    public static final byte[] SIGNATURE = ascii("RPTFILEHDR");
    public static final byte[] INSTANCE_HEADER_MARKER = ascii("RPTINSTHDR");
    public static final byte[] PAGE_TABLE_MARKER = ascii("PAGETBLHDR\0\0\0");
    public static final byte[] SECTION_TABLE_MARKER = ascii("SECTIONHDR\0\0\0");
    public static final byte[] END_MARKER = ascii("ENDDATA");

    /** Header line ends at 0x1A or NUL, and never runs into the fixed sub-header. */
    public static final int HEADER_LINE_LIMIT = 0xC0;
    public static final int INSTANCE_HEADER_OFFSET = 0xF0;

    /** Table directory rows: u16 type, u16 reserved, u32 count, u32 relative offset, u32 reserved. */
    public static final int PAGE_TABLE_ROW = 0x1D0;
    public static final int SECTION_TABLE_ROW = 0x1E0;
    public static final int BINARY_TABLE_ROW = 0x1F0;
    public static final int ROW_COUNT = 4;
    public static final int ROW_OFFSET = 8;

    /** First page block; also the minimum file length. */
    public static final int HEADER_LENGTH = 0x200;

    public static final int PAGE_ENTRY_SIZE = 24;
    public static final int SECTION_ENTRY_SIZE = 12;

    /** How far past the directory offset a table marker is looked for before scanning the whole file. */
    private static final int NEAR_SCAN_WINDOW = 4096;

    private static byte[] ascii(String text) {
        return text.getBytes(StandardCharsets.US_ASCII);
    }

    public PageStore open(Path path) throws IOException {
        return open(Files.readAllBytes(path), path.getFileName().toString());
    }

    public PageStore open(byte[] data, String source) throws ArchiveFormatException {
        ArchiveBuffer buffer = new ArchiveBuffer(data, source);
        List<IntegrityWarning> warnings = new ArrayList<>();

        PageStoreHeader header = parseHeader(buffer);
        List<PageTableEntry> pages = readPageTable(buffer, header, warnings);
        List<Section> sections = readSectionTable(buffer, header, warnings);

        logger.debug("Parsed {}: domain {}, species {}, {} pages ({} declared), {} sections, {} binary objects",
            source, header.getDomainId(), header.getSpeciesId(), pages.size(), header.getDeclaredPageCount(),
            sections.size(), header.getBinaryObjectCount());
        return new PageStore(buffer, header, pages, sections, warnings);
    }

    private PageStoreHeader parseHeader(ArchiveBuffer buffer) throws ArchiveFormatException {
        if (!buffer.regionMatches(0, SIGNATURE)) {
            throw buffer.formatError(0, "missing RPTFILEHDR signature");
        }
        if (buffer.length() < HEADER_LENGTH) {
            throw buffer.formatError(buffer.length(), "header truncated, " + buffer.length() + " bytes");
        }
        if (!buffer.regionMatches(INSTANCE_HEADER_OFFSET, INSTANCE_HEADER_MARKER)) {
            logger.debug("{}: no RPTINSTHDR marker at 0x{}", buffer.source(),
                Integer.toHexString(INSTANCE_HEADER_OFFSET).toUpperCase());
        }

        String[] parts = headerLine(buffer).split("\t");
        int domainId = 0;
        int speciesId = 0;
        if (parts.length >= 2 && parts[1].contains(":")) {
            String[] ids = parts[1].split(":", 2);
            domainId = parseId(buffer, ids[0]);
            speciesId = parseId(buffer, ids[1]);
        }
        String timestamp = parts.length >= 3 ? parts[2].trim() : "";

        return new PageStoreHeader(
            domainId,
            speciesId,
            timestamp,
            (int) Math.min(buffer.u32(PAGE_TABLE_ROW + ROW_COUNT), Integer.MAX_VALUE),
            tableOffset(buffer, PAGE_TABLE_ROW),
            (int) Math.min(buffer.u32(SECTION_TABLE_ROW + ROW_COUNT), Integer.MAX_VALUE),
            tableOffset(buffer, SECTION_TABLE_ROW),
            buffer.u32(BINARY_TABLE_ROW + ROW_COUNT));
    }

    private String headerLine(ArchiveBuffer buffer) {
        int end = SIGNATURE.length;
        while (end < HEADER_LINE_LIMIT) {
            int b = buffer.u8(end);
            if (b == 0x1A || b == 0) {
                break;
            }
            end++;
        }
        return buffer.text(0, end, StandardCharsets.US_ASCII);
    }

    private int parseId(ArchiveBuffer buffer, String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            logger.debug("{}: header id '{}' is not a number", buffer.source(), text);
            return 0;
        }
    }

    /**
     * Absolute position a directory row points at, or 0 when the row is empty.
     */
    private long tableOffset(ArchiveBuffer buffer, int row) {
        long relative = buffer.u32(row + ROW_OFFSET);
        return relative == 0 ? 0 : relative + INSTANCE_HEADER_OFFSET;
    }

    private List<PageTableEntry> readPageTable(ArchiveBuffer buffer, PageStoreHeader header,
                                               List<IntegrityWarning> warnings) throws ArchiveFormatException {
        int declared = header.getDeclaredPageCount();
        int marker = locateTable(buffer, header.getPageTableOffset(), PAGE_TABLE_MARKER);
        if (marker < 0) {
            if (declared == 0) {
                return List.of();
            }
            throw buffer.formatError(header.getPageTableOffset(),
                "PAGETBLHDR page table not found for " + declared + " declared pages");
        }

        int first = marker + PAGE_TABLE_MARKER.length;
        List<PageTableEntry> pages = new ArrayList<>();
        List<Integer> unreadable = new ArrayList<>();
        for (int i = 0; i < declared; i++) {
            int off = first + i * PAGE_ENTRY_SIZE;
            if (!buffer.fits(off, PAGE_ENTRY_SIZE) || buffer.regionMatches(off, END_MARKER)) {
                break;
            }
            long blockOffset = buffer.u32(off) + INSTANCE_HEADER_OFFSET;
            long compressedSize = buffer.u32(off + 16);
            boolean readable = compressedSize > 0
                && blockOffset >= HEADER_LENGTH
                && blockOffset + compressedSize <= buffer.length();
            if (!readable) {
                unreadable.add(i + 1);
            }
            pages.add(new PageTableEntry(i + 1, blockOffset, buffer.u16(off + 8), buffer.u16(off + 10),
                buffer.u32(off + 12), compressedSize, readable));
        }

        if (pages.size() < declared) {
            warn(warnings, IntegrityWarning.of(Kind.PAGE_GAP,
                "%s: directory declares %d pages, page table has %d; pages %d-%d are missing",
                buffer.source(), declared, pages.size(), pages.size() + 1, declared));
        }
        if (!unreadable.isEmpty()) {
            warn(warnings, IntegrityWarning.of(Kind.PAGE_GAP,
                "%s: %d page blocks lie outside the file, first is page %d",
                buffer.source(), unreadable.size(), unreadable.get(0)));
        }
        return pages;
    }

    private List<Section> readSectionTable(ArchiveBuffer buffer, PageStoreHeader header,
                                           List<IntegrityWarning> warnings) {
        int declared = header.getDeclaredSectionCount();
        if (declared == 0 && header.getSectionTableOffset() == 0) {
            return List.of();
        }
        int marker = locateTable(buffer, header.getSectionTableOffset(), SECTION_TABLE_MARKER);
        if (marker < 0) {
            if (declared > 0) {
                warn(warnings, IntegrityWarning.of(Kind.INVALID_SECTION,
                    "%s: directory declares %d sections but there is no SECTIONHDR table",
                    buffer.source(), declared));
            }
            return List.of();
        }

        int first = marker + SECTION_TABLE_MARKER.length;
        List<Section> sections = new ArrayList<>();
        int read = 0;
        while (declared == 0 || read < declared) {
            int off = first + read * SECTION_ENTRY_SIZE;
            if (!buffer.fits(off, SECTION_ENTRY_SIZE) || buffer.regionMatches(off, END_MARKER)) {
                if (declared > 0) {
                    warn(warnings, IntegrityWarning.of(Kind.INVALID_SECTION,
                        "%s: directory declares %d sections but the table ends after %d",
                        buffer.source(), declared, read));
                }
                break;
            }
            long sectionId = buffer.u32(off);
            long startPage = buffer.u32(off + 4);
            long pageCount = buffer.u32(off + 8);
            read++;
            if (sectionId == 0 && startPage == 0 && pageCount == 0) {
                break;
            }
            if (startPage < 1 || pageCount < 1 || startPage > Integer.MAX_VALUE || pageCount > Integer.MAX_VALUE) {
                warn(warnings, IntegrityWarning.of(Kind.INVALID_SECTION,
                    "%s: section %d has start page %d and page count %d; skipped",
                    buffer.source(), sectionId, startPage, pageCount));
                continue;
            }
            sections.add(new Section(sectionId, String.valueOf(sectionId), (int) startPage, (int) pageCount));
        }
        return sections;
    }

    /**
     * Finds a table marker: at the directory offset, else shortly after it, else
     * anywhere after the header. Directory offsets of some writers point near the
     * table rather than at it. Returns -1 when the marker is absent.
     */
    private int locateTable(ArchiveBuffer buffer, long declaredOffset, byte[] marker) {
        if (declaredOffset >= HEADER_LENGTH && declaredOffset <= Integer.MAX_VALUE
            && buffer.regionMatches((int) declaredOffset, marker)) {
            return (int) declaredOffset;
        }
        if (declaredOffset >= HEADER_LENGTH && declaredOffset < buffer.length()) {
            int near = buffer.indexOf(marker, (int) declaredOffset - 16);
            if (near >= 0 && near - declaredOffset <= NEAR_SCAN_WINDOW) {
                logger.debug("{}: table marker at 0x{}, directory says 0x{}", buffer.source(),
                    Integer.toHexString(near).toUpperCase(), Long.toHexString(declaredOffset).toUpperCase());
                return near;
            }
        }
        int anywhere = buffer.indexOf(marker, HEADER_LENGTH);
        if (anywhere >= 0) {
            logger.debug("{}: table marker found by full scan at 0x{}", buffer.source(),
                Integer.toHexString(anywhere).toUpperCase());
        }
        return anywhere;
    }

    private void warn(List<IntegrityWarning> warnings, IntegrityWarning warning) {
        logger.warn("{}", warning);
        warnings.add(warning);
    }
}
