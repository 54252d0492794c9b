package im.arun.rptsearch.fixture;

import im.arun.rptsearch.store.PageStoreReader;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.Deflater;

/**
 * Builds synthetic page stores the way the archive writer lays them out: file
 * header, instance header, table directory, zlib page blocks from 0x200, then
 * the section table and the page table, each closed by {@code ENDDATA}.
 */
public class PageStoreFixture {
    private static final int INSTANCE = PageStoreReader.INSTANCE_HEADER_OFFSET;

    private final List<String> pages = new ArrayList<>();
    private final List<long[]> sections = new ArrayList<>();
    private final Set<Integer> corrupt = new HashSet<>();
    private final Set<Integer> detached = new HashSet<>();
    private Charset charset = StandardCharsets.ISO_8859_1;
    private Integer declaredPages;
    private boolean sectionTable;
    private int directorySkew;
    private int domainId = 1;
    private int speciesId = 1346;
    private String timestamp = "2025/01/13 08:00:00.000";

    public PageStoreFixture page(String... lines) {
        pages.add(String.join("\r\n", lines) + "\r\n");
        return this;
    }

    public PageStoreFixture pages(List<String> texts) {
        pages.addAll(texts);
        return this;
    }

    public PageStoreFixture section(long id, int startPage, int pageCount) {
        sectionTable = true;
        sections.add(new long[] {id, startPage, pageCount});
        return this;
    }

    /**
     * Writes an empty section table even when no sections were added.
     */
    public PageStoreFixture emptySectionTable() {
        sectionTable = true;
        return this;
    }

    public PageStoreFixture charset(Charset charset) {
        this.charset = charset;
        return this;
    }

    public PageStoreFixture identity(int domainId, int speciesId, String timestamp) {
        this.domainId = domainId;
        this.speciesId = speciesId;
        this.timestamp = timestamp;
        return this;
    }

    /**
     * Page count written to the table directory; the page table still lists the real pages.
     */
    public PageStoreFixture declaredPages(int count) {
        this.declaredPages = count;
        return this;
    }

    /**
     * Directory offsets point {@code bytes} before the tables instead of at them.
     */
    public PageStoreFixture directorySkew(int bytes) {
        this.directorySkew = bytes;
        return this;
    }

    /**
     * Page {@code n} gets a block of bytes that is not a zlib stream.
     */
    public PageStoreFixture corruptPage(int pageNumber) {
        corrupt.add(pageNumber);
        return this;
    }

    /**
     * Page {@code n} gets a table entry pointing past the end of the file.
     */
    public PageStoreFixture detachedPage(int pageNumber) {
        detached.add(pageNumber);
        return this;
    }

    public byte[] build() {
        LittleEndianOutput out = new LittleEndianOutput();
        String line = String.format("RPTFILEHDR\t%04d:%d\t%s\u001A", domainId, speciesId, timestamp);
        out.putBytes(0, line.getBytes(StandardCharsets.US_ASCII));
        out.putU32(0xC0, 0x010500E0L);
        out.putU32(0xC4, 1);
        out.putU32(0xC8, 0xE0);
        out.putBytes(0xD4, "ENDHDR\0\0".getBytes(StandardCharsets.US_ASCII));
        out.putU32(0xE0, INSTANCE);

        out.putBytes(INSTANCE, "RPTINSTHDR\0\0".getBytes(StandardCharsets.US_ASCII));
        out.putU32(INSTANCE + 0x0C, 0xE0);
        out.putU32(INSTANCE + 0x10, 1);
        out.putU32(INSTANCE + 0x14, speciesId);
        out.putBytes(INSTANCE + 0xD0, "ENDHDR\0\0".getBytes(StandardCharsets.US_ASCII));
        out.padTo(PageStoreReader.HEADER_LENGTH);

        List<long[]> blocks = new ArrayList<>();
        for (int i = 0; i < pages.size(); i++) {
            byte[] raw = pages.get(i).getBytes(charset);
            byte[] block = corrupt.contains(i + 1) ? new byte[] {0x11, 0x22, 0x33, 0x44, 0x55, 0x66} : deflate(raw);
            long offset = out.size();
            out.bytes(block);
            blocks.add(new long[] {offset, block.length, raw.length});
        }
        int dataEnd = out.size();
        out.putU32(0xE8, dataEnd - INSTANCE);

        int sectionTableAt = 0;
        if (sectionTable) {
            sectionTableAt = out.size();
            out.bytes(PageStoreReader.SECTION_TABLE_MARKER);
            for (long[] section : sections) {
                out.u32(section[0]);
                out.u32(section[1]);
                out.u32(section[2]);
            }
            out.bytes("ENDDATA\0\0".getBytes(StandardCharsets.US_ASCII));
        }

        int pageTableAt = out.size();
        out.bytes(PageStoreReader.PAGE_TABLE_MARKER);
        int fileEnd = pageTableAt + PageStoreReader.PAGE_TABLE_MARKER.length
            + blocks.size() * PageStoreReader.PAGE_ENTRY_SIZE + 9;
        for (int i = 0; i < blocks.size(); i++) {
            long[] block = blocks.get(i);
            long absolute = detached.contains(i + 1) ? fileEnd + 1000 : block[0];
            out.u32(absolute - INSTANCE);
            out.u32(0);
            out.u16(133);
            out.u16(66);
            out.u32(block[2]);
            out.u32(block[1]);
            out.u32(0);
        }
        out.bytes("ENDDATA\0\0".getBytes(StandardCharsets.US_ASCII));

        out.putU8(PageStoreReader.PAGE_TABLE_ROW, 0x02);
        out.putU8(PageStoreReader.PAGE_TABLE_ROW + 1, 0x01);
        out.putU32(PageStoreReader.PAGE_TABLE_ROW + 4, declaredPages != null ? declaredPages : pages.size());
        out.putU32(PageStoreReader.PAGE_TABLE_ROW + 8, pageTableAt - directorySkew - INSTANCE);
        if (sectionTable) {
            out.putU8(PageStoreReader.SECTION_TABLE_ROW, 0x01);
            out.putU8(PageStoreReader.SECTION_TABLE_ROW + 1, 0x01);
            out.putU32(PageStoreReader.SECTION_TABLE_ROW + 4, sections.size());
            out.putU32(PageStoreReader.SECTION_TABLE_ROW + 8, sectionTableAt - directorySkew - INSTANCE);
        }
        return out.toByteArray();
    }

    static byte[] deflate(byte[] raw) {
        Deflater deflater = new Deflater();
        try {
            deflater.setInput(raw);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] chunk = new byte[4096];
            while (!deflater.finished()) {
                int n = deflater.deflate(chunk);
                out.write(chunk, 0, n);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }
}
