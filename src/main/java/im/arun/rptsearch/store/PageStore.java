package im.arun.rptsearch.store;

import im.arun.rptsearch.binary.ArchiveBuffer;
import im.arun.rptsearch.model.IntegrityWarning;
import im.arun.rptsearch.model.Section;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * Parsed page store of one report instance revision. Page blocks are inflated
 * on request; the parsed tables are immutable and shared between queries.
 */
public final class PageStore {
    private static final int INFLATE_CHUNK = 8192;

    private final ArchiveBuffer buffer;
    private final PageStoreHeader header;
    private final List<PageTableEntry> pages;
    private final List<Section> sections;
    private final List<IntegrityWarning> warnings;

    PageStore(ArchiveBuffer buffer, PageStoreHeader header, List<PageTableEntry> pages,
              List<Section> sections, List<IntegrityWarning> warnings) {
        this.buffer = buffer;
        this.header = header;
        this.pages = List.copyOf(pages);
        this.sections = List.copyOf(sections);
        this.warnings = List.copyOf(warnings);
    }

    public String getSource() {
        return buffer.source();
    }

    public PageStoreHeader getHeader() {
        return header;
    }

    /**
     * Number of pages the store claims, which may exceed the readable entries.
     */
    public int pageCount() {
        return Math.max(header.getDeclaredPageCount(), pages.size());
    }

    public List<PageTableEntry> getPages() {
        return pages;
    }

    /**
     * Section table in file order; empty when the report has no section security.
     */
    public List<Section> sections() {
        return sections;
    }

    public List<IntegrityWarning> getWarnings() {
        return warnings;
    }

    public PageTableEntry pageEntry(int pageNumber) throws PageReadException {
        if (pageNumber < 1 || pageNumber > pages.size()) {
            throw new PageReadException(pageNumber, "no page table entry (store has " + pages.size() + ")");
        }
        return pages.get(pageNumber - 1);
    }

    public PageText getPageText(int pageNumber, Charset charset) throws PageReadException {
        byte[] raw = inflate(pageEntry(pageNumber));
        return new PageText(pageNumber, splitLines(new String(raw, charset)));
    }

    byte[] inflate(PageTableEntry entry) throws PageReadException {
        if (!entry.isReadable()) {
            throw new PageReadException(entry.getPageNumber(),
                String.format("block at 0x%X (%d bytes) lies outside the file", entry.getOffset(), entry.getCompressedSize()));
        }
        byte[] compressed = buffer.bytes((int) entry.getOffset(), (int) entry.getCompressedSize());
        int sizeHint = (int) Math.min(Math.max(entry.getUncompressedSize(), 256), 1 << 24);

        Inflater inflater = new Inflater();
        try {
            inflater.setInput(compressed);
            ByteArrayOutputStream out = new ByteArrayOutputStream(sizeHint);
            byte[] chunk = new byte[INFLATE_CHUNK];
            while (!inflater.finished()) {
                int n = inflater.inflate(chunk);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new PageReadException(entry.getPageNumber(), "compressed block ends before the stream does");
                }
                out.write(chunk, 0, n);
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            throw new PageReadException(entry.getPageNumber(), "corrupt compressed block: " + e.getMessage(), e);
        } finally {
            inflater.end();
        }
    }

    /**
     * Split at CRLF or LF. A terminator at the very end does not start another line.
     */
    static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int length = text.length();
        while (start < length) {
            int newline = text.indexOf('\n', start);
            if (newline < 0) {
                lines.add(stripCarriageReturn(text.substring(start)));
                break;
            }
            lines.add(stripCarriageReturn(text.substring(start, newline)));
            start = newline + 1;
        }
        return lines;
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
