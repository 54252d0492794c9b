package im.arun.rptsearch.store;

import im.arun.rptsearch.binary.ArchiveFormatException;
import im.arun.rptsearch.fixture.PageStoreFixture;
import im.arun.rptsearch.fixture.SampleArchive;
import im.arun.rptsearch.model.IntegrityWarning;
import im.arun.rptsearch.model.Section;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.zip.Deflater;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageStoreReaderTest {
    private final PageStoreReader reader = new PageStoreReader();

    @Test
    void readsPagesAndSections() throws Exception {
        PageStore store = reader.open(SampleArchive.storeFixture().build(), "sample.RPT");

        assertThat(store.pageCount()).isEqualTo(6);
        assertThat(store.getWarnings()).isEmpty();
        assertThat(store.sections()).extracting(Section::getSectionId).containsExactly(1L, 2L, 3L);
        assertThat(store.sections().get(2).getStartPage()).isEqualTo(5);
        assertThat(store.sections().get(2).lastPage()).isEqualTo(6);

        PageText page = store.getPageText(2, StandardCharsets.ISO_8859_1);
        assertThat(page.getPageNumber()).isEqualTo(2);
        assertThat(page.getLines()).hasSize(4);
        assertThat(page.getLines().get(0)).isEqualTo("REPORT DDU017P PAGE 0002");
        assertThat(page.getLines().get(1)).isEmpty();
        assertThat(page.getLines().get(2)).startsWith("200-044295-001  JOHN DOE");
    }

    @Test
    void readsLargeStoreWithSectionRanges() throws Exception {
        List<String> pages = new ArrayList<>();
        for (int i = 1; i <= 3500; i++) {
            pages.add("PAGE " + i + "\r\n");
        }
        byte[] data = new PageStoreFixture().pages(pages)
            .section(1, 1, 890)
            .section(2, 891, 2203)
            .section(3, 3094, 407)
            .build();

        PageStore store = reader.open(data, "large.RPT");

        assertThat(store.pageCount()).isEqualTo(3500);
        assertThat(store.sections()).hasSize(3);
        assertThat(store.sections().get(1).lastPage()).isEqualTo(3093);
        assertThat(store.sections().get(2).lastPage()).isEqualTo(3500);
        assertThat(store.getPageText(3500, StandardCharsets.ISO_8859_1).getLines()).containsExactly("PAGE 3500");
        assertThat(store.getPageText(1, StandardCharsets.ISO_8859_1).getLines()).containsExactly("PAGE 1");
    }

    @Test
    void missingPagesAreAGapNotAFailure() throws Exception {
        byte[] data = new PageStoreFixture().page("one").page("two").declaredPages(4).build();

        PageStore store = reader.open(data, "gap.RPT");

        assertThat(store.pageCount()).isEqualTo(4);
        assertThat(store.getWarnings()).extracting(IntegrityWarning::getKind)
            .containsExactly(IntegrityWarning.Kind.PAGE_GAP);
        assertThat(store.getPageText(2, StandardCharsets.ISO_8859_1).getLines()).containsExactly("two");
        assertThatThrownBy(() -> store.getPageText(3, StandardCharsets.ISO_8859_1))
            .isInstanceOf(PageReadException.class)
            .extracting(e -> ((PageReadException) e).getPageNumber())
            .isEqualTo(3);
    }

    @Test
    void corruptBlockFailsOnlyThatPage() throws Exception {
        byte[] data = new PageStoreFixture().page("one").page("two").page("three").corruptPage(2).build();

        PageStore store = reader.open(data, "corrupt.RPT");

        assertThatThrownBy(() -> store.getPageText(2, StandardCharsets.ISO_8859_1))
            .isInstanceOf(PageReadException.class)
            .hasMessageContaining("page 2");
        assertThat(store.getPageText(1, StandardCharsets.ISO_8859_1).getLines()).containsExactly("one");
        assertThat(store.getPageText(3, StandardCharsets.ISO_8859_1).getLines()).containsExactly("three");
    }

    @Test
    void blockOutsideFileIsUnreadable() throws Exception {
        byte[] data = new PageStoreFixture().page("one").page("two").detachedPage(1).build();

        PageStore store = reader.open(data, "detached.RPT");

        assertThat(store.pageEntry(1).isReadable()).isFalse();
        assertThat(store.getWarnings()).extracting(IntegrityWarning::getKind)
            .containsExactly(IntegrityWarning.Kind.PAGE_GAP);
        assertThatThrownBy(() -> store.getPageText(1, StandardCharsets.ISO_8859_1))
            .isInstanceOf(PageReadException.class);
        assertThat(store.getPageText(2, StandardCharsets.ISO_8859_1).getLines()).containsExactly("two");
    }

    @Test
    void decodesDoubleByteReports() throws Exception {
        byte[] data = new PageStoreFixture().charset(StandardCharsets.UTF_16LE)
            .page("ZÜRICH 8001", "KONTO 42")
            .build();

        PageStore store = reader.open(data, "utf16.RPT");

        assertThat(store.getPageText(1, StandardCharsets.UTF_16LE).getLines())
            .containsExactly("ZÜRICH 8001", "KONTO 42");
    }

    @Test
    void storeWithoutSectionTableHasNoSections() throws Exception {
        PageStore store = reader.open(new PageStoreFixture().page("one").build(), "open.RPT");

        assertThat(store.sections()).isEmpty();
        assertThat(store.getHeader().getSectionTableOffset()).isZero();
    }

    @Test
    void invalidSectionIsSkippedWithWarning() throws Exception {
        byte[] data = new PageStoreFixture().page("one").page("two")
            .section(1, 1, 1)
            .section(2, 2, 0)
            .build();

        PageStore store = reader.open(data, "sections.RPT");

        assertThat(store.sections()).extracting(Section::getSectionId).containsExactly(1L);
        assertThat(store.getWarnings()).extracting(IntegrityWarning::getKind)
            .containsExactly(IntegrityWarning.Kind.INVALID_SECTION);
    }

    @Test
    void splitsOnCrLfAndLf() {
        assertThat(PageStore.splitLines("a\nb\r\nc")).containsExactly("a", "b", "c");
        assertThat(PageStore.splitLines("a\r\n")).containsExactly("a");
        assertThat(PageStore.splitLines("a\n\nb")).containsExactly("a", "", "b");
        assertThat(PageStore.splitLines("")).isEmpty();
    }

    @Test
    void readsHeaderLineAndTableDirectory() throws Exception {
        byte[] data = new PageStoreFixture().identity(1, 1346, "2025/01/13 08:00:00.000")
            .page("one").page("two")
            .section(7, 1, 2)
            .build();

        PageStoreHeader header = reader.open(data, "header.RPT").getHeader();

        assertThat(header.getDomainId()).isEqualTo(1);
        assertThat(header.getSpeciesId()).isEqualTo(1346);
        assertThat(header.getTimestamp()).isEqualTo("2025/01/13 08:00:00.000");
        assertThat(header.getDeclaredPageCount()).isEqualTo(2);
        assertThat(header.getDeclaredSectionCount()).isEqualTo(1);
        assertThat(header.getPageTableOffset()).isEqualTo(indexOf(data, PageStoreReader.PAGE_TABLE_MARKER));
        assertThat(header.getSectionTableOffset()).isEqualTo(indexOf(data, PageStoreReader.SECTION_TABLE_MARKER));
    }

    @Test
    void pageOffsetsAreRelativeToInstanceHeader() throws Exception {
        byte[] data = new PageStoreFixture().page("one").page("two").build();

        PageStore store = reader.open(data, "offsets.RPT");

        assertThat(store.pageEntry(1).getOffset()).isEqualTo(PageStoreReader.HEADER_LENGTH);
        assertThat(store.pageEntry(1).getLineWidth()).isEqualTo(133);
        assertThat(store.pageEntry(1).getLinesPerPage()).isEqualTo(66);
        assertThat(store.getPageText(2, StandardCharsets.ISO_8859_1).getLines()).containsExactly("two");
    }

    @Test
    void findsTablesNearTheDirectoryOffset() throws Exception {
        byte[] data = new PageStoreFixture().page("one").page("two")
            .section(1, 1, 1)
            .section(2, 2, 1)
            .directorySkew(40)
            .build();

        PageStore store = reader.open(data, "skewed.RPT");

        assertThat(store.getWarnings()).isEmpty();
        assertThat(store.sections()).extracting(Section::getSectionId).containsExactly(1L, 2L);
        assertThat(store.getPageText(1, StandardCharsets.ISO_8859_1).getLines()).containsExactly("one");
    }

    @Test
    void findsTablesByScanWhenDirectoryOffsetsAreZero() throws Exception {
        byte[] data = new PageStoreFixture().page("one").page("two").section(1, 1, 2).build();
        putU32(data, PageStoreReader.PAGE_TABLE_ROW + PageStoreReader.ROW_OFFSET, 0);
        putU32(data, PageStoreReader.SECTION_TABLE_ROW + PageStoreReader.ROW_OFFSET, 0);

        PageStore store = reader.open(data, "scan.RPT");

        assertThat(store.pageCount()).isEqualTo(2);
        assertThat(store.sections()).extracting(Section::getSectionId).containsExactly(1L);
        assertThat(store.getPageText(2, StandardCharsets.ISO_8859_1).getLines()).containsExactly("two");
    }

    @Test
    void opensStoreWrittenByHand() throws Exception {
        byte[] page = "HAND MADE\r\n".getBytes(StandardCharsets.US_ASCII);
        byte[] block = deflate(page);
        ByteBuffer buf = ByteBuffer.allocate(0x200 + block.length + 13 + 24 + 9).order(ByteOrder.LITTLE_ENDIAN);
        buf.put("RPTFILEHDR\t0042:77\t2024/06/30 23:59:59.000\u001A".getBytes(StandardCharsets.US_ASCII));
        buf.put(0xF0, "RPTINSTHDR\0\0".getBytes(StandardCharsets.US_ASCII));
        int pageTable = 0x200 + block.length;
        buf.put(0x1D0, (byte) 0x02).put(0x1D1, (byte) 0x01);
        buf.putInt(0x1D4, 1);
        buf.putInt(0x1D8, pageTable - 0xF0);
        buf.position(0x200);
        buf.put(block);
        buf.put("PAGETBLHDR\0\0\0".getBytes(StandardCharsets.US_ASCII));
        buf.putInt(0x200 - 0xF0).putInt(0).putShort((short) 80).putShort((short) 60)
            .putInt(page.length).putInt(block.length).putInt(0);
        buf.put("ENDDATA\0\0".getBytes(StandardCharsets.US_ASCII));

        PageStore store = reader.open(buf.array(), "hand.RPT");

        assertThat(store.getHeader().getDomainId()).isEqualTo(42);
        assertThat(store.getHeader().getSpeciesId()).isEqualTo(77);
        assertThat(store.sections()).isEmpty();
        assertThat(store.getPageText(1, StandardCharsets.US_ASCII).getLines()).containsExactly("HAND MADE");
    }

    @Test
    void rejectsMissingSignature() {
        byte[] data = SampleArchive.storeFixture().build();
        data[2] = 'X';

        assertThatThrownBy(() -> reader.open(data, "bad.RPT"))
            .isInstanceOf(ArchiveFormatException.class)
            .hasMessageContaining("RPTFILEHDR");
    }

    @Test
    void rejectsMissingPageTableMarker() {
        byte[] data = SampleArchive.storeFixture().build();
        data[indexOf(data, PageStoreReader.PAGE_TABLE_MARKER)] = 'X';

        assertThatThrownBy(() -> reader.open(data, "bad.RPT"))
            .isInstanceOf(ArchiveFormatException.class)
            .hasMessageContaining("PAGETBLHDR");
    }

    @Test
    void rejectsTruncatedHeader() {
        byte[] data = Arrays.copyOf(SampleArchive.storeFixture().build(), 0x100);

        assertThatThrownBy(() -> reader.open(data, "short.RPT"))
            .isInstanceOf(ArchiveFormatException.class)
            .hasMessageContaining("truncated");
    }

    @Test
    void opensFromPath(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("260271NL.RPT");
        Files.write(file, SampleArchive.storeFixture().build());

        PageStore store = reader.open(file);

        assertThat(store.getSource()).isEqualTo("260271NL.RPT");
        assertThat(store.pageCount()).isEqualTo(6);
    }

    private static int indexOf(byte[] data, byte[] marker) {
        outer:
        for (int i = 0; i + marker.length <= data.length; i++) {
            for (int j = 0; j < marker.length; j++) {
                if (data[i + j] != marker[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    private static void putU32(byte[] data, int offset, long value) {
        ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN).putInt(offset, (int) value);
    }

    private static byte[] deflate(byte[] raw) {
        Deflater deflater = new Deflater();
        try {
            deflater.setInput(raw);
            deflater.finish();
            byte[] out = new byte[raw.length + 64];
            int n = deflater.deflate(out);
            return Arrays.copyOf(out, n);
        } finally {
            deflater.end();
        }
    }
}
