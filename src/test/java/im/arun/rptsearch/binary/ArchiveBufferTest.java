package im.arun.rptsearch.binary;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ArchiveBufferTest {

    @Test
    void readsLittleEndianUnsignedValues() {
        byte[] data = {(byte) 0xFE, 0x01, 0x02, 0x03, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF};
        ArchiveBuffer buffer = new ArchiveBuffer(data, "test");

        assertThat(buffer.u8(0)).isEqualTo(0xFE);
        assertThat(buffer.u16(0)).isEqualTo(0x01FE);
        assertThat(buffer.u32(0)).isEqualTo(0x030201FEL);
        assertThat(buffer.u32(4)).isEqualTo(0xFFFFFFFFL);
    }

    @Test
    void decodesPaddedDoubleByteText() {
        byte[] label = "2025-01-13".getBytes(StandardCharsets.UTF_16LE);
        byte[] data = new byte[24];
        System.arraycopy(label, 0, data, 0, label.length);
        ArchiveBuffer buffer = new ArchiveBuffer(data, "test");

        assertThat(buffer.doubleByteText(0, 24)).isEqualTo("2025-01-13");
        assertThat(buffer.doubleByteText(20, 10)).isEmpty();
    }

    @Test
    void findsMarkersAndChecksBounds() {
        byte[] marker = ArchiveBuffer.doubleByte("**ME");
        byte[] data = new byte[40];
        System.arraycopy(marker, 0, data, 12, marker.length);
        System.arraycopy(marker, 0, data, 30, marker.length);
        ArchiveBuffer buffer = new ArchiveBuffer(data, "test");

        assertThat(buffer.indexOf(marker, 0)).isEqualTo(12);
        assertThat(buffer.indexOf(marker, 13)).isEqualTo(30);
        assertThat(buffer.indexOf(marker, 31)).isEqualTo(-1);
        assertThat(buffer.regionMatches(30, marker)).isTrue();
        assertThat(buffer.regionMatches(36, marker)).isFalse();
        assertThat(buffer.fits(32, 8)).isTrue();
        assertThat(buffer.fits(33, 8)).isFalse();
        assertThat(buffer.fits(-1, 2)).isFalse();
    }

    @Test
    void formatErrorsNameSourceAndOffset() {
        ArchiveFormatException e = new ArchiveBuffer(new byte[4], "25001002.MAP").formatError(0x48, "bad marker");

        assertThat(e).hasMessage("25001002.MAP (offset 0x48): bad marker");
    }
}
