package io.archive.vectors.source;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class NpyReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testReadsWhatWriterWrites() throws IOException {
        float[][] vectors = {{1f, 2f, 3f}, {-4f, 5.5f, 0f}};
        Path file = tempDir.resolve("batch.npy");
        NpyWriter.write(file, vectors);

        float[][] read = NpyReader.read(file);

        assertEquals(2, read.length);
        assertArrayEquals(vectors[0], read[0]);
        assertArrayEquals(vectors[1], read[1]);

        NpyReader.Header header = NpyReader.readHeader(file);
        assertEquals("<f4", header.descr());
        assertEquals(2, header.rows());
        assertEquals(3, header.columns());
    }

    @Test
    void testWriterAlignsHeader() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        NpyWriter.write(out, new float[][]{{1f}});

        // 10 byte preamble + header, padded to 64, then one float
        assertEquals(0, (out.size() - 4) % 64);
    }

    @Test
    void testReadsDoublePrecision() throws IOException {
        ByteBuffer data = ByteBuffer.allocate(16).order(ByteOrder.LITTLE_ENDIAN);
        data.putDouble(0.25).putDouble(-1.5);
        byte[] bytes = npy("{'descr': '<f8', 'fortran_order': False, 'shape': (1, 2), }", data.array());

        float[][] read = NpyReader.read(new ByteArrayInputStream(bytes), "doubles");

        assertArrayEquals(new float[]{0.25f, -1.5f}, read[0]);
    }

    @Test
    void testRejectsFortranOrder() {
        byte[] bytes = npy("{'descr': '<f4', 'fortran_order': True, 'shape': (1, 1), }", new byte[4]);

        BatchFormatException e = assertThrows(BatchFormatException.class,
            () -> NpyReader.read(new ByteArrayInputStream(bytes), "fortran"));
        assertEquals("fortran", e.getSourceName());
    }

    @Test
    void testRejectsIntegerArrays() {
        byte[] bytes = npy("{'descr': '<i8', 'fortran_order': False, 'shape': (1, 1), }", new byte[8]);

        assertThrows(BatchFormatException.class, () -> NpyReader.read(new ByteArrayInputStream(bytes), "ints"));
    }

    @Test
    void testRejectsOneDimensionalShape() {
        byte[] bytes = npy("{'descr': '<f4', 'fortran_order': False, 'shape': (3,), }", new byte[12]);

        assertThrows(BatchFormatException.class, () -> NpyReader.read(new ByteArrayInputStream(bytes), "flat"));
    }

    @Test
    void testRejectsTruncatedData() {
        byte[] bytes = npy("{'descr': '<f4', 'fortran_order': False, 'shape': (2, 2), }", new byte[8]);

        assertThrows(BatchFormatException.class, () -> NpyReader.read(new ByteArrayInputStream(bytes), "short"));
    }

    @Test
    void testRejectsBadMagic() {
        byte[] bytes = "not numpy at all".getBytes(StandardCharsets.US_ASCII);

        assertThrows(BatchFormatException.class, () -> NpyReader.read(new ByteArrayInputStream(bytes), "text"));
    }

    private static byte[] npy(String header, byte[] data) {
        byte[] headerBytes = (header + "\n").getBytes(StandardCharsets.ISO_8859_1);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(NpyReader.MAGIC);
        out.write(1);
        out.write(0);
        out.write(headerBytes.length & 0xFF);
        out.write((headerBytes.length >> 8) & 0xFF);
        out.writeBytes(headerBytes);
        out.writeBytes(data);
        return out.toByteArray();
    }
}
