package io.archive.vectors.source;

import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes 2-D float32 arrays as NumPy {@code .npy} version 1.0 files.
 */
public final class NpyWriter {

    private static final int ALIGNMENT = 64;

    private NpyWriter() {
    }

    public static void write(Path path, float[][] vectors) throws IOException {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try (OutputStream os = Files.newOutputStream(tmp)) {
            write(os, vectors);
        }
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    public static void write(OutputStream os, float[][] vectors) throws IOException {
        int columns = vectors.length == 0 ? 0 : vectors[0].length;
        DataOutputStream out = new DataOutputStream(new BufferedOutputStream(os, 1 << 16));

        StringBuilder header = new StringBuilder(String.format(
            "{'descr': '<f4', 'fortran_order': False, 'shape': (%d, %d), }", vectors.length, columns));
        // magic(6) + version(2) + length(2) + header + '\n' must be a multiple of the alignment
        int total = NpyReader.MAGIC.length + 4 + header.length() + 1;
        header.append(" ".repeat((ALIGNMENT - total % ALIGNMENT) % ALIGNMENT)).append('\n');

        out.write(NpyReader.MAGIC);
        out.writeByte(1);
        out.writeByte(0);
        out.writeShort(Short.reverseBytes((short) header.length()));
        out.write(header.toString().getBytes(StandardCharsets.ISO_8859_1));

        ByteBuffer row = ByteBuffer.allocate(columns * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float[] vector : vectors) {
            if (vector.length != columns) {
                throw new IllegalArgumentException("Ragged array: expected " + columns + " columns, got " + vector.length);
            }
            row.clear();
            row.asFloatBuffer().put(vector);
            out.write(row.array());
        }
        out.flush();
    }
}
