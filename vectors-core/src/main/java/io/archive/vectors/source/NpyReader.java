package io.archive.vectors.source;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads 2-D little-endian float arrays in NumPy {@code .npy} format
 * (versions 1.0 to 3.0, C order, {@code <f4} or {@code <f8}).
 */
public final class NpyReader {

    static final byte[] MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};

    private static final Pattern DESCR = Pattern.compile("'descr'\\s*:\\s*'([^']+)'");
    private static final Pattern FORTRAN = Pattern.compile("'fortran_order'\\s*:\\s*(True|False)");
    private static final Pattern SHAPE = Pattern.compile("'shape'\\s*:\\s*\\(([^)]*)\\)");

    private NpyReader() {
    }

    /**
     * Array header: element type and shape.
     */
    public record Header(String descr, int rows, int columns) {

        int elementSize() {
            return descr.endsWith("8") ? 8 : 4;
        }
    }

    public static float[][] read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, baseName(path));
        }
    }

    /**
     * Reads only the header, for row counts without loading the data.
     */
    public static Header readHeader(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return readHeader(new DataInputStream(new BufferedInputStream(in)), baseName(path));
        }
    }

    public static float[][] read(InputStream is, String name) throws IOException {
        DataInputStream in = new DataInputStream(new BufferedInputStream(is, 1 << 16));
        Header header = readHeader(in, name);

        int elementSize = header.elementSize();
        byte[] rowBytes = new byte[header.columns() * elementSize];
        float[][] vectors = new float[header.rows()][header.columns()];

        for (int r = 0; r < header.rows(); r++) {
            try {
                in.readFully(rowBytes);
            } catch (java.io.EOFException e) {
                throw new BatchFormatException(name, String.format(
                    "array truncated at row %d of %d", r, header.rows()), e);
            }
            ByteBuffer buffer = ByteBuffer.wrap(rowBytes).order(ByteOrder.LITTLE_ENDIAN);
            if (elementSize == 4) {
                buffer.asFloatBuffer().get(vectors[r]);
            } else {
                for (int c = 0; c < header.columns(); c++) {
                    vectors[r][c] = (float) buffer.getDouble();
                }
            }
        }
        return vectors;
    }

    private static Header readHeader(DataInputStream in, String name) throws IOException {
        byte[] magic = new byte[MAGIC.length];
        in.readFully(magic);
        if (!Arrays.equals(magic, MAGIC)) {
            throw new BatchFormatException(name, "not a .npy file: bad magic");
        }

        int major = in.readUnsignedByte();
        in.readUnsignedByte(); // minor

        int headerLength = switch (major) {
            case 1 -> Short.toUnsignedInt(Short.reverseBytes(in.readShort()));
            case 2, 3 -> Integer.reverseBytes(in.readInt());
            default -> throw new BatchFormatException(name, "unsupported .npy version " + major);
        };
        if (headerLength < 0) {
            throw new BatchFormatException(name, "corrupt .npy header length");
        }

        byte[] headerBytes = new byte[headerLength];
        in.readFully(headerBytes);
        String header = new String(headerBytes, major == 3 ? StandardCharsets.UTF_8 : StandardCharsets.ISO_8859_1);

        String descr = group(DESCR, header, name, "descr");
        if (!descr.equals("<f4") && !descr.equals("<f8")) {
            throw new BatchFormatException(name, "unsupported element type " + descr + ", expected <f4 or <f8");
        }
        if (group(FORTRAN, header, name, "fortran_order").equals("True")) {
            throw new BatchFormatException(name, "Fortran-ordered arrays are not supported");
        }

        String[] dims = Arrays.stream(group(SHAPE, header, name, "shape").split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toArray(String[]::new);
        if (dims.length != 2) {
            throw new BatchFormatException(name, "expected a 2-D array, got shape (" + String.join(", ", dims) + ")");
        }

        try {
            return new Header(descr, Math.toIntExact(Long.parseLong(dims[0])), Math.toIntExact(Long.parseLong(dims[1])));
        } catch (NumberFormatException | ArithmeticException e) {
            throw new BatchFormatException(name, "bad shape in .npy header", e);
        }
    }

    private static String group(Pattern pattern, String header, String name, String key) {
        Matcher matcher = pattern.matcher(header);
        if (!matcher.find()) {
            throw new BatchFormatException(name, "missing '" + key + "' in .npy header");
        }
        return matcher.group(1);
    }

    private static String baseName(Path path) {
        String fileName = path.getFileName().toString();
        return fileName.endsWith(".npy") ? fileName.substring(0, fileName.length() - 4) : fileName;
    }
}
