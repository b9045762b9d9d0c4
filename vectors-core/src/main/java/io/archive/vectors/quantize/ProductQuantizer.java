package io.archive.vectors.quantize;

import io.archive.vectors.VectorMath;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

/**
 * Product quantizer: splits a vector into {@code m} sub-vectors and encodes each
 * one as the index of its nearest sub-centroid, one byte per sub-vector.
 */
public final class ProductQuantizer {

    public static final int MAX_CENTROIDS = 256;

    private final int dimensions;
    private final int m;
    private final int subDimensions;
    private final int centroids;
    private final float[][][] codebooks;

    private ProductQuantizer(int dimensions, int m, int centroids, float[][][] codebooks) {
        this.dimensions = dimensions;
        this.m = m;
        this.subDimensions = dimensions / m;
        this.centroids = centroids;
        this.codebooks = codebooks;
    }

    /**
     * Trains one codebook per sub-space.
     *
     * @param vectors          training vectors (typically IVF residuals)
     * @param requestedM       desired sub-quantizer count; the largest divisor of the
     *                         dimensions not above it is used
     * @param seed             k-means seed
     */
    public static ProductQuantizer train(float[][] vectors, int requestedM, long seed) {
        int dimensions = vectors[0].length;
        int m = largestDivisorAtMost(dimensions, requestedM);
        int subDimensions = dimensions / m;
        int centroids = Math.min(MAX_CENTROIDS, vectors.length);

        float[][][] codebooks = new float[m][][];
        for (int sub = 0; sub < m; sub++) {
            float[][] slices = new float[vectors.length][subDimensions];
            for (int i = 0; i < vectors.length; i++) {
                System.arraycopy(vectors[i], sub * subDimensions, slices[i], 0, subDimensions);
            }
            float[][] learned = new KMeans(centroids, seed + sub).fit(slices);
            codebooks[sub] = pad(learned, centroids, subDimensions);
        }
        return new ProductQuantizer(dimensions, m, centroids, codebooks);
    }

    /**
     * Encodes a vector into {@code m} unsigned bytes.
     */
    public byte[] encode(float[] vector) {
        byte[] code = new byte[m];
        float[] slice = new float[subDimensions];
        for (int sub = 0; sub < m; sub++) {
            System.arraycopy(vector, sub * subDimensions, slice, 0, subDimensions);
            code[sub] = (byte) KMeans.nearest(codebooks[sub], slice);
        }
        return code;
    }

    /**
     * Inner products between each query sub-vector and every sub-centroid.
     * Summing {@code table[sub][code[sub]]} over all sub-spaces gives the inner
     * product of the query with the decoded vector.
     */
    public float[][] innerProductTable(float[] query) {
        float[][] table = new float[m][centroids];
        for (int sub = 0; sub < m; sub++) {
            int offset = sub * subDimensions;
            for (int c = 0; c < centroids; c++) {
                table[sub][c] = VectorMath.dot(query, offset, codebooks[sub][c], 0, subDimensions);
            }
        }
        return table;
    }

    /**
     * Scores the code at {@code offset} of a packed code array against a table.
     */
    public float score(float[][] table, byte[] codes, int offset) {
        float sum = 0;
        for (int sub = 0; sub < m; sub++) {
            sum += table[sub][codes[offset + sub] & 0xFF];
        }
        return sum;
    }

    public float[] decode(byte[] code) {
        float[] vector = new float[dimensions];
        for (int sub = 0; sub < m; sub++) {
            System.arraycopy(codebooks[sub][code[sub] & 0xFF], 0, vector, sub * subDimensions, subDimensions);
        }
        return vector;
    }

    public int codeSize() {
        return m;
    }

    public int centroids() {
        return centroids;
    }

    // ==================== Persistence ====================

    public void writeTo(DataOutputStream dos) throws IOException {
        dos.writeInt(dimensions);
        dos.writeInt(m);
        dos.writeInt(centroids);
        for (float[][] codebook : codebooks) {
            for (float[] centroid : codebook) {
                for (float v : centroid) {
                    dos.writeFloat(v);
                }
            }
        }
    }

    public static ProductQuantizer readFrom(DataInputStream dis) throws IOException {
        int dimensions = dis.readInt();
        int m = dis.readInt();
        int centroids = dis.readInt();
        int subDimensions = dimensions / m;
        float[][][] codebooks = new float[m][centroids][subDimensions];
        for (int sub = 0; sub < m; sub++) {
            for (int c = 0; c < centroids; c++) {
                for (int d = 0; d < subDimensions; d++) {
                    codebooks[sub][c][d] = dis.readFloat();
                }
            }
        }
        return new ProductQuantizer(dimensions, m, centroids, codebooks);
    }

    static int largestDivisorAtMost(int n, int limit) {
        for (int d = Math.min(n, Math.max(1, limit)); d > 1; d--) {
            if (n % d == 0) {
                return d;
            }
        }
        return 1;
    }

    // k-means returns fewer centroids than asked for tiny samples
    private static float[][] pad(float[][] learned, int centroids, int subDimensions) {
        if (learned.length == centroids) {
            return learned;
        }
        float[][] padded = new float[centroids][subDimensions];
        for (int c = 0; c < centroids; c++) {
            padded[c] = learned[c % learned.length].clone();
        }
        return padded;
    }
}
