package io.archive.vectors.quantize;

import io.archive.vectors.VectorMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * Lloyd's k-means with squared L2 distance.
 *
 * <p>Centroids start at distinct random sample points. Inputs larger than
 * {@code maxPointsPerCentroid * k} are subsampled before iterating, and clusters
 * that end up empty are re-seeded from a random point.</p>
 */
public final class KMeans {

    private static final Logger log = LoggerFactory.getLogger(KMeans.class);

    public static final int DEFAULT_ITERATIONS = 20;
    public static final int MAX_POINTS_PER_CENTROID = 256;

    private final int k;
    private final int iterations;
    private final long seed;

    public KMeans(int k, int iterations, long seed) {
        if (k < 1) throw new IllegalArgumentException("k must be >= 1");
        this.k = k;
        this.iterations = iterations;
        this.seed = seed;
    }

    public KMeans(int k, long seed) {
        this(k, DEFAULT_ITERATIONS, seed);
    }

    /**
     * Clusters the points and returns the centroids. When there are fewer
     * points than {@code k}, one centroid per point is returned.
     */
    public float[][] fit(float[][] points) {
        if (points.length == 0) {
            throw new IllegalArgumentException("Cannot cluster an empty point set");
        }
        Random random = new Random(seed);
        float[][] data = subsample(points, (long) k * MAX_POINTS_PER_CENTROID, random);
        int clusters = Math.min(k, data.length);
        int dims = data[0].length;

        float[][] centroids = initialCentroids(data, clusters, random);
        int[] assignment = new int[data.length];

        for (int iter = 0; iter < iterations; iter++) {
            int changed = 0;
            for (int i = 0; i < data.length; i++) {
                int nearest = nearest(centroids, data[i]);
                if (iter == 0 || nearest != assignment[i]) {
                    changed++;
                }
                assignment[i] = nearest;
            }

            float[][] sums = new float[clusters][dims];
            int[] counts = new int[clusters];
            for (int i = 0; i < data.length; i++) {
                int c = assignment[i];
                counts[c]++;
                float[] point = data[i];
                float[] sum = sums[c];
                for (int d = 0; d < dims; d++) {
                    sum[d] += point[d];
                }
            }

            for (int c = 0; c < clusters; c++) {
                if (counts[c] == 0) {
                    centroids[c] = data[random.nextInt(data.length)].clone();
                    continue;
                }
                for (int d = 0; d < dims; d++) {
                    centroids[c][d] = sums[c][d] / counts[c];
                }
            }

            if (changed == 0) {
                log.debug("k-means converged after {} iterations", iter + 1);
                break;
            }
        }
        return centroids;
    }

    /**
     * Index of the centroid closest to the point in squared L2 distance.
     */
    public static int nearest(float[][] centroids, float[] point) {
        int best = 0;
        float bestDistance = Float.MAX_VALUE;
        for (int c = 0; c < centroids.length; c++) {
            float distance = VectorMath.squaredDistance(centroids[c], point);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = c;
            }
        }
        return best;
    }

    private static float[][] initialCentroids(float[][] data, int clusters, Random random) {
        int[] picks = partialShuffle(data.length, clusters, random);
        float[][] centroids = new float[clusters][];
        for (int c = 0; c < clusters; c++) {
            centroids[c] = data[picks[c]].clone();
        }
        return centroids;
    }

    private static float[][] subsample(float[][] points, long limit, Random random) {
        if (points.length <= limit) {
            return points;
        }
        int[] picks = partialShuffle(points.length, (int) limit, random);
        float[][] sample = new float[picks.length][];
        for (int i = 0; i < picks.length; i++) {
            sample[i] = points[picks[i]];
        }
        return sample;
    }

    /**
     * First {@code count} entries of a Fisher-Yates shuffle of {@code 0..n-1}:
     * a uniform sample without replacement.
     */
    public static int[] partialShuffle(int n, int count, Random random) {
        int[] indices = new int[n];
        for (int i = 0; i < n; i++) {
            indices[i] = i;
        }
        for (int i = 0; i < count; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        int[] result = new int[count];
        System.arraycopy(indices, 0, result, 0, count);
        return result;
    }
}
