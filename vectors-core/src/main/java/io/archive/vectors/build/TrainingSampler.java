package io.archive.vectors.build;

import io.archive.vectors.VectorMath;
import io.archive.vectors.quantize.KMeans;
import io.archive.vectors.source.BatchFormatException;
import io.archive.vectors.source.ChunkSource;
import io.archive.vectors.source.SourceBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Draws the training sample for a compressed index from the head of the corpus.
 *
 * <p>Vectors are read file by file from at most {@code maxFiles} files that have
 * metadata, stopping once the budget is reached. A larger pool is reduced to the
 * budget by uniform sampling without replacement. The result is normalized.</p>
 */
public class TrainingSampler {

    private static final Logger log = LoggerFactory.getLogger(TrainingSampler.class);

    private final ChunkSource source;
    private final int maxFiles;
    private final int budget;
    private final int dimensions;
    private final long seed;

    public TrainingSampler(ChunkSource source, int maxFiles, int budget, int dimensions, long seed) {
        this.source = source;
        this.maxFiles = maxFiles;
        this.budget = budget;
        this.dimensions = dimensions;
        this.seed = seed;
    }

    public float[][] sample(List<SourceBatch> batches) {
        List<float[]> pool = new ArrayList<>();
        int filesRead = 0;

        for (SourceBatch batch : batches.subList(0, Math.min(maxFiles, batches.size()))) {
            if (!batch.hasMetadata()) {
                continue;
            }
            float[][] vectors;
            try {
                vectors = source.loadVectors(batch);
            } catch (IOException | BatchFormatException e) {
                log.warn("Skipping {} for training: {}", batch.name(), e.getMessage());
                continue;
            }
            if (vectors.length > 0 && vectors[0].length != dimensions) {
                log.warn("Skipping {} for training: dimension {} != {}", batch.name(), vectors[0].length, dimensions);
                continue;
            }
            pool.addAll(List.of(vectors));
            filesRead++;
            if (pool.size() >= budget) {
                break;
            }
        }

        float[][] sample;
        if (pool.size() > budget) {
            int[] picks = KMeans.partialShuffle(pool.size(), budget, new Random(seed));
            sample = new float[budget][];
            for (int i = 0; i < budget; i++) {
                sample[i] = pool.get(picks[i]);
            }
        } else {
            sample = pool.toArray(new float[0][]);
        }

        log.info("Training sample: {} vectors from {} files", sample.length, filesRead);
        return VectorMath.normalizeRows(sample);
    }
}
