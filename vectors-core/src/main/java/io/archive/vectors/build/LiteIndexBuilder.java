package io.archive.vectors.build;

import io.archive.vectors.IndexMode;
import io.archive.vectors.VectorIndex;
import io.archive.vectors.VectorMath;
import io.archive.vectors.quantize.KMeans;
import io.archive.vectors.source.BatchFormatException;
import io.archive.vectors.source.ChunkRow;
import io.archive.vectors.source.ChunkSource;
import io.archive.vectors.source.LoadedBatch;
import io.archive.vectors.source.SourceBatch;
import io.archive.vectors.store.ChunkRecord;
import io.archive.vectors.store.MetadataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Builds a small exact index over a random sample of the corpus, with chunk text
 * stored in the metadata database so the result needs no chunk files at query time.
 *
 * <p>Files are picked at an even stride across the sorted corpus and a fixed number
 * of rows is drawn from each. Existing artifacts are replaced.</p>
 */
public class LiteIndexBuilder {

    private static final Logger log = LoggerFactory.getLogger(LiteIndexBuilder.class);

    private final LiteConfig config;
    private final ChunkSource source;

    public LiteIndexBuilder(LiteConfig config) {
        this.config = config;
        this.source = new ChunkSource(config.embeddingsDir(), config.chunksDir());
    }

    /**
     * @throws IllegalStateException if no file could be sampled
     */
    public BuildReport build() throws IOException {
        Instant start = Instant.now();
        IndexArtifacts artifacts = config.artifacts();
        artifacts.deleteAll();

        List<SourceBatch> all = source.list();
        List<SourceBatch> selected = select(all, config.sampleFiles());
        if (selected.isEmpty()) {
            throw new IllegalStateException("No source files found in " + config.embeddingsDir());
        }
        int docsPerFile = Math.max(1, config.targetDocs() / selected.size());
        log.info("Found {} total files, sampling {} files, ~{} docs per file", all.size(), selected.size(), docsPerFile);

        Random random = new Random(config.seed());
        int processed = 0;
        int skipped = 0;
        int errored = 0;

        try (VectorIndex index = VectorIndex.create(IndexMode.EXACT, config.indexConfig());
             MetadataStore store = MetadataStore.openForWriting(artifacts.database(), true)) {

            for (int f = 0; f < selected.size(); f++) {
                SourceBatch batch = selected.get(f);
                if (!batch.hasMetadata()) {
                    log.warn("Skip {}: no CSV", batch.name());
                    skipped++;
                    continue;
                }

                LoadedBatch loaded;
                try {
                    loaded = source.load(batch, true);
                    if (loaded.dimensions() != index.getDimensions()) {
                        throw new BatchFormatException(batch.name(), "dimension " + loaded.dimensions()
                            + " does not match " + index.getDimensions());
                    }
                } catch (IOException | BatchFormatException e) {
                    log.warn("Skip {}: {}", batch.name(), e.getMessage());
                    errored++;
                    continue;
                }

                int n = Math.min(docsPerFile, loaded.size());
                int[] rows = KMeans.partialShuffle(loaded.size(), n, random);
                Arrays.sort(rows);

                float[][] vectors = new float[n][];
                for (int i = 0; i < n; i++) {
                    vectors[i] = loaded.vectors()[rows[i]];
                }
                long firstId = index.add(VectorMath.normalizeRows(vectors));

                List<ChunkRecord> records = new ArrayList<>(n);
                for (int i = 0; i < n; i++) {
                    ChunkRow row = loaded.rows().get(rows[i]);
                    records.add(new ChunkRecord(firstId + i, row.articleId(), row.articleTitle(), row.date(),
                        row.paper(), batch.name(), rows[i], truncate(row.text())));
                }
                store.insertAll(records);
                store.commit();
                processed++;
                log.info("  [{}/{}] {}: {} docs sampled", f + 1, selected.size(), batch.name(), n);
            }

            if (index.isEmpty()) {
                throw new IllegalStateException("No embeddings loaded from " + config.embeddingsDir());
            }
            index.save(artifacts.index());

            BuildReport report = new BuildReport(IndexMode.EXACT, all.size(), processed, skipped, 0, errored,
                index.size(), index.size(), store.count(), Duration.between(start, Instant.now()));
            log.info("Lite index built: {}", report.summary());
            return report;
        }
    }

    /**
     * Every {@code max(1, total / count)}-th file, at most {@code count} of them.
     */
    static List<SourceBatch> select(List<SourceBatch> all, int count) {
        int step = Math.max(1, all.size() / Math.max(1, count));
        List<SourceBatch> selected = new ArrayList<>();
        for (int i = 0; i < all.size() && selected.size() < count; i += step) {
            selected.add(all.get(i));
        }
        return selected;
    }

    private String truncate(String text) {
        return text.length() > config.maxTextLength() ? text.substring(0, config.maxTextLength()) : text;
    }
}
