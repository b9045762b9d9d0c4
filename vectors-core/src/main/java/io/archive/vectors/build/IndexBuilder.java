package io.archive.vectors.build;

import io.archive.vectors.IncompatibleModelException;
import io.archive.vectors.IndexConfig;
import io.archive.vectors.IndexConsistencyException;
import io.archive.vectors.IndexMode;
import io.archive.vectors.VectorIndex;
import io.archive.vectors.VectorMath;
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
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds a vector index and its metadata store from a chunk source, resumably.
 *
 * <p>Each source file is ingested whole: its vectors are appended to the index,
 * which assigns the next contiguous ids, and its rows are written to the store
 * under the same ids. Every few files a checkpoint commits the store, saves the
 * index and only then appends the files to the resume log, so a killed build
 * restarts from the last checkpoint. On startup, store rows past the saved index
 * are dropped and the resume log is reconciled with the rows present.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * BuildConfig config = BuildConfig.defaults(embeddingsDir, chunksDir, Path.of("udn.index"));
 * BuildReport report = new IndexBuilder(config).build();
 * }</pre>
 */
public class IndexBuilder {

    private static final Logger log = LoggerFactory.getLogger(IndexBuilder.class);

    private final BuildConfig config;
    private final ChunkSource source;
    private final IndexArtifacts artifacts;

    public IndexBuilder(BuildConfig config) {
        this(config, new ChunkSource(config.embeddingsDir(), config.chunksDir()));
    }

    public IndexBuilder(BuildConfig config, ChunkSource source) {
        this.config = config;
        this.source = source;
        this.artifacts = config.artifacts();
    }

    /**
     * Runs or resumes the build.
     *
     * @throws io.archive.vectors.TrainingException if a compressed index has nothing to train on
     * @throws IndexConsistencyException if the store has fewer rows than the saved index has vectors
     * @throws IOException if listing sources or writing artifacts fails
     */
    public BuildReport build() throws IOException {
        Instant start = Instant.now();
        List<SourceBatch> batches = source.list();
        log.info("Found {} source files in {}", batches.size(), source.getEmbeddingsDir());

        IngestionTracker tracker = IngestionTracker.open(artifacts.resumeLog());
        try (VectorIndex index = openIndex(batches.size());
             MetadataStore store = MetadataStore.openForWriting(artifacts.database(), config.storeText())) {

            reconcile(index, store, tracker);

            if (index.mode().requiresTraining() && !index.isTrained()) {
                log.info("Phase 1: training {} index", index.mode());
                index.train(new TrainingSampler(source, config.trainingFiles(), config.trainingBudget(),
                    index.getDimensions(), config.seed()).sample(batches));
                index.save(artifacts.index());
            }

            log.info("Phase 2: adding vectors");
            return populate(batches, index, store, tracker, start);
        }
    }

    // ==================== Phases ====================

    private VectorIndex openIndex(int fileCount) throws IOException {
        IndexConfig indexConfig = config.indexConfig();
        if (artifacts.indexExists()) {
            VectorIndex index = VectorIndex.load(artifacts.index());
            if (!index.getModelId().equals(indexConfig.modelId()) || index.getDimensions() != indexConfig.dimensions()) {
                index.close();
                throw new IncompatibleModelException(
                    indexConfig.modelId() + "/" + indexConfig.dimensions(),
                    index.getModelId() + "/" + index.getDimensions());
            }
            if (config.modeOverride() != null && config.modeOverride() != index.mode()) {
                log.warn("Resuming existing {} index; ignoring requested mode {}", index.mode(), config.modeOverride());
            }
            log.info("Resuming {} index with {} vectors", index.mode(), index.size());
            return index;
        }

        IndexMode mode = ModeSelector.from(config).select(fileCount);
        log.info("Mode: {} ({} files, exact threshold {})", mode, fileCount, config.exactThreshold());
        return VectorIndex.create(mode, indexConfig);
    }

    /**
     * Brings store and resume log in line with the saved index.
     */
    void reconcile(VectorIndex index, MetadataStore store, IngestionTracker tracker) throws IOException {
        long vectors = index.size();
        long rows = store.count();

        if (rows > vectors) {
            int removed = store.truncateFrom(vectors);
            log.warn("Dropped {} metadata rows beyond the last index checkpoint ({} vectors)", removed, vectors);
        } else if (rows < vectors) {
            log.error("Metadata store has {} rows but index has {} vectors; rebuild required", rows, vectors);
            throw new IndexConsistencyException(vectors, rows);
        }

        Map<String, Long> bySource = store.rowCountsBySource();
        List<String> unlogged = bySource.keySet().stream()
            .filter(name -> !tracker.isCommitted(name))
            .collect(Collectors.toList());
        if (!unlogged.isEmpty()) {
            log.info("Marking {} checkpointed files as committed", unlogged.size());
            tracker.markCommitted(unlogged);
        }

        Set<String> dropped = tracker.retainCommitted(bySource.keySet());
        if (!dropped.isEmpty()) {
            log.warn("Resume log listed {} files with no stored rows; they will be ingested again", dropped.size());
        }
    }

    private BuildReport populate(List<SourceBatch> batches, VectorIndex index, MetadataStore store,
                                 IngestionTracker tracker, Instant start) throws IOException {
        int interval = config.checkpointInterval(index.mode());
        boolean includeText = store.storesInlineText();
        List<String> pending = new ArrayList<>();

        int processed = 0;
        int skipped = 0;
        int alreadyCommitted = 0;
        int errored = 0;
        long added = 0;

        for (int i = 0; i < batches.size(); i++) {
            SourceBatch batch = batches.get(i);

            if (tracker.isCommitted(batch.name())) {
                alreadyCommitted++;
                continue;
            }
            if (!batch.hasMetadata()) {
                log.warn("Skipping {}: no metadata file at {}", batch.name(), batch.metadataPath());
                skipped++;
                continue;
            }
            if (!tracker.tryClaim(batch.name())) {
                log.debug("Skipping {}: claimed elsewhere", batch.name());
                skipped++;
                continue;
            }

            LoadedBatch loaded;
            try {
                loaded = source.load(batch, includeText);
                if (loaded.dimensions() != index.getDimensions()) {
                    throw new BatchFormatException(batch.name(), String.format(
                        "vector dimension %d does not match index dimension %d",
                        loaded.dimensions(), index.getDimensions()));
                }
            } catch (IOException | BatchFormatException e) {
                log.warn("Rejecting {}: {}", batch.name(), e.getMessage());
                tracker.release(batch.name());
                errored++;
                continue;
            }

            long firstId = index.add(VectorMath.normalizeRows(loaded.vectors()));
            store.insertAll(toRecords(batch.name(), firstId, loaded.rows(), includeText));
            pending.add(batch.name());
            processed++;
            added += loaded.size();

            if (pending.size() >= interval) {
                checkpoint(index, store, tracker, pending);
                logProgress(i + 1, batches.size(), index.size(), start);
            }
        }

        if (!pending.isEmpty() || !artifacts.indexExists()) {
            checkpoint(index, store, tracker, pending);
        }

        BuildReport report = new BuildReport(index.mode(), batches.size(), processed, skipped, alreadyCommitted,
            errored, added, index.size(), store.count(), Duration.between(start, Instant.now()));
        log.info("Index built: {}", report.summary());
        return report;
    }

    /**
     * Store first, then index, then log: a crash between steps leaves at most
     * extra store rows, which the next run truncates.
     */
    private void checkpoint(VectorIndex index, MetadataStore store, IngestionTracker tracker,
                            List<String> pending) throws IOException {
        store.commit();
        index.save(artifacts.index());
        tracker.markCommitted(pending);
        log.debug("Checkpoint: {} files committed, {} vectors", pending.size(), index.size());
        pending.clear();
    }

    private static List<ChunkRecord> toRecords(String sourceName, long firstId, List<ChunkRow> rows,
                                               boolean includeText) {
        List<ChunkRecord> records = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            ChunkRow row = rows.get(i);
            records.add(new ChunkRecord(firstId + i, row.articleId(), row.articleTitle(), row.date(),
                row.paper(), sourceName, i, includeText ? row.text() : null));
        }
        return records;
    }

    private static void logProgress(int done, int total, long vectors, Instant start) {
        double minutes = Duration.between(start, Instant.now()).toMillis() / 60_000.0;
        double rate = minutes > 0 ? vectors / minutes : 0;
        double eta = done > 0 ? (minutes / done) * (total - done) : 0;
        log.info("[{}/{}] {} docs | {} /min | ETA: {} min",
            done, total, String.format("%,d", vectors), String.format("%,.0f", rate), String.format("%.0f", eta));
    }
}
