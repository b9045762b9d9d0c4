package io.archive.vectors.embeddings;

import io.archive.vectors.source.ChunkRow;
import io.archive.vectors.source.ChunkSource;
import io.archive.vectors.source.NpyWriter;
import io.archive.vectors.source.SourceBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Embeds chunk CSV files into the {@code .npy} arrays the index builder reads.
 *
 * <p>Files that already have an array are left alone, so an interrupted run
 * picks up where it stopped. Each array is written atomically.</p>
 */
public class ChunkEmbedder {

    private static final Logger log = LoggerFactory.getLogger(ChunkEmbedder.class);

    private final EmbeddingModel model;
    private final ChunkSource source;
    private final int batchSize;

    public ChunkEmbedder(EmbeddingModel model, ChunkSource source, int batchSize) {
        this.model = model;
        this.source = source;
        this.batchSize = Math.max(1, batchSize);
    }

    /**
     * Outcome of an embedding run.
     */
    public record Summary(int filesEmbedded, int filesSkipped, int filesFailed, long chunks) {}

    public Summary embedAll() throws IOException {
        Files.createDirectories(source.getEmbeddingsDir());
        List<Path> csvFiles = source.listMetadataFiles();
        log.info("Found {} chunk files", csvFiles.size());

        int embedded = 0;
        int skipped = 0;
        int failed = 0;
        long chunks = 0;

        for (int i = 0; i < csvFiles.size(); i++) {
            String fileName = csvFiles.get(i).getFileName().toString();
            SourceBatch batch = source.batch(fileName.substring(0, fileName.length() - ".csv".length()));

            if (Files.exists(batch.vectorsPath())) {
                skipped++;
                continue;
            }

            try {
                int count = embed(batch);
                chunks += count;
                embedded++;
                log.info("[{}/{}] {}: {} vectors (total so far: {})", i + 1, csvFiles.size(), batch.name(), count, chunks);
            } catch (IOException e) {
                log.warn("Failed to embed {}: {}", batch.name(), e.getMessage());
                failed++;
            }
        }

        log.info("Embedded {} files ({} chunks), {} already present, {} failed", embedded, chunks, skipped, failed);
        return new Summary(embedded, skipped, failed, chunks);
    }

    /**
     * Embeds one file's chunk text and writes its array.
     *
     * @return rows embedded
     */
    public int embed(SourceBatch batch) throws IOException {
        List<ChunkRow> rows = source.loadRows(batch, true);
        float[][] vectors = new float[rows.size()][];

        List<String> texts = new ArrayList<>(batchSize);
        int next = 0;
        for (ChunkRow row : rows) {
            texts.add(row.text());
            if (texts.size() == batchSize) {
                next = fill(vectors, next, texts);
            }
        }
        if (!texts.isEmpty()) {
            fill(vectors, next, texts);
        }

        NpyWriter.write(batch.vectorsPath(), vectors);
        return rows.size();
    }

    private int fill(float[][] vectors, int offset, List<String> texts) {
        List<float[]> embeddings = model.embedBatch(texts);
        for (int i = 0; i < embeddings.size(); i++) {
            vectors[offset + i] = embeddings.get(i);
        }
        int next = offset + texts.size();
        texts.clear();
        return next;
    }
}
