package io.archive.vectors.retrieval;

import io.archive.vectors.Neighbor;
import io.archive.vectors.ScoreKind;
import io.archive.vectors.VectorMath;
import io.archive.vectors.store.ChunkRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Answers a query with ranked passages: embed, normalize, search, join metadata,
 * resolve text, score, and summarize.
 *
 * <p>Holds no per-query state and is safe to share between threads.</p>
 */
public class RetrievalEngine {

    private static final Logger log = LoggerFactory.getLogger(RetrievalEngine.class);

    private final IndexHandle handle;
    private final QueryEmbedder embedder;
    private final TextResolver textResolver;
    private final RetrievalConfig config;

    public RetrievalEngine(IndexHandle handle, QueryEmbedder embedder, TextResolver textResolver,
                           RetrievalConfig config) {
        this.handle = handle;
        this.embedder = embedder;
        this.textResolver = textResolver;
        this.config = config;
    }

    /**
     * @param topK results wanted; limited by {@link RetrievalConfig#effectiveTopK(int)}
     * @throws EmbedderUnavailableException if the query cannot be embedded
     */
    public RetrievalResult retrieve(String query, int topK) {
        if (query == null || query.isBlank()) {
            return RetrievalResult.emptyQuery(query);
        }

        float[] vector = embedder.embed(query);
        if (vector == null || vector.length != handle.dimensions()) {
            throw new EmbedderUnavailableException(String.format(
                "Embedder returned %s values, index expects %d",
                vector == null ? "no" : String.valueOf(vector.length), handle.dimensions()));
        }
        float[] normalized = VectorMath.normalizedCopy(vector);

        List<Neighbor> hits = handle.search(normalized, config.effectiveTopK(topK));
        if (hits.isEmpty()) {
            return RetrievalResult.noResults(query);
        }

        List<Long> ids = hits.stream().map(Neighbor::id).collect(Collectors.toList());
        Map<Long, ChunkRecord> records = handle.lookup(ids);

        ScoreKind kind = handle.scoreKind();
        List<Passage> passages = new ArrayList<>(hits.size());
        for (Neighbor hit : hits) {
            ChunkRecord record = records.get(hit.id());
            if (record == null) {
                log.warn("No metadata for indexed id {}; dropping result", hit.id());
                continue;
            }
            passages.add(new Passage(record, resolveText(record), hit.score(), Relevance.percent(hit.score(), kind)));
        }

        if (passages.isEmpty()) {
            return RetrievalResult.noResults(query);
        }
        return RetrievalResult.found(query, ExtractiveSummary.of(passages, config.archiveName()), passages);
    }

    public RetrievalResult retrieve(String query) {
        return retrieve(query, config.defaultTopK());
    }

    public RetrievalConfig getConfig() {
        return config;
    }

    private String resolveText(ChunkRecord record) {
        try {
            String text = textResolver.resolve(record);
            return text != null ? text : "";
        } catch (RuntimeException e) {
            log.warn("Text lookup failed for id {} ({} row {}): {}",
                record.globalId(), record.sourceFile(), record.rowOffset(), e.getMessage());
            return "";
        }
    }
}
