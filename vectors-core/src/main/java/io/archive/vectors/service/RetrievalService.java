package io.archive.vectors.service;

import io.archive.vectors.IncompatibleModelException;
import io.archive.vectors.build.IndexArtifacts;
import io.archive.vectors.retrieval.EmbedderUnavailableException;
import io.archive.vectors.retrieval.IndexHandle;
import io.archive.vectors.retrieval.InlineTextResolver;
import io.archive.vectors.retrieval.Passage;
import io.archive.vectors.retrieval.QueryEmbedder;
import io.archive.vectors.retrieval.Relevance;
import io.archive.vectors.retrieval.RetrievalConfig;
import io.archive.vectors.retrieval.RetrievalEngine;
import io.archive.vectors.retrieval.RetrievalResult;
import io.archive.vectors.retrieval.SourceFileTextResolver;
import io.archive.vectors.retrieval.SourceFormatter;
import io.archive.vectors.retrieval.TextResolver;
import io.archive.vectors.retrieval.TimeLimitedEmbedder;
import io.archive.vectors.source.ChunkSource;
import io.archive.vectors.store.ChunkRecord;
import io.archive.vectors.store.MetadataStoreException;
import io.archive.vectors.synthesis.AnswerSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The query service: built once at startup, then shared by every request handler.
 *
 * <p>Loading failures (missing or corrupt index, missing database, index and
 * database out of step) do not escape {@link #open}; the service starts in
 * {@link ServiceStatus#NOT_INITIALIZED} and answers each request with that status.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * try (RetrievalService service = RetrievalService.open(
 *         IndexArtifacts.forBase(Path.of("data/udn.index")), chunkSource, embedder,
 *         AnswerSynthesizer.disabled(), RetrievalConfig.defaults())) {
 *     QueryResponse response = service.ask(QueryRequest.of("mining accidents in Park City"));
 * }
 * }</pre>
 */
public class RetrievalService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    private final IndexHandle handle;
    private final RetrievalEngine engine;
    private final AnswerSynthesizer synthesizer;
    private final SourceFormatter formatter;
    private final AutoCloseable embedderResource;
    private final String failureReason;

    private RetrievalService(IndexHandle handle, RetrievalEngine engine, AnswerSynthesizer synthesizer,
                             RetrievalConfig config, AutoCloseable embedderResource, String failureReason) {
        this.handle = handle;
        this.engine = engine;
        this.synthesizer = synthesizer;
        this.formatter = SourceFormatter.from(config);
        this.embedderResource = embedderResource;
        this.failureReason = failureReason;
    }

    /**
     * Wires a service around an already open handle.
     */
    public RetrievalService(IndexHandle handle, QueryEmbedder embedder, TextResolver textResolver,
                            AnswerSynthesizer synthesizer, RetrievalConfig config) {
        this(handle, new RetrievalEngine(handle, embedder, textResolver, config), synthesizer, config, null, null);
    }

    /**
     * Loads and validates persisted artifacts.
     *
     * @param chunkSource where text is looked up when the store has none inline; may be null for lite indexes
     */
    public static RetrievalService open(IndexArtifacts artifacts, ChunkSource chunkSource, QueryEmbedder embedder,
                                        AnswerSynthesizer synthesizer, RetrievalConfig config) {
        IndexHandle handle;
        try {
            handle = IndexHandle.open(artifacts, config.nprobe());
        } catch (IOException | RuntimeException e) {
            log.error("Failed to load index {}: {}", artifacts.index(), e.getMessage());
            return notInitialized(e.getMessage(), synthesizer, config);
        }

        TextResolver resolver;
        if (handle.storesInlineText()) {
            resolver = new InlineTextResolver();
        } else if (chunkSource != null) {
            resolver = new SourceFileTextResolver(chunkSource);
        } else {
            log.warn("Index {} keeps no inline text and no chunk directory is configured; passages will have no text",
                artifacts.index());
            resolver = record -> "";
        }

        TimeLimitedEmbedder limited = new TimeLimitedEmbedder(embedder, config.embedTimeout());
        RetrievalEngine engine = new RetrievalEngine(handle, limited, resolver, config);
        log.info("Retrieval service ready with {} documents", handle.size());
        return new RetrievalService(handle, engine, synthesizer, config, limited, null);
    }

    /**
     * Checks that the embedder produces vectors for the index's model.
     *
     * @throws IncompatibleModelException if the model ids differ
     */
    public void requireModel(String embedderModelId) {
        if (handle != null && !handle.modelId().equals(embedderModelId)) {
            throw new IncompatibleModelException(handle.modelId(), embedderModelId);
        }
    }

    public QueryResponse ask(QueryRequest request) {
        if (failureReason != null) {
            return QueryResponse.notInitialized(failureReason);
        }

        RetrievalResult result;
        try {
            result = engine.retrieve(request.query(), request.topK());
        } catch (EmbedderUnavailableException e) {
            log.error("Query embedding unavailable: {}", e.getMessage());
            return QueryResponse.unavailable(e.getMessage());
        } catch (MetadataStoreException e) {
            log.error("Metadata store unavailable: {}", e.getMessage(), e);
            return QueryResponse.unavailable(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Query failed: {}", e.getMessage(), e);
            return QueryResponse.unavailable("query failed");
        }

        if (request.useSynthesizer()) {
            result = synthesizer.apply(result);
        }

        List<SourceView> sources = result.passages().stream()
            .map(this::toView)
            .collect(Collectors.toList());
        return new QueryResponse(ServiceStatus.OK, result.answer(), sources, result.synthesized());
    }

    public ServiceStats stats() {
        if (failureReason != null) {
            return new ServiceStats(ServiceStatus.NOT_INITIALIZED, 0, null, null,
                synthesizer.backendName(), synthesizer.isAvailable());
        }
        return new ServiceStats(ServiceStatus.OK, handle.size(), handle.modelId(), handle.mode(),
            synthesizer.backendName(), synthesizer.isAvailable());
    }

    public ServiceStatus status() {
        return failureReason != null ? ServiceStatus.NOT_INITIALIZED : ServiceStatus.OK;
    }

    public boolean isReady() {
        return failureReason == null;
    }

    @Override
    public void close() {
        synthesizer.close();
        if (embedderResource != null) {
            try {
                embedderResource.close();
            } catch (Exception e) {
                log.warn("Failed to release embedder: {}", e.getMessage());
            }
        }
        if (handle != null) {
            handle.close();
        }
    }

    // ==================== Helper Methods ====================

    private static RetrievalService notInitialized(String reason, AnswerSynthesizer synthesizer,
                                                   RetrievalConfig config) {
        return new RetrievalService(null, null, synthesizer, config, null,
            reason != null ? reason : "unknown error");
    }

    private SourceView toView(Passage passage) {
        ChunkRecord record = passage.record();
        return new SourceView(
            formatter.title(record.articleTitle()),
            formatter.snippet(passage.text()),
            SourceFormatter.date(record.date()),
            formatter.paper(record.paper()),
            record.articleId(),
            formatter.link(record.articleId()),
            Relevance.format(passage.relevance())
        );
    }
}
