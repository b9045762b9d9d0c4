package io.archive.vectors.retrieval;

import io.archive.vectors.IndexConsistencyException;
import io.archive.vectors.IndexMode;
import io.archive.vectors.IvfPqVectorIndex;
import io.archive.vectors.Neighbor;
import io.archive.vectors.ScoreKind;
import io.archive.vectors.VectorIndex;
import io.archive.vectors.build.IndexArtifacts;
import io.archive.vectors.store.ChunkRecord;
import io.archive.vectors.store.MetadataStore;
import io.archive.vectors.store.MetadataStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * A loaded vector index paired with its metadata store, validated as consistent.
 * Search breadth is fixed when the handle is opened.
 */
public class IndexHandle implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(IndexHandle.class);

    private final VectorIndex index;
    private final MetadataStore store;

    private IndexHandle(VectorIndex index, MetadataStore store) {
        this.index = index;
        this.store = store;
    }

    /**
     * Loads persisted artifacts read-only.
     *
     * @throws IOException if the index file is missing or unreadable
     * @throws MetadataStoreException if the database is missing
     * @throws IndexConsistencyException if the store has fewer rows than the index has vectors
     */
    public static IndexHandle open(IndexArtifacts artifacts, int nprobe) throws IOException {
        if (!artifacts.indexExists()) {
            throw new IOException("Index file not found: " + artifacts.index());
        }
        VectorIndex index = VectorIndex.load(artifacts.index());
        if (!artifacts.databaseExists()) {
            index.close();
            throw new MetadataStoreException("Metadata store " + artifacts.database()
                + " not found for index " + artifacts.index());
        }
        MetadataStore store = null;
        try {
            store = MetadataStore.openReadOnly(artifacts.database());
            return of(index, store, nprobe);
        } catch (RuntimeException e) {
            index.close();
            if (store != null) {
                store.close();
            }
            throw e;
        }
    }

    /**
     * Wraps an index and store already in memory.
     */
    public static IndexHandle of(VectorIndex index, MetadataStore store, int nprobe) {
        long vectors = index.size();
        long rows = store.count();
        if (rows < vectors) {
            log.error("Index has {} vectors but metadata store only {} rows", vectors, rows);
            throw new IndexConsistencyException(vectors, rows);
        }
        if (rows > vectors) {
            log.warn("Metadata store has {} rows beyond the {} indexed vectors; they will never be returned",
                rows - vectors, vectors);
        }
        if (index instanceof IvfPqVectorIndex ivf) {
            ivf.setNprobe(nprobe);
        }
        log.info("Index ready: {} mode, {} vectors, model {}", index.mode(), vectors, index.getModelId());
        return new IndexHandle(index, store);
    }

    public List<Neighbor> search(float[] query, int k) {
        return index.search(query, k);
    }

    public Map<Long, ChunkRecord> lookup(Collection<Long> ids) {
        return store.findAll(ids);
    }

    public ScoreKind scoreKind() {
        return index.scoreKind();
    }

    public IndexMode mode() {
        return index.mode();
    }

    public long size() {
        return index.size();
    }

    public int dimensions() {
        return index.getDimensions();
    }

    public String modelId() {
        return index.getModelId();
    }

    public boolean storesInlineText() {
        return store.storesInlineText();
    }

    @Override
    public void close() {
        index.close();
        store.close();
    }
}
